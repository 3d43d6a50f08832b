package com.example.mlrundb.store;

import com.example.mlrundb.encode.AttributeNames;
import com.example.mlrundb.error.BackendException;
import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.filter.FilterExpression;
import com.example.mlrundb.filter.FilterPredicate;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link StoreClient} over a single MongoDB collection. The item path is the document
 * id; {@code __name} and {@code __dir} hold its last segment and parent directory so
 * that directory queries and name filters are plain field matches.
 */
@Component
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    static final String ID = "_id";
    static final String DIRECTORY = "__dir";

    private final MongoTemplate mongo;
    private final String collection;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo, @Value("${app.store.collection:mlrun_items}") String collection) {
        this.mongo = mongo;
        this.collection = collection;
    }

    @Override
    public void put(String path, Map<String, Object> attributes) {
        Document doc = new Document(ID, path);
        attributes.forEach(doc::append);
        doc.put(AttributeNames.ITEM_NAME, StorePaths.name(path));
        doc.put(DIRECTORY, StorePaths.directory(path));
        try {
            mongo.save(doc, collection);
        } catch (DataAccessException e) {
            throw translate("put " + path, e);
        }
    }

    @Override
    public StoreItem get(String path, List<String> attributeNames) {
        Query q = Query.query(Criteria.where(ID).is(path));
        project(q, attributeNames);
        Document doc;
        try {
            doc = mongo.findOne(q, Document.class, collection);
        } catch (DataAccessException e) {
            throw translate("get " + path, e);
        }
        if (doc == null) {
            throw new NotFoundException(path);
        }
        return toItem(doc);
    }

    @Override
    public void update(String path, Map<String, Object> attributes) {
        Update update = new Update();
        attributes.forEach(update::set);
        update.set(AttributeNames.ITEM_NAME, StorePaths.name(path));
        update.set(DIRECTORY, StorePaths.directory(path));
        try {
            mongo.upsert(Query.query(Criteria.where(ID).is(path)), update, collection);
        } catch (DataAccessException e) {
            throw translate("update " + path, e);
        }
    }

    @Override
    public void delete(String path) {
        DeleteResult result;
        try {
            result = mongo.remove(Query.query(Criteria.where(ID).is(path)), collection);
        } catch (DataAccessException e) {
            throw translate("delete " + path, e);
        }
        if (result.getDeletedCount() == 0) {
            throw new NotFoundException(path);
        }
    }

    @Override
    public StoreCursor query(String pathPrefix, List<String> attributeNames, String filter) {
        String directory = StorePaths.asDirectory(pathPrefix);
        FilterExpression expression = FilterExpression.parse(filter);
        List<Criteria> criteria = new ArrayList<>();
        criteria.add(Criteria.where(DIRECTORY).is(directory));
        for (FilterPredicate predicate : expression.getPredicates()) {
            criteria.add(toCriteria(predicate));
        }
        Query q = new Query(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        project(q, attributeNames);
        try {
            if (!mongo.exists(Query.query(Criteria.where(DIRECTORY).is(directory)), collection)) {
                throw new NotFoundException(directory);
            }
            logger.debug("Querying {} with {}", directory, q);
            Stream<Document> stream = mongo.stream(q, Document.class, collection);
            return new DocumentCursor(stream);
        } catch (DataAccessException e) {
            throw translate("query " + directory, e);
        }
    }

    static Criteria toCriteria(FilterPredicate predicate) {
        Criteria c = Criteria.where(predicate.getAttribute());
        Object value = predicate.getValue();
        switch (predicate.getOperator()) {
            case EQ:
                return c.is(value);
            case NE:
                return c.ne(value);
            case GT:
                return c.gt(value);
            case GE:
                return c.gte(value);
            case LT:
                return c.lt(value);
            case LE:
                return c.lte(value);
            case CONTAINS:
                return c.regex(Pattern.quote((String) value));
            case STARTS:
                return c.regex("^" + Pattern.quote((String) value));
            case ENDS:
                return c.regex(Pattern.quote((String) value) + "$");
            case EXISTS:
                return c.exists(true);
            default:
                throw new IllegalArgumentException("Unsupported operator " + predicate.getOperator());
        }
    }

    private static void project(Query q, List<String> attributeNames) {
        if (attributeNames != null && !attributeNames.isEmpty()) {
            attributeNames.forEach(q.fields()::include);
            q.fields().include(AttributeNames.ITEM_NAME);
        }
    }

    static StoreItem toItem(Document doc) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        doc.forEach((k, v) -> {
            if (!ID.equals(k) && !DIRECTORY.equals(k)) {
                attributes.put(k, v instanceof Binary binary ? binary.getData() : v);
            }
        });
        return new StoreItem(attributes);
    }

    private static BackendException translate(String operation, DataAccessException e) {
        int status = e instanceof DataAccessResourceFailureException || e instanceof QueryTimeoutException ? 503 : 500;
        logger.error("Mongo {} failed", operation, e);
        return new BackendException(status, "Backend " + operation + " failed: " + e.getMessage(), e);
    }

    private static final class DocumentCursor implements StoreCursor {

        private final Stream<Document> stream;
        private final Iterator<Document> iterator;

        DocumentCursor(Stream<Document> stream) {
            this.stream = stream;
            this.iterator = stream.iterator();
        }

        @Override
        public boolean hasNext() {
            try {
                return iterator.hasNext();
            } catch (DataAccessException e) {
                throw translate("cursor read", e);
            }
        }

        @Override
        public StoreItem next() {
            try {
                return toItem(iterator.next());
            } catch (DataAccessException e) {
                throw translate("cursor read", e);
            }
        }

        @Override
        public void close() {
            stream.close();
        }
    }
}
