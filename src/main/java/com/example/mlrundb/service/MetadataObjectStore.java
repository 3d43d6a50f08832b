package com.example.mlrundb.service;

import com.example.mlrundb.codec.DocumentCodec;
import com.example.mlrundb.encode.AttributeEncoder;
import com.example.mlrundb.encode.AttributeNames;
import com.example.mlrundb.encode.AttributeSource;
import com.example.mlrundb.encode.EnvelopeReader;
import com.example.mlrundb.error.BatchDeleteException;
import com.example.mlrundb.error.FormatException;
import com.example.mlrundb.error.MetadataDbException;
import com.example.mlrundb.error.NotFoundException;
import com.example.mlrundb.listing.ListingEngine;
import com.example.mlrundb.store.StoreClient;
import com.example.mlrundb.store.StoreCursor;
import com.example.mlrundb.store.StoreItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Store, read, list and bulk-delete operations shared by runs and artifacts. Each stored
 * item holds the document verbatim plus the attributes derived from its envelope.
 */
@Component
public class MetadataObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(MetadataObjectStore.class);

    private final StoreClient store;
    private final DocumentCodec codec;
    private final EnvelopeReader envelopes;
    private final AttributeEncoder encoder;
    private final ListingEngine listing;

    public MetadataObjectStore(StoreClient store, DocumentCodec codec, EnvelopeReader envelopes,
                               AttributeEncoder encoder, ListingEngine listing) {
        this.store = store;
        this.codec = codec;
        this.envelopes = envelopes;
        this.encoder = encoder;
        this.listing = listing;
    }

    /**
     * Replaces the item at {@code path}. {@code extraAttributes} are written first, so
     * envelope attributes of the same name take precedence.
     */
    public void storeObject(String path, byte[] document, Class<? extends AttributeSource> envelopeType,
                            Map<String, Object> extraAttributes) {
        if (document == null || document.length == 0) {
            throw new FormatException("Document body is empty");
        }
        Map<String, Object> attributes = new LinkedHashMap<>(extraAttributes);
        encoder.flattenInto(envelopes.read(codec.readTree(document), envelopeType), attributes);
        attributes.put(AttributeNames.DATA, document);
        store.put(path, attributes);
        logger.info("Stored {} ({} attributes)", path, attributes.size());
    }

    public byte[] readObject(String path) {
        StoreItem item = store.get(path, List.of(AttributeNames.DATA));
        return item.getData().orElseThrow(() -> new FormatException("Item " + path + " holds no document"));
    }

    /** {@code {"data": doc}} for the document at {@code path}. */
    public byte[] readWrapped(String path) {
        return listing.wrapData(readObject(path));
    }

    public byte[] list(String directory, String filter, boolean sort, int limit, String collection) {
        List<byte[]> documents;
        try {
            StoreCursor cursor = store.query(directory,
                    List.of(AttributeNames.ITEM_NAME, AttributeNames.DATA, AttributeNames.RUN_LAST_UPDATE_EPOCH), filter);
            documents = listing.list(cursor, sort, limit);
        } catch (NotFoundException e) {
            logger.debug("{} does not exist, returning empty {}", directory, collection);
            documents = List.of();
        }
        return listing.render(collection, documents);
    }

    /**
     * Deletes every item under {@code directory} matching {@code filter}. Items are
     * deleted one by one; failures do not stop the pass and are reported together at
     * the end.
     *
     * @return number of deleted items
     * @throws BatchDeleteException when at least one item could not be deleted
     */
    public int deleteMatching(String directory, String filter) {
        List<StoreItem> items;
        try {
            items = store.query(directory, List.of(AttributeNames.ITEM_NAME), filter).all();
        } catch (NotFoundException e) {
            logger.debug("{} does not exist, nothing to delete", directory);
            return 0;
        }
        Map<String, MetadataDbException> failures = new LinkedHashMap<>();
        int deleted = 0;
        for (StoreItem item : items) {
            String name = item.getName().orElse(null);
            if (name == null) {
                continue;
            }
            String path = directory + name;
            logger.debug("Deleting {}", path);
            try {
                store.delete(path);
                deleted++;
            } catch (NotFoundException e) {
                logger.debug("{} already gone", path);
            } catch (MetadataDbException e) {
                logger.warn("Failed to delete {}: {}", path, e.getMessage());
                failures.put(path, e);
            }
        }
        if (!failures.isEmpty()) {
            throw new BatchDeleteException(failures, deleted);
        }
        logger.info("Deleted {} item(s) under {}", deleted, directory);
        return deleted;
    }

    public void delete(String path) {
        store.delete(path);
        logger.info("Deleted {}", path);
    }
}
