package com.example.mlrundb.store;

import com.example.mlrundb.error.BackendException;
import com.example.mlrundb.error.NotFoundException;

import java.util.List;
import java.util.Map;

/**
 * Document store addressed by hierarchical paths. Every item has a name (its last path
 * segment, exposed as {@code __name}) and a set of scalar attributes.
 *
 * <p>Failures surface as {@link NotFoundException} for missing paths and
 * {@link BackendException} for everything else; nothing is retried.
 */
public interface StoreClient {

    /** Writes the item at {@code path}, replacing all of its previous attributes. */
    void put(String path, Map<String, Object> attributes);

    /** Reads the named attributes of one item; an empty list reads all of them. */
    StoreItem get(String path, List<String> attributeNames);

    /** Upserts the given attributes, leaving the item's other attributes untouched. */
    void update(String path, Map<String, Object> attributes);

    void delete(String path);

    /**
     * Items directly under {@code pathPrefix} that match {@code filter}
     * (see {@link com.example.mlrundb.filter.FilterExpressionBuilder}).
     *
     * @throws NotFoundException when nothing was ever stored under the prefix
     */
    StoreCursor query(String pathPrefix, List<String> attributeNames, String filter);
}
