package com.example.mlrundb.store;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** Items matched by a {@link StoreClient#query}. Close it when not drained. */
public interface StoreCursor extends Iterator<StoreItem>, AutoCloseable {

    /** Drains the remaining items and closes the cursor. */
    default List<StoreItem> all() {
        try (StoreCursor cursor = this) {
            List<StoreItem> items = new ArrayList<>();
            cursor.forEachRemaining(items::add);
            return items;
        }
    }

    @Override
    void close();

    static StoreCursor of(List<StoreItem> items) {
        Iterator<StoreItem> it = items.iterator();
        return new StoreCursor() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public StoreItem next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }
}
