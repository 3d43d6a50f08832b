package com.example.mlrundb.listing;

import com.example.mlrundb.encode.AttributeNames;
import com.example.mlrundb.store.StoreCursor;
import com.example.mlrundb.store.StoreItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Turns a query cursor into the list of stored documents a listing returns.
 *
 * <p>Items are ordered most recently updated first whenever sorting or a limit is
 * requested. An item without a last-update epoch gets a synthetic key from a counter in
 * arrival order and ranks after every item that has one.
 */
@Component
public class ListingEngine {

    private static final Logger logger = LoggerFactory.getLogger(ListingEngine.class);

    private static final Comparator<Entry> MOST_RECENT_FIRST = Comparator
            .comparing((Entry e) -> e.dated).reversed()
            .thenComparing(Comparator.comparingLong((Entry e) -> e.key).reversed())
            .thenComparingInt(e -> e.arrival);

    /**
     * @param sort  order by last update, most recent first
     * @param limit maximum number of documents; {@code 0} for all. A positive limit
     *              implies sorting.
     */
    public List<byte[]> list(StoreCursor cursor, boolean sort, int limit) {
        List<Entry> entries = new ArrayList<>();
        long syntheticKey = 0;
        for (StoreItem item : cursor.all()) {
            byte[] data = item.getData().orElse(null);
            if (data == null) {
                logger.warn("Skipping item {} without document data", item.getName().orElse("?"));
                continue;
            }
            OptionalLong epoch = item.getLong(AttributeNames.RUN_LAST_UPDATE_EPOCH);
            long key = epoch.isPresent() ? epoch.getAsLong() : syntheticKey++;
            entries.add(new Entry(key, epoch.isPresent(), entries.size(), data));
        }
        if (sort || limit > 0) {
            entries.sort(MOST_RECENT_FIRST);
        }
        if (limit > 0 && entries.size() > limit) {
            entries = entries.subList(0, limit);
        }
        logger.debug("Listing returns {} document(s)", entries.size());
        return entries.stream().map(e -> e.data).collect(Collectors.toList());
    }

    /** {@code {"<collection>": [doc,doc,...]}} with every document copied verbatim. */
    public byte[] render(String collection, List<byte[]> documents) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(("{\"" + collection + "\": [").getBytes(StandardCharsets.UTF_8));
        for (int i = 0; i < documents.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.writeBytes(documents.get(i));
        }
        out.writeBytes("]}".getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    /** {@code {"data": doc}} for point reads. */
    public byte[] wrapData(byte[] document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(document.length + 10);
        out.writeBytes("{\"data\":".getBytes(StandardCharsets.UTF_8));
        out.writeBytes(document);
        out.write('}');
        return out.toByteArray();
    }

    private static final class Entry {
        final long key;
        final boolean dated;
        final int arrival;
        final byte[] data;

        Entry(long key, boolean dated, int arrival, byte[] data) {
            this.key = key;
            this.dated = dated;
            this.arrival = arrival;
            this.data = data;
        }
    }
}
