package com.example.mlrundb.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dot-separated field path such as {@code status.results.accuracy}.
 *
 * <ul>
 *   <li>{@code \.} is a literal dot inside a segment</li>
 *   <li>a segment made of digits (or {@code -1}, meaning "append") addresses an array
 *       element</li>
 *   <li>a leading {@code :} makes a numeric segment an object key</li>
 * </ul>
 */
final class DotPath {

    private final List<Segment> segments;

    private DotPath(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    static DotPath parse(String path) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\' && i + 1 < path.length() && path.charAt(i + 1) == '.') {
                current.append('.');
                i++;
            } else if (c == '.') {
                segments.add(Segment.of(current.toString()));
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        segments.add(Segment.of(current.toString()));
        return new DotPath(segments);
    }

    List<Segment> getSegments() {
        return segments;
    }

    static final class Segment {
        static final int APPEND = -1;

        final String key;
        /** Array index, {@link #APPEND}, or null when the segment is only an object key. */
        final Integer index;

        private Segment(String key, Integer index) {
            this.key = key;
            this.index = index;
        }

        static Segment of(String raw) {
            if (raw.startsWith(":")) {
                return new Segment(raw.substring(1), null);
            }
            if (raw.equals("-1")) {
                return new Segment(raw, APPEND);
            }
            if (!raw.isEmpty() && raw.length() < 10 && raw.chars().allMatch(Character::isDigit)) {
                return new Segment(raw, Integer.parseInt(raw));
            }
            return new Segment(raw, null);
        }

        boolean isIndex() {
            return index != null;
        }
    }
}
