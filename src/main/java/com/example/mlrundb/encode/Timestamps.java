package com.example.mlrundb.encode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.OptionalLong;

/** Run timestamps: {@code yyyy-MM-dd HH:mm:ss.SSSSSS}, UTC. */
public final class Timestamps {

    public static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS").withResolverStyle(ResolverStyle.STRICT);

    private Timestamps() {
    }

    /** Nanoseconds since the epoch, or empty when {@code text} is not a timestamp. */
    public static OptionalLong toEpochNanos(String text) {
        if (text == null || text.length() != 26) {
            return OptionalLong.empty();
        }
        try {
            Instant instant = LocalDateTime.parse(text, FORMAT).toInstant(ZoneOffset.UTC);
            return OptionalLong.of(Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano()));
        } catch (DateTimeParseException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }
}
