package com.discussboard.backend.global.common;

import java.util.Locale;

import com.discussboard.backend.global.error.ProblemException;

/**
 * Converts between persisted enum constants and the lower-case values used on the wire.
 */
public final class EnumValues {

    private EnumValues() {
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String raw, String errorCode) {
        if (raw == null || raw.isBlank()) {
            throw ProblemException.badRequest(errorCode, type.getSimpleName() + " is required");
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest(errorCode, "Unsupported value: " + raw);
        }
    }

    public static <E extends Enum<E>> E parseOptional(Class<E> type, String raw, String errorCode) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return parse(type, raw, errorCode);
    }

    public static String wire(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }
}
