package com.rms.cdc.core.model;

import java.util.Locale;

/**
 * Explicit type tag of a {@link FilterValue} literal.
 *
 * <p>The tag, not the Java class of the decoded column value, decides how a
 * comparison is performed.</p>
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATETIME,
    LIST,
    NULL;

    /** Parses the lowercase tag used in persisted configuration ({@code "string"}, ...). */
    public static ValueType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("value type tag is required");
        }
        return ValueType.valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
