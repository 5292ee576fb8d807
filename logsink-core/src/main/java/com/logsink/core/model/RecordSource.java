package com.logsink.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Wire format a record arrived in at the intake edge. */
public enum RecordSource {
    STRUCTURED_UPLOAD("structured_upload"),
    TEXT_UPLOAD("text_upload");

    private final String wireName;

    RecordSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RecordSource fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("source is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecordSource source : values()) {
            if (source.wireName.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown record source '" + value + "'");
    }
}
