package com.rootrag.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.rootrag.core.ValidationException;

public enum DocOrigin {
    SOURCE_HEADER("source_header"),
    SOURCE_IMPL("source_impl"),
    DOXYGEN_COMMENT("doxygen_comment"),
    REFERENCE_DOC("reference_doc"),
    TUTORIAL_DOC("tutorial_doc");

    private final String value;

    DocOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DocOrigin fromValue(String value) {
        for (DocOrigin origin : values()) {
            if (origin.value.equals(value)) {
                return origin;
            }
        }
        throw new ValidationException("doc_origin", "unknown value '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
