package com.rootrag.corpus;

import java.io.IOException;

public class InvalidRefException extends IOException {
    private final String ref;

    public InvalidRefException(String ref, String message) {
        super(message);
        this.ref = ref;
    }

    public String ref() {
        return ref;
    }
}
