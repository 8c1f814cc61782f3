package com.rootrag.corpus;

import java.io.IOException;

public class GitOperationException extends IOException {
    private final GitCommandResult result;

    public GitOperationException(String message, GitCommandResult result) {
        super(message);
        this.result = result;
    }

    public GitOperationException(String message, Throwable cause) {
        super(message, cause);
        this.result = null;
    }

    public GitCommandResult result() {
        return result;
    }
}
