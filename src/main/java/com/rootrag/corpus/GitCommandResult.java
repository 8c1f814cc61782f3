package com.rootrag.corpus;

import java.util.List;

public record GitCommandResult(
        List<String> command,
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String commandLine() {
        return String.join(" ", command);
    }
}
