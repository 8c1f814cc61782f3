package com.rootrag.corpus;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code git} subcommands for the corpus fetcher.
 *
 * <p>Failures never throw: a launch failure, a timeout and an interrupt are reported in the
 * returned {@link GitCommandResult} with exit codes 127, 124 and 130. Output is trimmed UTF-8.
 */
public class GitCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    static final int TIMEOUT_EXIT_CODE = 124;
    static final int INTERRUPTED_EXIT_CODE = 130;
    static final int LAUNCH_FAILURE_EXIT_CODE = 127;

    public static final String DEFAULT_GIT_EXECUTABLE = "git";

    private final String gitExecutable;
    private final ProcessStarter processStarter;

    public GitCommandRunner() {
        this(DEFAULT_GIT_EXECUTABLE);
    }

    public GitCommandRunner(String gitExecutable) {
        this(gitExecutable, new PromptlessProcessStarter());
    }

    GitCommandRunner(ProcessStarter processStarter) {
        this(DEFAULT_GIT_EXECUTABLE, processStarter);
    }

    GitCommandRunner(String gitExecutable, ProcessStarter processStarter) {
        if (gitExecutable == null || gitExecutable.isBlank()) {
            throw new IllegalArgumentException("gitExecutable must not be blank");
        }
        this.gitExecutable = gitExecutable;
        this.processStarter = processStarter;
    }

    /**
     * Runs {@code git [-C repoDir] args...}. Pass a null {@code repoDir} for commands that need no
     * local repository, such as {@code ls-remote} and {@code clone}.
     */
    public GitCommandResult run(Path repoDir, Duration timeout, String... args) {
        List<String> command = commandFor(repoDir, args);
        long started = System.nanoTime();

        Process process;
        try {
            process = processStarter.start(command);
        } catch (IOException e) {
            log.warn("Unable to launch {}: {}", gitExecutable, e.getMessage());
            return new GitCommandResult(command, LAUNCH_FAILURE_EXIT_CODE, "", String.valueOf(e.getMessage()), false, false, true);
        }

        OutputCapture output = new OutputCapture(process);
        GitCommandResult result;
        try {
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                result = output.finish(command, process.exitValue(), false, false);
            } else {
                log.warn("git {} exceeded {} ms, killing it", subcommand(args), timeout.toMillis());
                process.destroyForcibly();
                result = output.finish(command, TIMEOUT_EXIT_CODE, true, false);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            result = output.finish(command, INTERRUPTED_EXIT_CODE, false, true);
        }
        log.debug("git {} exitCode={} elapsedMs={}", subcommand(args), result.exitCode(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return result;
    }

    List<String> commandFor(Path repoDir, String... args) {
        List<String> command = new ArrayList<>(args.length + 3);
        command.add(gitExecutable);
        if (repoDir != null) {
            command.add("-C");
            command.add(repoDir.toString());
        }
        command.addAll(List.of(args));
        return List.copyOf(command);
    }

    private static String subcommand(String... args) {
        return args.length == 0 ? "" : args[0];
    }

    private static final class OutputCapture {
        private final CompletableFuture<String> stdout;
        private final CompletableFuture<String> stderr;

        private OutputCapture(Process process) {
            this.stdout = drain(process.getInputStream());
            this.stderr = drain(process.getErrorStream());
        }

        private GitCommandResult finish(List<String> command, int exitCode, boolean timedOut, boolean interrupted) {
            return new GitCommandResult(command, exitCode, stdout.join(), stderr.join(), timedOut, interrupted, false);
        }

        private static CompletableFuture<String> drain(InputStream stream) {
            return CompletableFuture.supplyAsync(() -> {
                try (InputStream in = stream) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
                } catch (IOException e) {
                    log.warn("Unable to read git output: {}", e.getMessage());
                    return "";
                }
            });
        }
    }

    interface ProcessStarter {
        Process start(List<String> command) throws IOException;
    }

    /** Starts git with terminal prompts disabled, so a credential request fails instead of blocking. */
    private static final class PromptlessProcessStarter implements ProcessStarter {
        @Override
        public Process start(List<String> command) throws IOException {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            return builder.start();
        }
    }
}
