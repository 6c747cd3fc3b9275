package com.gatekeeper.core.invoker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link ToolInvoker} backed by {@link ProcessBuilder}.
 * <p>
 * stdout and stderr are drained concurrently so a chatty tool cannot block on a
 * full pipe. Draining runs on the invoker's own unbounded pool, never on a shared
 * one, so concurrent runs cannot starve each other's readers. On timeout the
 * process is destroyed forcibly and whatever output was captured so far is returned.
 */
public class ProcessToolInvoker implements ToolInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolInvoker.class);

    private static final long DRAIN_GRACE_MS = 500;

    private final ExecutorService drainExecutor;

    public ProcessToolInvoker() {
        this(Executors.newCachedThreadPool(drainThreads()));
    }

    ProcessToolInvoker(ExecutorService drainExecutor) {
        this.drainExecutor = drainExecutor;
    }

    private static ThreadFactory drainThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "gatekeeper-tool-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public ToolResult run(ToolCommand command) {
        log.debug("Running {}: {}", command.name(), command.display());
        long start = System.nanoTime();

        Process process;
        try {
            var builder = new ProcessBuilder(command.command()).redirectErrorStream(false);
            if (command.workingDirectory() != null) {
                builder.directory(command.workingDirectory().toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            if (isMissingExecutable(e)) {
                log.debug("Tool {} not found: {}", command.name(), e.getMessage());
                return ToolResult.notFound(command.name(), command.executable() + " is not installed or not on PATH");
            }
            log.warn("Could not start {}: {}", command.name(), e.getMessage());
            return ToolResult.error(command.name(), "Could not start " + command.executable() + ": " + e.getMessage(),
                    elapsedMs(start));
        }

        Future<String> stdout = drainExecutor.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = drainExecutor.submit(() -> drain(process.getErrorStream()));

        try {
            boolean finished = true;
            if (command.timeout() == null) {
                process.waitFor();
            } else {
                finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                process.destroyForcibly();
                log.warn("Tool {} timed out after {}", command.name(), command.timeout());
                return new ToolResult(command.name(), ToolStatus.TIMED_OUT, -1,
                        partial(stdout), timeoutMessage(command) + partial(stderr), elapsedMs(start));
            }
            int exitCode = process.exitValue();
            var result = new ToolResult(command.name(),
                    exitCode == 0 ? ToolStatus.SUCCEEDED : ToolStatus.FAILED,
                    exitCode, stdout.get(), stderr.get(), elapsedMs(start));
            log.debug("Tool {} exited with {} in {}ms", command.name(), exitCode, result.durationMs());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ToolResult.error(command.name(), "Interrupted while waiting for " + command.name(), elapsedMs(start));
        } catch (ExecutionException e) {
            log.warn("Failed to capture output of {}: {}", command.name(), e.getCause().getMessage());
            return ToolResult.error(command.name(), "Failed to capture output: " + e.getCause().getMessage(),
                    elapsedMs(start));
        }
    }

    private static String drain(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String partial(Future<String> output) {
        try {
            return output.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("No partial output captured: {}", e.toString());
            return "";
        }
    }

    private static String timeoutMessage(ToolCommand command) {
        return command.name() + " did not finish within " + command.timeout().toSeconds() + "s\n";
    }

    @Override
    public void close() {
        drainExecutor.shutdownNow();
    }

    static boolean isMissingExecutable(IOException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("error=2") || message.contains("no such file")
                || message.contains("cannot find the file");
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
