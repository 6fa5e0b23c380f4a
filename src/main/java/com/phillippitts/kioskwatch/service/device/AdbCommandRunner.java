package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.exception.DeviceCommandException;
import com.phillippitts.kioskwatch.exception.DeviceCommandExceptionBuilder;
import com.phillippitts.kioskwatch.util.ProcessTimeouts;
import com.phillippitts.kioskwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code adb} binary and collects its output.
 *
 * <p>Responsibilities:
 * - Build the command line from the configured adb executable and the caller's arguments
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently
 * - Enforce a timeout and terminate runaway processes
 * - Provide structured error context in {@link DeviceCommandException}
 *
 * <p>Holds no per-call state, so one instance serves all device pool threads.
 */
final class AdbCommandRunner {

    private static final Logger LOG = LogManager.getLogger(AdbCommandRunner.class);

    private final ProcessFactory processFactory;
    private final String adbPath;

    /**
     * Process execution state: the process plus its stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    AdbCommandRunner(ProcessFactory processFactory, String adbPath) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.adbPath = Objects.requireNonNull(adbPath, "adbPath");
    }

    /**
     * Runs {@code adb <args>} and returns its stdout.
     *
     * @param args     arguments after the adb executable
     * @param timeout  maximum run time; the process is killed when exceeded
     * @param deviceId device the command targets, for error context
     * @return stdout (may be empty)
     * @throws DeviceCommandException on timeout, non-zero exit, I/O error or interruption
     */
    String run(List<String> args, Duration timeout, String deviceId) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(timeout, "timeout");

        List<String> command = buildCommand(args);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command);
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw commandError("Timeout after " + timeout.toMillis() + "ms", args, deviceId,
                        -1, exec.stderr(), startTime, null, true);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw commandError("Non-zero exit: " + exitCode, args, deviceId,
                        exitCode, exec.stderr(), startTime, null, false);
            }
            String output;
            synchronized (exec.stdout()) {
                output = exec.stdout().toString();
            }
            LOG.debug("adb {} finished in {}ms, stdout={} chars",
                    args, TimeUtils.elapsedMillis(startTime), output.length());
            return output;
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (exec != null && exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
            throw commandError("I/O failure: " + e.getMessage(), args, deviceId,
                    -1, exec == null ? null : exec.stderr(), startTime, e, false);
        } finally {
            if (exec != null) {
                joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            }
        }
    }

    /**
     * Starts a long-running {@code adb <args>} process whose stdout the caller consumes.
     * stderr is drained on a daemon thread so the process never blocks on it.
     *
     * @param args     arguments after the adb executable
     * @param deviceId device the command targets, for error context
     * @return started process
     * @throws DeviceCommandException if the process cannot be started
     */
    Process startStreaming(List<String> args, String deviceId) {
        List<String> command = buildCommand(args);
        try {
            Process process = processFactory.start(command);
            startGobbler(process.getErrorStream(), new StringBuilder(), "adb-stream-err",
                    ProcessTimeouts.STDERR_MAX_BYTES);
            return process;
        } catch (IOException e) {
            throw DeviceCommandExceptionBuilder.create("Failed to start stream: " + e.getMessage())
                    .device(deviceId)
                    .metadata("command", String.join(" ", args))
                    .cause(e)
                    .build();
        }
    }

    private List<String> buildCommand(List<String> args) {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(adbPath);
        cmd.addAll(args);
        return cmd;
    }

    private ProcessExecution startProcessWithGobblers(List<String> command) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command);

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "adb-out",
                ProcessTimeouts.STDOUT_MAX_BYTES);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "adb-err",
                ProcessTimeouts.STDERR_MAX_BYTES);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder up to a cap, then keeps draining without accumulating
     * so the process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), available));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Terminates a process: {@link Process#destroy()} first, then {@link Process#destroyForcibly()}
     * if it is still alive after the graceful timeout.
     */
    static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private DeviceCommandException commandError(String msg, List<String> args, String deviceId,
                                                int exitCode, StringBuilder stderr, long startNano,
                                                Throwable cause, boolean timedOut) {
        String stderrSnippet = "";
        if (stderr != null) {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ProcessTimeouts.ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        DeviceCommandExceptionBuilder builder = DeviceCommandExceptionBuilder.create(msg)
                .device(deviceId)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("command", String.join(" ", args))
                .metadata("stderr", stderrSnippet);
        if (timedOut) {
            builder.timedOut();
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
