package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link LogStream} over a running {@code adb logcat} process.
 *
 * <p>A daemon reader thread moves stdout lines into a bounded queue. When the queue is full
 * the reader blocks, which in turn back-pressures the adb process.
 */
final class AdbLogStream implements LogStream {

    private static final Logger LOG = LogManager.getLogger(AdbLogStream.class);

    private final Process process;
    private final BlockingQueue<String> lines;
    private final Thread reader;
    private volatile boolean readerDone;
    private volatile boolean closed;

    AdbLogStream(Process process, int capacity, String name) {
        this.process = Objects.requireNonNull(process, "process");
        this.lines = new LinkedBlockingQueue<>(capacity);
        this.reader = new Thread(this::readLoop, name);
        this.reader.setDaemon(true);
        this.reader.start();
    }

    private void readLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (!closed && (line = br.readLine()) != null) {
                lines.put(line);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed) {
                LOG.warn("Log stream read failed: {}", e.toString());
            }
        } finally {
            readerDone = true;
            LOG.debug("Log stream reader finished (closed={})", closed);
        }
    }

    @Override
    public Optional<String> poll(Duration timeout) {
        try {
            if (timeout.isZero() || timeout.isNegative()) {
                return Optional.ofNullable(lines.poll());
            }
            return Optional.ofNullable(lines.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public boolean isFinished() {
        return readerDone && lines.isEmpty();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (process.isAlive()) {
            AdbCommandRunner.destroyProcess(process);
        }
        reader.interrupt();
        try {
            reader.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        lines.clear();
        LOG.info("Log stream closed");
    }
}
