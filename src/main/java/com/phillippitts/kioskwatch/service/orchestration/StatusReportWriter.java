package com.phillippitts.kioskwatch.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Persists the status report as pretty-printed JSON.
 *
 * <p>The report is written to a sibling temp file and moved over the target, so a reader
 * never sees a half-written report.
 */
public final class StatusReportWriter {

    private static final Logger LOG = LogManager.getLogger(StatusReportWriter.class);
    private static final int INDENT = 2;

    private final Path target;

    public StatusReportWriter(Path target) {
        this.target = Objects.requireNonNull(target, "target must not be null").toAbsolutePath();
    }

    public Path target() {
        return target;
    }

    /**
     * @throws UncheckedIOException if the report cannot be written
     */
    public void write(JSONObject report) {
        Objects.requireNonNull(report, "report must not be null");
        Path dir = target.getParent();
        Path tmp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, report.toString(INDENT), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Report written to {}", target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write report to " + target + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temp report {}: {}", tmp, e.toString());
        }
    }
}
