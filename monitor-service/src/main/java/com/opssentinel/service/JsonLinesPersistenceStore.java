package com.opssentinel.service;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.spi.PersistenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Audit trail that appends one JSON document per line to
 * {@code alerts.jsonl} and {@code executions.jsonl}.
 *
 * <p>
 * An execution is appended on every state change, so the file holds its full
 * history. Write failures surface as {@link UncheckedIOException}; the
 * engines log them and carry on.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesPersistenceStore implements PersistenceStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesPersistenceStore.class);

    static final String ALERTS_FILE = "alerts.jsonl";
    static final String EXECUTIONS_FILE = "executions.jsonl";

    private final Path alertsFile;
    private final Path executionsFile;
    private final RecordSerializer serializer;

    public JsonLinesPersistenceStore(Path directory, RecordSerializer serializer) {
        Objects.requireNonNull(directory, "directory must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create audit directory " + directory, e);
        }
        this.alertsFile = directory.resolve(ALERTS_FILE);
        this.executionsFile = directory.resolve(EXECUTIONS_FILE);
        LOG.info("Audit trail writing to {}", directory.toAbsolutePath());
    }

    @Override
    public void persistAlert(AnomalyAlert alert) {
        append(alertsFile, serializer.toJson(alert));
    }

    @Override
    public void persistExecution(ResponseExecution execution) {
        append(executionsFile, serializer.toJson(execution));
    }

    private synchronized void append(Path file, String json) {
        try {
            Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    Path getAlertsFile() {
        return alertsFile;
    }

    Path getExecutionsFile() {
        return executionsFile;
    }
}
