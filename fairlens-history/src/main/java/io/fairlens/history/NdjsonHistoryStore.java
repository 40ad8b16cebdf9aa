package io.fairlens.history;

/*
 * Copyright (c) fairlens
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import io.fairlens.metrics.FairnessSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/// [FairnessHistoryStore] persisted as two NDJSON (newline-delimited JSON)
/// files in a directory.
///
/// ## Files
///
/// ```text
/// <directory>/
///   metrics.ndjson    {"system":"credit","metric":"demographic_parity","timestamp":"2026-03-01T12:00:00Z","value":0.25}
///   snapshots.ndjson  {"systemId":"credit","modelVersion":"1.4.0","timestamp":"...","categoryScore":0.36,...}
/// ```
///
/// Opening a store replays both files into an [InMemoryHistoryStore], which
/// serves every read. Appends go to the file first and to memory second, so a
/// failed write leaves both unchanged.
///
/// ## Usage
///
/// ```java
/// try (NdjsonHistoryStore store = new NdjsonHistoryStore(Path.of("history"))) {
///     store.recordSnapshot(snapshot);
///     List<MetricPoint> window = store.getHistory("credit", "demographic_parity", 10);
/// }
/// ```
///
/// ## Thread Safety
///
/// All appends are serialized on one write lock; reads use the per-series
/// locks of the in-memory index. [#recordSnapshot(FairnessSnapshot)] checks
/// the snapshot and every series against the index before writing either file.
public final class NdjsonHistoryStore implements FairnessHistoryStore, Closeable {

    private static final Logger logger = LogManager.getLogger(NdjsonHistoryStore.class);

    public static final String METRICS_FILE = "metrics.ndjson";
    public static final String SNAPSHOTS_FILE = "snapshots.ndjson";

    private final Path directory;
    private final Gson gson = FairlensGsonConfig.compactGson();
    private final InMemoryHistoryStore index = new InMemoryHistoryStore();
    private final BufferedWriter metricsWriter;
    private final BufferedWriter snapshotsWriter;
    private final Object writeLock = new Object();

    /// Opens or creates a store in a directory.
    ///
    /// @param directory the store directory, created if missing
    /// @throws IOException if the directory or its files cannot be read or opened for writing
    /// @throws HistoryStoreException if an existing file holds a malformed line
    public NdjsonHistoryStore(Path directory) throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        Files.createDirectories(directory);
        Path metricsFile = directory.resolve(METRICS_FILE);
        Path snapshotsFile = directory.resolve(SNAPSHOTS_FILE);

        int points = replay(metricsFile, MetricLine.class,
            line -> index.appendMetricValue(line.system(), line.metric(), line.timestamp(), line.value()));
        int records = replay(snapshotsFile, SnapshotRecord.class, index::appendRecord);
        logger.info("Opened history store {} ({} metric points, {} snapshots)", directory, points, records);

        this.metricsWriter = open(metricsFile);
        this.snapshotsWriter = open(snapshotsFile);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void recordSnapshot(FairnessSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        SnapshotRecord record = SnapshotRecord.of(snapshot);
        synchronized (writeLock) {
            index.checkRecordable(record);
            StringBuilder lines = new StringBuilder();
            for (Map.Entry<String, Double> entry : record.metricValues().entrySet()) {
                lines.append(gson.toJson(new MetricLine(record.systemId(), entry.getKey(), record.timestamp(),
                    entry.getValue()))).append(System.lineSeparator());
            }
            writeLine(snapshotsWriter, gson.toJson(record), SNAPSHOTS_FILE);
            write(metricsWriter, lines.toString(), METRICS_FILE);
            index.recordSnapshot(snapshot);
        }
    }

    @Override
    public void appendSnapshot(FairnessSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        SnapshotRecord record = SnapshotRecord.of(snapshot);
        synchronized (writeLock) {
            index.checkAppendable(record);
            writeLine(snapshotsWriter, gson.toJson(record), SNAPSHOTS_FILE);
            index.appendRecord(record);
        }
    }

    @Override
    public void appendMetricValue(String systemId, String metric, Instant timestamp, double value) {
        MetricSeriesKey key = new MetricSeriesKey(systemId, metric);
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        InMemoryHistoryStore.requireFinite(key, value);
        synchronized (writeLock) {
            index.checkAppendable(key, timestamp);
            writeLine(metricsWriter, gson.toJson(new MetricLine(systemId, metric, timestamp, value)), METRICS_FILE);
            index.appendMetricValue(systemId, metric, timestamp, value);
        }
    }

    @Override
    public List<MetricPoint> getHistory(String systemId, String metric, int window) {
        return index.getHistory(systemId, metric, window);
    }

    @Override
    public List<SnapshotRecord> snapshots(String systemId, int limit) {
        return index.snapshots(systemId, limit);
    }

    @Override
    public List<String> metrics(String systemId) {
        return index.metrics(systemId);
    }

    private void writeLine(BufferedWriter writer, String json, String file) {
        write(writer, json + System.lineSeparator(), file);
    }

    private void write(BufferedWriter writer, String text, String file) {
        try {
            writer.write(text);
            writer.flush();
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to append to " + directory.resolve(file), e);
        }
    }

    private <T> int replay(Path file, Class<T> type, Consumer<T> sink) throws IOException {
        if (!Files.exists(file)) {
            return 0;
        }
        int count = 0;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                // Gson reports a rejecting record constructor as a plain RuntimeException
                T entry;
                try {
                    entry = gson.fromJson(line, type);
                } catch (RuntimeException e) {
                    throw new HistoryStoreException("Malformed line " + lineNumber + " in " + file, e);
                }
                try {
                    sink.accept(entry);
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new HistoryStoreException("Invalid entry on line " + lineNumber + " in " + file, e);
                }
                count++;
            }
        }
        return count;
    }

    private static BufferedWriter open(Path file) throws IOException {
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE);
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            try {
                metricsWriter.close();
            } finally {
                snapshotsWriter.close();
            }
        }
    }

    /// One line of the metrics file.
    private record MetricLine(String system, String metric, Instant timestamp, double value) {
    }
}
