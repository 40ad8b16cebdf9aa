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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.fairlens.history.HistoryFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NdjsonHistoryStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneLinePerAppend() throws IOException {
        try (NdjsonHistoryStore store = new NdjsonHistoryStore(tempDir)) {
            store.appendMetricValue("credit", "demographic_parity", T0, 0.25);
            store.appendMetricValue("credit", "demographic_parity", T0.plusSeconds(60), 0.3);
        }

        List<String> lines = Files.readAllLines(tempDir.resolve(NdjsonHistoryStore.METRICS_FILE), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("{\"system\":\"credit\",\"metric\":\"demographic_parity\",\"timestamp\":\"2026-03-01T00:00:00Z\",\"value\":0.25}",
            lines.get(0));
    }

    @Test
    void reopenReplaysHistory() throws IOException {
        try (NdjsonHistoryStore store = new NdjsonHistoryStore(tempDir)) {
            store.recordSnapshot(HistoryFixtures.snapshot("credit", T0));
            store.recordSnapshot(HistoryFixtures.snapshot("credit", T0.plusSeconds(3600)));
        }

        try (NdjsonHistoryStore store = new NdjsonHistoryStore(tempDir)) {
            List<MetricPoint> points = store.getHistory("credit", "demographic_parity", 10);
            assertEquals(2, points.size());
            assertEquals(T0.plusSeconds(3600), points.get(1).timestamp());
            assertEquals(0.25, points.get(1).value(), 1e-12);

            List<SnapshotRecord> records = store.snapshots("credit", 10);
            assertEquals(2, records.size());
            SnapshotRecord first = records.get(0);
            assertEquals("credit", first.systemId());
            assertEquals(T0, first.timestamp());
            assertEquals(0.36, first.categoryScore(), 1e-9);
            assertEquals(0.2, first.metricScores().get("demographic_parity"));
            assertThat(first.metricValues()).containsKey("category_score");
            assertThat(first.criticalIssues()).hasSize(4);

            // appends continue after the replayed points
            store.appendMetricValue("credit", "demographic_parity", T0.plusSeconds(7200), 0.1);
            assertEquals(3, store.getHistory("credit", "demographic_parity", 10).size());
            assertThrows(IllegalArgumentException.class,
                () -> store.appendMetricValue("credit", "demographic_parity", T0, 0.1));
        }
    }

    @Test
    void rejectedAppendWritesNothing() throws IOException {
        try (NdjsonHistoryStore store = new NdjsonHistoryStore(tempDir)) {
            store.appendMetricValue("credit", "calibration", T0.plusSeconds(10), 0.1);
            assertThrows(IllegalArgumentException.class,
                () -> store.appendMetricValue("credit", "calibration", T0, 0.2));
            assertThrows(IllegalArgumentException.class,
                () -> store.appendMetricValue("credit", "calibration", T0.plusSeconds(20), Double.POSITIVE_INFINITY));
        }
        assertEquals(1, Files.readAllLines(tempDir.resolve(NdjsonHistoryStore.METRICS_FILE)).size());
    }

    @Test
    void rejectedSnapshotWritesNeitherFile() throws IOException {
        try (NdjsonHistoryStore store = new NdjsonHistoryStore(tempDir)) {
            store.appendMetricValue("credit", "predictive_parity", T0.plusSeconds(60), 0.0);

            assertThatThrownBy(() -> store.recordSnapshot(HistoryFixtures.snapshot("credit", T0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("credit/predictive_parity");
            assertTrue(store.snapshots("credit", 10).isEmpty());
            assertTrue(store.getHistory("credit", "demographic_parity", 10).isEmpty());
            assertEquals(List.of("predictive_parity"), store.metrics("credit"));
        }
        assertEquals(1, Files.readAllLines(tempDir.resolve(NdjsonHistoryStore.METRICS_FILE)).size());
        assertEquals(0, Files.readAllLines(tempDir.resolve(NdjsonHistoryStore.SNAPSHOTS_FILE)).size());
    }

    @Test
    void createsMissingDirectory() throws IOException {
        Path nested = tempDir.resolve("a").resolve("b");
        try (NdjsonHistoryStore store = new NdjsonHistoryStore(nested)) {
            assertEquals(nested, store.directory());
            assertTrue(store.snapshots("credit", 1).isEmpty());
        }
        assertTrue(Files.exists(nested.resolve(NdjsonHistoryStore.SNAPSHOTS_FILE)));
    }

    @Test
    void malformedLineFailsOpen() throws IOException {
        Files.writeString(tempDir.resolve(NdjsonHistoryStore.METRICS_FILE),
            "{\"system\":\"credit\",\"metric\":\"calibration\",\"timestamp\":\"2026-03-01T00:00:00Z\",\"value\":0.1}\n"
                + "\n"
                + "{not json\n");

        assertThatThrownBy(() -> new NdjsonHistoryStore(tempDir))
            .isInstanceOf(HistoryStoreException.class)
            .hasMessageContaining("line 3");
    }

    @Test
    void outOfOrderFileFailsOpen() throws IOException {
        Files.writeString(tempDir.resolve(NdjsonHistoryStore.METRICS_FILE),
            "{\"system\":\"credit\",\"metric\":\"calibration\",\"timestamp\":\"2026-03-02T00:00:00Z\",\"value\":0.1}\n"
                + "{\"system\":\"credit\",\"metric\":\"calibration\",\"timestamp\":\"2026-03-01T00:00:00Z\",\"value\":0.1}\n");

        assertThatThrownBy(() -> new NdjsonHistoryStore(tempDir))
            .isInstanceOf(HistoryStoreException.class)
            .hasMessageContaining("line 2")
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
