package io.fairlens.drift;

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

import io.fairlens.history.InMemoryHistoryStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DriftConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults() {
        DriftConfig config = DriftConfig.defaults();
        assertEquals(5, config.getWindowSize());
        assertEquals(0.05, config.getAlpha());
        assertEquals(2.0, config.getSigmaLimit());
        assertEquals(0.03, config.ladder().minorThreshold());
        assertEquals(0.15, config.ladder().majorThreshold());
    }

    @Test
    void parsesSnakeCaseKeys() {
        DriftConfig config = DriftConfig.fromJson("{\"window_size\": 8, \"sigma_limit\": 3.0}");
        assertEquals(8, config.getWindowSize());
        assertEquals(3.0, config.getSigmaLimit());
        assertEquals(0.05, config.getAlpha());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> DriftConfig.fromJson("{\"window_size\": 1}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("window_size");
        assertThatThrownBy(() -> DriftConfig.fromJson("{\"alpha\": 1.0}"))
            .hasMessageContaining("alpha");
        assertThatThrownBy(() -> DriftConfig.fromJson("{\"minor_threshold\": 0.2}"))
            .hasMessageContaining("minor_threshold");
        assertThrows(IllegalArgumentException.class, () -> DriftConfig.fromJson("[1, 2"));
    }

    @Test
    void windowSizeIsCappedSoRequiredPointsFitAnInt() {
        DriftConfig largest = new DriftConfig().setWindowSize(DriftConfig.MAX_WINDOW_SIZE);
        largest.validate();
        assertEquals(Integer.MAX_VALUE - 1, new DriftMonitor(new InMemoryHistoryStore(), largest)
            .requiredPoints());

        assertThatThrownBy(() -> DriftConfig.fromJson("{\"window_size\": " + (DriftConfig.MAX_WINDOW_SIZE + 1) + "}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("window_size");
        assertThrows(IllegalArgumentException.class,
            () -> new DriftConfig().setWindowSize(Integer.MAX_VALUE).validate());
    }

    @Test
    void saveAndLoad() throws IOException {
        Path file = tempDir.resolve("drift.json");
        new DriftConfig().setWindowSize(10).setAlpha(0.01).save(file);

        DriftConfig loaded = DriftConfig.load(file);
        assertEquals(10, loaded.getWindowSize());
        assertEquals(0.01, loaded.getAlpha());
        assertTrue(loaded.toJson().contains("\"window_size\": 10"));
    }
}
