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
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FairlensGsonConfigTest {

    @Test
    void instantsAreIsoStrings() {
        Gson gson = FairlensGsonConfig.compactGson();
        Instant at = Instant.parse("2026-03-01T12:30:00.123Z");

        assertEquals("\"2026-03-01T12:30:00.123Z\"", gson.toJson(at));
        assertEquals(at, gson.fromJson("\"2026-03-01T12:30:00.123Z\"", Instant.class));
        assertThrows(JsonParseException.class, () -> gson.fromJson("\"yesterday\"", Instant.class));
    }

    @Test
    void snapshotRecordRoundTripKeepsNullCategoryScore() {
        Gson gson = FairlensGsonConfig.compactGson();
        SnapshotRecord record = new SnapshotRecord("credit", "2.0", Instant.parse("2026-03-01T00:00:00Z"),
            null, Map.of(), Map.of(), List.of("a <b> issue"));

        String json = gson.toJson(record);
        assertFalse(json.contains("categoryScore"));
        assertTrue(json.contains("a <b> issue"));

        SnapshotRecord restored = gson.fromJson(json, SnapshotRecord.class);
        assertEquals(record, restored);
        assertTrue(restored.category().isEmpty());
    }

    @Test
    void specialFloatsAreAllowed() {
        assertEquals("Infinity", FairlensGsonConfig.compactGson().toJson(Double.POSITIVE_INFINITY));
        assertTrue(FairlensGsonConfig.gson().toJson(Map.of("k", 1)).contains("\n"));
    }
}
