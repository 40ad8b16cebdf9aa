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
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/// Centralized Gson configuration for fairlens persistence.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | HTML escaping | Disabled | Issue texts keep `<` and `>` readable |
/// | Special floats | Allowed | Infinite control-chart distances survive a round trip |
/// | `Instant` | ISO-8601 string | Stable, sortable timestamps |
///
/// [#gson()] pretty-prints for configuration files; [#compactGson()] writes
/// one record per line for NDJSON stores.
///
/// ## Thread Safety
///
/// [Gson] instances are thread-safe; both are shared singletons.
public final class FairlensGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private FairlensGsonConfig() {
    }

    /// Returns the shared pretty-printing instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns the shared single-line instance.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new builder with the fairlens defaults, for callers that need
    /// further customization.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe());
    }

    /// Writes an [Instant] as its ISO-8601 text.
    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            String text = in.nextString();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("invalid timestamp: " + text, e);
            }
        }
    }
}
