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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.fairlens.history.FairlensGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable settings for drift detection.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "window_size": 5,        // points per window (2 to MAX_WINDOW_SIZE); a check reads 2 x window_size points
 *   "alpha": 0.05,           // t-test significance level
 *   "sigma_limit": 2.0,      // control limits at baseline mean +/- sigma_limit x std
 *   "minor_threshold": 0.03, // absolute change at which drift becomes MINOR
 *   "major_threshold": 0.15  // absolute change at which drift becomes MAJOR
 * }
 * }</pre>
 *
 * @see DriftMonitor
 */
public class DriftConfig {

    /// Largest window size whose 2 x window_size point count fits in an int
    public static final int MAX_WINDOW_SIZE = Integer.MAX_VALUE / 2;

    @SerializedName("window_size")
    private int windowSize = 5;

    @SerializedName("alpha")
    private double alpha = 0.05;

    @SerializedName("sigma_limit")
    private double sigmaLimit = 2.0;

    @SerializedName("minor_threshold")
    private double minorThreshold = 0.03;

    @SerializedName("major_threshold")
    private double majorThreshold = 0.15;

    public DriftConfig() {
    }

    public static DriftConfig defaults() {
        return new DriftConfig();
    }

    /**
     * Parses a configuration from JSON; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static DriftConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        DriftConfig config;
        try {
            config = FairlensGsonConfig.gson().fromJson(json, DriftConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid drift config JSON: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        config.validate();
        return config;
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @throws IOException if the file cannot be read
     */
    public static DriftConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DriftConfig config;
            try {
                config = FairlensGsonConfig.gson().fromJson(reader, DriftConfig.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid drift config in " + path + ": " + e.getMessage(), e);
            }
            if (config == null) {
                return defaults();
            }
            config.validate();
            return config;
        }
    }

    public void save(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            FairlensGsonConfig.gson().toJson(this, writer);
        }
    }

    public String toJson() {
        return FairlensGsonConfig.gson().toJson(this);
    }

    /**
     * Checks that every value is in range.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public void validate() {
        if (windowSize < 2 || windowSize > MAX_WINDOW_SIZE) {
            throw new IllegalArgumentException("window_size must be in [2, " + MAX_WINDOW_SIZE + "], got: " + windowSize);
        }
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got: " + alpha);
        }
        if (!(sigmaLimit > 0.0) || Double.isInfinite(sigmaLimit)) {
            throw new IllegalArgumentException("sigma_limit must be positive and finite, got: " + sigmaLimit);
        }
        if (!(minorThreshold > 0.0 && majorThreshold > minorThreshold)) {
            throw new IllegalArgumentException("minor_threshold and major_threshold must satisfy 0 < minor < major, got: "
                + minorThreshold + ", " + majorThreshold);
        }
    }

    /// The severity ladder for the configured thresholds.
    public SeverityLadder ladder() {
        return SeverityLadder.of(minorThreshold, majorThreshold);
    }

    public int getWindowSize() {
        return windowSize;
    }

    public DriftConfig setWindowSize(int windowSize) {
        this.windowSize = windowSize;
        return this;
    }

    public double getAlpha() {
        return alpha;
    }

    public DriftConfig setAlpha(double alpha) {
        this.alpha = alpha;
        return this;
    }

    public double getSigmaLimit() {
        return sigmaLimit;
    }

    public DriftConfig setSigmaLimit(double sigmaLimit) {
        this.sigmaLimit = sigmaLimit;
        return this;
    }

    public double getMinorThreshold() {
        return minorThreshold;
    }

    public DriftConfig setMinorThreshold(double minorThreshold) {
        this.minorThreshold = minorThreshold;
        return this;
    }

    public double getMajorThreshold() {
        return majorThreshold;
    }

    public DriftConfig setMajorThreshold(double majorThreshold) {
        this.majorThreshold = majorThreshold;
        return this;
    }

    @Override
    public String toString() {
        return "DriftConfig{windowSize=" + windowSize
            + ", alpha=" + alpha
            + ", sigmaLimit=" + sigmaLimit
            + ", minorThreshold=" + minorThreshold
            + ", majorThreshold=" + majorThreshold + "}";
    }
}
