package io.fairlens.metrics.compute;

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
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable settings for metric computation and bias aggregation.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; missing keys keep their defaults:
 * <pre>{@code
 * {
 *   "min_group_size": 10,          // groups smaller than this mark a metric unreliable
 *   "calibration_bins": 10,        // equal-width probability bins for ECE
 *   "max_intersection_depth": 2,   // largest attribute combination for subgroup performance
 *   "min_subgroup_size": 2,        // subgroups smaller than this are ignored by subgroup performance
 *   "top_n": 5,                    // length of worst-group and largest-gap lists
 *   "low_accuracy_threshold": 0.75 // subgroups below this accuracy are listed as low accuracy
 * }
 * }</pre>
 *
 * @see MetricComputer
 */
public class MetricsConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("min_group_size")
    private int minGroupSize = 10;

    @SerializedName("calibration_bins")
    private int calibrationBins = 10;

    @SerializedName("max_intersection_depth")
    private int maxIntersectionDepth = 2;

    @SerializedName("min_subgroup_size")
    private int minSubgroupSize = 2;

    @SerializedName("top_n")
    private int topN = 5;

    @SerializedName("low_accuracy_threshold")
    private double lowAccuracyThreshold = 0.75;

    /**
     * Creates a configuration with default values.
     */
    public MetricsConfig() {
    }

    /**
     * Returns a configuration with default values.
     */
    public static MetricsConfig defaults() {
        return new MetricsConfig();
    }

    /**
     * Parses a configuration from JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static MetricsConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        MetricsConfig config;
        try {
            config = GSON.fromJson(json, MetricsConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid metrics config JSON: " + e.getMessage(), e);
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
     * @throws IllegalArgumentException if the content is invalid
     */
    public static MetricsConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            MetricsConfig config;
            try {
                config = GSON.fromJson(reader, MetricsConfig.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid metrics config in " + path + ": " + e.getMessage(), e);
            }
            if (config == null) {
                return defaults();
            }
            config.validate();
            return config;
        }
    }

    /**
     * Writes this configuration to a JSON file.
     */
    public void save(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(this, writer);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Checks that every value is in range.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public void validate() {
        requireAtLeast("min_group_size", minGroupSize, 1);
        requireAtLeast("calibration_bins", calibrationBins, 1);
        requireAtLeast("max_intersection_depth", maxIntersectionDepth, 1);
        requireAtLeast("min_subgroup_size", minSubgroupSize, 1);
        requireAtLeast("top_n", topN, 1);
        if (!(lowAccuracyThreshold >= 0.0 && lowAccuracyThreshold <= 1.0)) {
            throw new IllegalArgumentException("low_accuracy_threshold must be in [0, 1], got: " + lowAccuracyThreshold);
        }
    }

    private static void requireAtLeast(String key, int value, int min) {
        if (value < min) {
            throw new IllegalArgumentException(key + " must be at least " + min + ", got: " + value);
        }
    }

    public int getMinGroupSize() {
        return minGroupSize;
    }

    public MetricsConfig setMinGroupSize(int minGroupSize) {
        this.minGroupSize = minGroupSize;
        return this;
    }

    public int getCalibrationBins() {
        return calibrationBins;
    }

    public MetricsConfig setCalibrationBins(int calibrationBins) {
        this.calibrationBins = calibrationBins;
        return this;
    }

    public int getMaxIntersectionDepth() {
        return maxIntersectionDepth;
    }

    public MetricsConfig setMaxIntersectionDepth(int maxIntersectionDepth) {
        this.maxIntersectionDepth = maxIntersectionDepth;
        return this;
    }

    public int getMinSubgroupSize() {
        return minSubgroupSize;
    }

    public MetricsConfig setMinSubgroupSize(int minSubgroupSize) {
        this.minSubgroupSize = minSubgroupSize;
        return this;
    }

    public int getTopN() {
        return topN;
    }

    public MetricsConfig setTopN(int topN) {
        this.topN = topN;
        return this;
    }

    public double getLowAccuracyThreshold() {
        return lowAccuracyThreshold;
    }

    public MetricsConfig setLowAccuracyThreshold(double lowAccuracyThreshold) {
        this.lowAccuracyThreshold = lowAccuracyThreshold;
        return this;
    }

    @Override
    public String toString() {
        return "MetricsConfig{minGroupSize=" + minGroupSize
            + ", calibrationBins=" + calibrationBins
            + ", maxIntersectionDepth=" + maxIntersectionDepth
            + ", minSubgroupSize=" + minSubgroupSize
            + ", topN=" + topN
            + ", lowAccuracyThreshold=" + lowAccuracyThreshold + "}";
    }
}
