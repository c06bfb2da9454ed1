package com.repo.scorecard.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for scorecard aggregation.
 * Loaded from scorecard.yaml in the given directory or uses sensible defaults.
 */
public class ScorecardConfig {

    private static final Logger log = LoggerFactory.getLogger(ScorecardConfig.class);

    public static final String FILE_NAME = "scorecard.yaml";

    // Bot detection
    private List<String> extraBotPatterns = List.of();

    // Scoring defaults
    private double windowWeeks = 4.0;
    private int baselinePoints = 40;

    // Presentation defaults
    private int topReviewerLimit = 5;
    private int podiumSize = 3;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static ScorecardConfig load(Path directory) {
        ScorecardConfig config = new ScorecardConfig();
        Path configFile = directory.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                log.info("Loaded configuration from: {}", configFile);
            } catch (IOException e) {
                log.warn("Could not read config file {}, using defaults: {}", configFile, e.getMessage());
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static ScorecardConfig defaults() {
        return new ScorecardConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("bots") instanceof Map) {
            Map<String, Object> bots = (Map<String, Object>) data.get("bots");
            Object patterns = bots.get("extra_patterns");
            if (patterns instanceof List) {
                List<String> parsed = new ArrayList<>();
                for (Object pattern : (List<Object>) patterns) {
                    if (pattern != null) {
                        parsed.add(pattern.toString());
                    }
                }
                extraBotPatterns = List.copyOf(parsed);
            }
        }

        if (data.get("scoring") instanceof Map) {
            Map<String, Object> scoring = (Map<String, Object>) data.get("scoring");
            windowWeeks = getDouble(scoring, "window_weeks", windowWeeks);
            baselinePoints = getInt(scoring, "baseline_points", baselinePoints);
        }

        if (data.get("reviewers") instanceof Map) {
            Map<String, Object> reviewers = (Map<String, Object>) data.get("reviewers");
            topReviewerLimit = getInt(reviewers, "top_limit", topReviewerLimit);
        }

        if (data.get("report") instanceof Map) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");
            podiumSize = getInt(report, "podium_size", podiumSize);
        }

        if (windowWeeks <= 0) {
            log.warn("scoring.window_weeks must be positive, got {}; using 4", windowWeeks);
            windowWeeks = 4.0;
        }
        if (topReviewerLimit < 0) {
            topReviewerLimit = 0;
        }
        if (podiumSize < 0) {
            log.warn("report.podium_size must not be negative, got {}; using 3", podiumSize);
            podiumSize = 3;
        }
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    // === Getters ===

    public List<String> getExtraBotPatterns() {
        return extraBotPatterns;
    }

    public double getWindowWeeks() {
        return windowWeeks;
    }

    public int getBaselinePoints() {
        return baselinePoints;
    }

    public int getTopReviewerLimit() {
        return topReviewerLimit;
    }

    public int getPodiumSize() {
        return podiumSize;
    }

    public BotFilter botFilter() {
        return new BotFilter(extraBotPatterns);
    }
}
