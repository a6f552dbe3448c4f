package com.example.reme.storage;

/** User-tunable knobs. Null fields fall back to the defaults below. */
public class Settings {
    public static final int DEFAULT_CACHE_TTL_HOURS = 24;
    public static final int DEFAULT_RECENT_DAYS = 7;
    public static final int DEFAULT_MIN_HISTORY = 3;
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.6;
    public static final double DEFAULT_MATCH_THRESHOLD = 0.5;

    public String dataDirectory;
    public Integer cacheTtlHours;
    public Integer recentDaysExcluded;
    public Integer minHistoryForScoring;
    public Double fuzzyThreshold;
    public Double searchMatchThreshold;
    // Seed the catalog and recipes from the bundled sample data on first run
    public Boolean seedSampleData;

    public int cacheTtlHours() { return cacheTtlHours != null ? cacheTtlHours : DEFAULT_CACHE_TTL_HOURS; }
    public int recentDaysExcluded() { return recentDaysExcluded != null ? recentDaysExcluded : DEFAULT_RECENT_DAYS; }
    public int minHistoryForScoring() { return minHistoryForScoring != null ? minHistoryForScoring : DEFAULT_MIN_HISTORY; }
    public double fuzzyThreshold() { return fuzzyThreshold != null ? fuzzyThreshold : DEFAULT_FUZZY_THRESHOLD; }
    public double searchMatchThreshold() { return searchMatchThreshold != null ? searchMatchThreshold : DEFAULT_MATCH_THRESHOLD; }
    public boolean seedSampleData() { return seedSampleData == null || seedSampleData; }
}
