package com.fintech.gaps.repair;

/**
 * Tunables for {@link RepairEngine}.
 *
 * @param chunkSize rows per window for the chunked strategy
 * @param chunkOverlap rows shared by consecutive windows, at least 1
 * @param seasonalFillLimit maximum consecutive grid steps the seasonal strategy fills in each direction
 * @param rollingWindowMax cap on the ml_forecast rolling window
 */
public record RepairSettings(int chunkSize, int chunkOverlap, int seasonalFillLimit, int rollingWindowMax) {

    public static final int DEFAULT_CHUNK_SIZE = 10_000;
    public static final int DEFAULT_CHUNK_OVERLAP = 1;
    public static final int DEFAULT_SEASONAL_FILL_LIMIT = 24;
    public static final int DEFAULT_ROLLING_WINDOW_MAX = 10;

    public RepairSettings {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("Chunk size must be at least 2, got " + chunkSize);
        }
        if (chunkOverlap < 1 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                "Chunk overlap must be in [1, chunkSize), got " + chunkOverlap);
        }
        if (seasonalFillLimit < 1) {
            throw new IllegalArgumentException("Seasonal fill limit must be positive, got " + seasonalFillLimit);
        }
        if (rollingWindowMax < 1) {
            throw new IllegalArgumentException("Rolling window cap must be positive, got " + rollingWindowMax);
        }
    }

    public static RepairSettings defaults() {
        return new RepairSettings(
            DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, DEFAULT_SEASONAL_FILL_LIMIT, DEFAULT_ROLLING_WINDOW_MAX);
    }
}
