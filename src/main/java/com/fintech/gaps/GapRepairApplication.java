package com.fintech.gaps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gap Repair Engine
 *
 * Detects and repairs missing periods in time-series data files.
 *
 * Key Features:
 * - Sampling frequency inference snapped to a canonical ladder (1m .. 1w)
 * - Gap detection with data-quality grading
 * - Eleven repair strategies, chosen automatically from the gap profile or named explicitly
 * - Parquet, CSV and JSON files repaired in place behind a timestamped backup
 * - Hard memory budget with reclamation between files
 * - Micrometer metrics for files processed, failed and gaps fixed
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class GapRepairApplication {

    public static void main(String[] args) {
        SpringApplication.run(GapRepairApplication.class, args);
    }
}
