package com.fintech.gaps.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the gap repair engine.
 * Maps to 'gap-repair.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "gap-repair")
public class GapRepairProperties {

    @Valid
    private Memory memory = new Memory();
    @Valid
    private Detection detection = new Detection();
    @Valid
    private Repair repair = new Repair();
    @Valid
    private Backup backup = new Backup();
    @Valid
    private Batch batch = new Batch();

    @Data
    public static class Memory {
        @Min(1)
        private long limitMb = 6144L;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double headroomRatio = 0.8;
    }

    @Data
    public static class Detection {
        @DecimalMin("1.0")
        private double toleranceMultiplier = 1.5;
    }

    @Data
    public static class Repair {
        @NotBlank
        private String defaultStrategy = "auto";

        @Min(2)
        private int chunkSize = 10_000;

        @Min(1)
        private int chunkOverlap = 1;

        @Min(1)
        private int seasonalFillLimit = 24;

        @Min(1)
        private int rollingWindowMax = 10;
    }

    @Data
    public static class Backup {
        private boolean required = false;

        @NotBlank
        private String directoryName = "backups";
    }

    @Data
    public static class Batch {
        private List<String> paths = new ArrayList<>();

        @NotBlank
        private String strategy = "auto";

        private boolean showProgress = false;
    }
}
