package com.fintech.gaps.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.gaps.detection.FrequencyInferencer;
import com.fintech.gaps.detection.GapDetector;
import com.fintech.gaps.detection.TimestampColumnLocator;
import com.fintech.gaps.domain.ResourceBudget;
import com.fintech.gaps.repair.ProcessingTimeEstimator;
import com.fintech.gaps.repair.RepairEngine;
import com.fintech.gaps.repair.RepairSettings;
import com.fintech.gaps.repair.StrategySelector;
import com.fintech.gaps.resource.JvmMemoryProbe;
import com.fintech.gaps.resource.MemoryProbe;
import com.fintech.gaps.resource.ResourceGuard;
import com.fintech.gaps.service.GapFixerOrchestrator;
import com.fintech.gaps.storage.BackupStore;
import com.fintech.gaps.storage.CsvTableCodec;
import com.fintech.gaps.storage.JsonTableCodec;
import com.fintech.gaps.storage.ParquetTableCodec;
import com.fintech.gaps.storage.TableStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for the engine components. Every component is a plain
 * class; this is the only place they are wired together.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryProbe memoryProbe() {
        return new JvmMemoryProbe();
    }

    @Bean
    public ResourceGuard resourceGuard(MemoryProbe memoryProbe, GapRepairProperties properties) {
        return new ResourceGuard(memoryProbe, properties.getMemory().getHeadroomRatio());
    }

    @Bean
    public TimestampColumnLocator timestampColumnLocator() {
        return new TimestampColumnLocator();
    }

    @Bean
    public GapDetector gapDetector(GapRepairProperties properties) {
        return new GapDetector(new FrequencyInferencer(), properties.getDetection().getToleranceMultiplier());
    }

    @Bean
    public StrategySelector strategySelector() {
        return new StrategySelector();
    }

    @Bean
    public RepairEngine repairEngine(ResourceGuard resourceGuard, GapRepairProperties properties) {
        GapRepairProperties.Repair repair = properties.getRepair();
        RepairSettings settings = new RepairSettings(
            repair.getChunkSize(),
            repair.getChunkOverlap(),
            repair.getSeasonalFillLimit(),
            repair.getRollingWindowMax()
        );
        return new RepairEngine(resourceGuard, settings);
    }

    @Bean
    public TableStore tableStore(ObjectMapper objectMapper) {
        return new TableStore(List.of(
            new ParquetTableCodec(),
            new CsvTableCodec(),
            new JsonTableCodec(objectMapper)
        ));
    }

    @Bean
    public BackupStore backupStore(Clock clock, GapRepairProperties properties) {
        return new BackupStore(clock, properties.getBackup().getDirectoryName());
    }

    @Bean
    public GapFixerOrchestrator gapFixerOrchestrator(
            TableStore tableStore,
            BackupStore backupStore,
            TimestampColumnLocator timestampColumnLocator,
            GapDetector gapDetector,
            StrategySelector strategySelector,
            RepairEngine repairEngine,
            ResourceGuard resourceGuard,
            GapRepairProperties properties,
            MeterRegistry meterRegistry) {
        GapFixerOrchestrator.Policy policy = new GapFixerOrchestrator.Policy(
            new ResourceBudget(properties.getMemory().getLimitMb()),
            properties.getBackup().isRequired(),
            properties.getRepair().getDefaultStrategy()
        );
        return new GapFixerOrchestrator(
            tableStore, backupStore, timestampColumnLocator, gapDetector, strategySelector,
            repairEngine, resourceGuard, new ProcessingTimeEstimator(), policy, meterRegistry);
    }
}
