package com.fintech.gaps.service;

import com.fintech.gaps.config.GapRepairProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch at startup over the files listed in {@code gap-repair.batch.paths}.
 * Does nothing when the list is empty.
 */
@Component
public class BatchRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final GapFixerOrchestrator orchestrator;
    private final GapRepairProperties properties;

    private BatchSummary lastSummary;

    public BatchRunner(GapFixerOrchestrator orchestrator, GapRepairProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        GapRepairProperties.Batch batch = properties.getBatch();
        if (batch.getPaths().isEmpty()) {
            log.debug("No batch paths configured, skipping startup batch");
            return;
        }
        List<Path> paths = batch.getPaths().stream().map(Path::of).toList();
        lastSummary = orchestrator.repairBatch(paths, batch.getStrategy(), batch.isShowProgress());
        lastSummary.results().stream()
            .filter(r -> !r.success())
            .forEach(r -> log.warn("Batch failure: {} [{}] {}", r.path(), r.errorType(), r.error()));
    }

    /** Summary of the startup batch, or null if none ran. */
    public BatchSummary getLastSummary() {
        return lastSummary;
    }
}
