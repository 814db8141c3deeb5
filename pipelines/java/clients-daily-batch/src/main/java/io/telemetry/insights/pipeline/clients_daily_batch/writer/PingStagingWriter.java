package io.telemetry.insights.pipeline.clients_daily_batch.writer;

import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.annotation.AfterStep;
import org.springframework.batch.core.annotation.BeforeStep;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

public class PingStagingWriter implements ItemWriter<Ping> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PingStagingWriter.class);

    private final PingStagingArea stagingArea;

    public PingStagingWriter(PingStagingArea stagingArea) {
        this.stagingArea = stagingArea;
    }

    @Override
    public void write(Chunk<? extends Ping> chunk) {
        stagingArea.addAll(chunk.getItems());
    }

    // Leftovers from a failed run must not leak into this one.
    @BeforeStep
    public void beforeStep(StepExecution stepExecution) {
        stagingArea.clear();
    }

    @AfterStep
    public void afterStep(StepExecution stepExecution) {
        LOGGER.info("Staged {} pings for rollup.", stagingArea.size());
    }
}
