package io.telemetry.insights.pipeline.clients_daily_batch.processor;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.MalformedPingException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.RawPing;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.SearchCountExtractor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.annotation.AfterStep;
import org.springframework.batch.core.annotation.BeforeStep;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.concurrent.atomic.AtomicLong;

public class PingParsingProcessor implements ItemProcessor<RawPing, Ping> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PingParsingProcessor.class);

    private final PingParser parser;
    private final AtomicLong droppedPings = new AtomicLong();

    public PingParsingProcessor(PingParser parser) {
        this.parser = parser;
    }

    public long getDroppedPings() {
        return droppedPings.get();
    }

    @Override
    public @Nullable Ping process(RawPing item) {
        Ping ping;
        try {
            ping = parser.parse(item);
        } catch (MalformedPingException e) {
            droppedPings.incrementAndGet();
            LOGGER.warn("Dropping malformed ping: {}", e.getMessage());
            return null;
        }
        return SearchCountExtractor.extract(ping);
    }

    @BeforeStep
    public void beforeStep(StepExecution stepExecution) {
        droppedPings.set(0);
    }

    @AfterStep
    public void afterStep(StepExecution stepExecution) {
        LOGGER.info("Ping parsing complete. {} rows read, {} dropped as malformed.",
                stepExecution.getReadCount(), droppedPings.get());
    }
}
