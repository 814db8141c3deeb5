package io.telemetry.insights.pipeline.clients_daily_batch.tasklet;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayAggregate;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ClientsDailyRollup;
import io.telemetry.insights.pipeline.clients_daily_batch.writer.ClientsDailyWriter;
import io.telemetry.insights.pipeline.clients_daily_batch.writer.PingStagingArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.time.LocalDate;
import java.util.List;

public class ClientsDailyRollupTasklet implements Tasklet {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientsDailyRollupTasklet.class);

    private final PingStagingArea stagingArea;
    private final ClientsDailyRollup rollup;
    private final ClientsDailyWriter writer;
    private final LocalDate activityDate;

    public ClientsDailyRollupTasklet(PingStagingArea stagingArea,
                                     ClientsDailyRollup rollup,
                                     ClientsDailyWriter writer,
                                     LocalDate activityDate) {
        this.stagingArea = stagingArea;
        this.rollup = rollup;
        this.writer = writer;
        this.activityDate = activityDate;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        List<Ping> pings = stagingArea.snapshot();
        LOGGER.info("Starting clients daily rollup for {} over {} staged pings.", activityDate, pings.size());

        List<ClientDayAggregate> rows;
        try {
            rows = rollup.rollup(pings, activityDate);
        } catch (RuntimeException e) {
            LOGGER.error("Clients daily rollup for {} failed: {}", activityDate, e.getMessage(), e);
            throw e;
        }

        writer.replaceActivityDay(activityDate, rows);
        // kept until the day is written so a failed rollup can be retried
        stagingArea.clear();
        return RepeatStatus.FINISHED;
    }
}
