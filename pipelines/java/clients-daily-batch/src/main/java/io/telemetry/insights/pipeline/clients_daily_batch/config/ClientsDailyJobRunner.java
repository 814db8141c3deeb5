package io.telemetry.insights.pipeline.clients_daily_batch.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "clients-daily", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class ClientsDailyJobRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientsDailyJobRunner.class);

    private final JobLauncher jobLauncher;
    private final Job clientsDailyJob;

    public ClientsDailyJobRunner(JobLauncher jobLauncher, @Qualifier("clientsDailyJob") Job clientsDailyJob) {
        this.jobLauncher = jobLauncher;
        this.clientsDailyJob = clientsDailyJob;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String requestedDate = option(args, "activityDate");
        LocalDate activityDate = requestedDate == null
                ? LocalDate.now(ZoneOffset.UTC).minusDays(1)
                : LocalDate.parse(requestedDate);

        JobParametersBuilder parameters = new JobParametersBuilder()
                .addString("activityDate", activityDate.toString())
                .addLong("launchedAt", System.currentTimeMillis());
        String sampleId = option(args, "sampleId");
        if (sampleId != null) {
            parameters.addString("sampleId", sampleId);
        }

        LOGGER.info("Launching {} for activity date {}{}", clientsDailyJob.getName(), activityDate,
                sampleId == null ? "" : " and sample " + sampleId);
        String exitCode = jobLauncher.run(clientsDailyJob, parameters.toJobParameters()).getExitStatus().getExitCode();
        LOGGER.info("{} finished with exit code {}", clientsDailyJob.getName(), exitCode);
        if (!"COMPLETED".equals(exitCode)) {
            throw new IllegalStateException(clientsDailyJob.getName() + " for " + activityDate + " ended " + exitCode);
        }
    }

    private static @Nullable String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
