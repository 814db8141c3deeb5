package io.telemetry.insights.pipeline.clients_daily_batch.config;

import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.model.RawPing;
import io.telemetry.insights.pipeline.clients_daily_batch.processor.PingParser;
import io.telemetry.insights.pipeline.clients_daily_batch.processor.PingParsingProcessor;
import io.telemetry.insights.pipeline.clients_daily_batch.reader.MainSummaryReaders;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ActivityDateConvention;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.AggregationSpecRegistry;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ClientsDailyRollup;
import io.telemetry.insights.pipeline.clients_daily_batch.tasklet.ClientsDailyRollupTasklet;
import io.telemetry.insights.pipeline.clients_daily_batch.tasklet.SchemaValidationTasklet;
import io.telemetry.insights.pipeline.clients_daily_batch.writer.ClientsDailyWriter;
import io.telemetry.insights.pipeline.clients_daily_batch.writer.PingStagingArea;
import io.telemetry.insights.pipeline.clients_daily_batch.writer.PingStagingWriter;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.LocalDate;

@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository(dataSourceRef = "batchDataSource", transactionManagerRef = "batchTransactionManager")
@EnableConfigurationProperties(ClientsDailyProperties.class)
public class ClientsDailyBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ClientsDailyProperties properties;

    public ClientsDailyBatchConfig(JobRepository jobRepository,
                                   @Qualifier("batchTransactionManager") PlatformTransactionManager transactionManager,
                                   ClientsDailyProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public PingSchema pingSchema() {
        return PingSchema.mainSummary();
    }

    @Bean
    public AggregationSpecRegistry aggregationSpecRegistry() {
        return AggregationSpecRegistry.mainSummaryDefaults();
    }

    @Bean
    public ActivityDateConvention activityDateConvention() {
        return ActivityDateConvention.of(properties.timezone());
    }

    @Bean
    public ClientsDailyRollup clientsDailyRollup(PingSchema pingSchema,
                                                 AggregationSpecRegistry aggregationSpecRegistry,
                                                 ActivityDateConvention activityDateConvention) {
        return new ClientsDailyRollup(pingSchema, aggregationSpecRegistry, activityDateConvention,
                properties.negativeProfileAge(), properties.parallelism());
    }

    @Bean
    public PingStagingArea pingStagingArea() {
        return new PingStagingArea();
    }

    @Bean
    @StepScope
    public JdbcCursorItemReader<RawPing> mainSummaryReader(
            @Qualifier("appDataSource") DataSource appDataSource,
            PingSchema pingSchema,
            @Value("#{jobParameters['activityDate']}") String activityDate,
            @Value("#{jobParameters['sampleId']}") @Nullable String sampleId
    ) {
        return MainSummaryReaders.forActivityDay(appDataSource, pingSchema, LocalDate.parse(activityDate),
                properties.lagDays(), sampleId);
    }

    @Bean
    public PingParsingProcessor pingParsingProcessor() {
        return new PingParsingProcessor(new PingParser());
    }

    @Bean
    public PingStagingWriter pingStagingWriter(PingStagingArea pingStagingArea) {
        return new PingStagingWriter(pingStagingArea);
    }

    @Bean
    public ClientsDailyWriter clientsDailyWriter(
            @Qualifier("appDataSource") DataSource appDataSource,
            @Qualifier("appTransactionManager") PlatformTransactionManager appTransactionManager,
            AggregationSpecRegistry aggregationSpecRegistry
    ) {
        return new ClientsDailyWriter(appDataSource, appTransactionManager, aggregationSpecRegistry);
    }

    @Bean
    public SchemaValidationTasklet schemaValidationTasklet(
            @Qualifier("appDataSource") DataSource appDataSource,
            PingSchema pingSchema,
            AggregationSpecRegistry aggregationSpecRegistry
    ) {
        return new SchemaValidationTasklet(appDataSource, pingSchema, aggregationSpecRegistry);
    }

    @Bean
    @StepScope
    public ClientsDailyRollupTasklet clientsDailyRollupTasklet(
            PingStagingArea pingStagingArea,
            ClientsDailyRollup clientsDailyRollup,
            ClientsDailyWriter clientsDailyWriter,
            @Value("#{jobParameters['activityDate']}") String activityDate
    ) {
        return new ClientsDailyRollupTasklet(pingStagingArea, clientsDailyRollup, clientsDailyWriter,
                LocalDate.parse(activityDate));
    }

    @Bean
    public Step schemaValidationStep(SchemaValidationTasklet schemaValidationTasklet) {
        return new StepBuilder("schemaValidationStep", jobRepository)
                .tasklet(schemaValidationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step pingStagingStep(
            JdbcCursorItemReader<RawPing> mainSummaryReader,
            PingParsingProcessor pingParsingProcessor,
            PingStagingWriter pingStagingWriter
    ) {
        return new StepBuilder("pingStagingStep", jobRepository)
                .<RawPing, Ping>chunk(properties.chunkSize())
                .reader(mainSummaryReader)
                .processor(pingParsingProcessor)
                .writer(pingStagingWriter)
                // staged pings live in memory, so a restarted job must stage them again
                .allowStartIfComplete(true)
                .build();
    }

    @Bean
    public Step rollupStep(ClientsDailyRollupTasklet clientsDailyRollupTasklet) {
        return new StepBuilder("rollupStep", jobRepository)
                .tasklet(clientsDailyRollupTasklet, transactionManager)
                .build();
    }

    @Bean
    public Job clientsDailyJob(Step schemaValidationStep, Step pingStagingStep, Step rollupStep) {
        return new JobBuilder("clientsDailyJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(schemaValidationStep)
                .next(pingStagingStep)
                .next(rollupStep)
                .build();
    }

}
