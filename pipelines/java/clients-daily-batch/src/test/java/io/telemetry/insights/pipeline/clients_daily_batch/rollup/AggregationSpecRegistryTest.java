package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.SchemaViolationException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregationSpecRegistryTest {

    private static final PingSchema SCHEMA = PingSchema.builder()
            .column("os", ColumnType.STRING)
            .column("first_paint", ColumnType.LONG)
            .column("sync_configured", ColumnType.BOOLEAN)
            .build();

    @Test
    void testMainSummaryDefaults_ValidAgainstMainSummarySchema() {
        AggregationSpecRegistry registry = AggregationSpecRegistry.mainSummaryDefaults();

        assertDoesNotThrow(() -> registry.validate(ClientsDailyRollup.groupedSchema(PingSchema.mainSummary())));
    }

    @Test
    void testMainSummaryDefaults_ContainsCoreRollupColumns() {
        Set<String> outputs = new HashSet<>();
        for (AggregationSpec spec : AggregationSpecRegistry.mainSummaryDefaults().specs()) {
            outputs.add(spec.outputColumn());
        }

        assertTrue(outputs.contains("search_count_all_sum"));
        assertTrue(outputs.contains("sync_configured"));
        assertTrue(outputs.contains("first_paint_mean"));
        assertTrue(outputs.contains("sessions_started_on_this_day"));
        assertTrue(outputs.contains("scalar_parent_browser_engagement_unique_domains_count_max"));
        assertTrue(outputs.contains("scalar_parent_browser_engagement_unique_domains_count_mean"));
    }

    @Test
    void testMainSummaryDefaults_NotValidAgainstRawInputSchema() {
        // search counts and the session flag only exist after extraction and grouping
        AggregationSpecRegistry registry = AggregationSpecRegistry.mainSummaryDefaults();

        assertThrows(SchemaViolationException.class, () -> registry.validate(PingSchema.mainSummary()));
    }

    @Test
    void testValidate_MissingSourceColumn_Throws() {
        AggregationSpecRegistry registry = AggregationSpecRegistry.builder()
                .sum("crashes_detected_content_sum", "crashes_detected_content")
                .build();

        SchemaViolationException e = assertThrows(SchemaViolationException.class, () -> registry.validate(SCHEMA));
        assertTrue(e.getMessage().contains("crashes_detected_content"));
    }

    @Test
    void testValidate_NumericKindOnStringColumn_Throws() {
        AggregationSpecRegistry registry = AggregationSpecRegistry.builder()
                .mean("os_mean", "os")
                .build();

        assertThrows(SchemaViolationException.class, () -> registry.validate(SCHEMA));
    }

    @Test
    void testValidate_FirstAndCountAcceptAnyType() {
        AggregationSpecRegistry registry = AggregationSpecRegistry.builder()
                .first("os", "os")
                .first("sync_configured", "sync_configured")
                .count("sync_configured_count", "sync_configured")
                .max("first_paint_max", "first_paint")
                .build();

        assertDoesNotThrow(() -> registry.validate(SCHEMA));
        assertEquals(4, registry.size());
    }

    @Test
    void testBuilder_DuplicateOutputColumn_Throws() {
        AggregationSpecRegistry.Builder builder = AggregationSpecRegistry.builder().first("os", "os");

        assertThrows(SchemaViolationException.class, () -> builder.first("os", "os"));
    }

    @Test
    void testSpecs_AreImmutable() {
        AggregationSpecRegistry registry = AggregationSpecRegistry.builder().first("os", "os").build();

        assertThrows(UnsupportedOperationException.class,
                () -> registry.specs().add(new AggregationSpec("x", "os", AggregationKind.COUNT)));
    }
}
