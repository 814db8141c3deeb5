package io.telemetry.insights.pipeline.clients_daily_batch;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.LocalDate;

/**
 * In-memory H2 database with the {@code main_summary} and {@code clients_daily} tables.
 */
public final class TestDatabase implements AutoCloseable {

    private static final String SQL_INSERT_PING =
            "INSERT INTO main_summary (client_id, document_id, submission_date, sample_id, subsession_start_date, "
                    + "session_start_date, profile_creation_date, search_counts, os, sync_configured, first_paint, "
                    + "crashes_detected_content) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final EmbeddedDatabase dataSource;
    private final JdbcTemplate jdbcTemplate;

    public TestDatabase() {
        this.dataSource = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/main_summary.sql")
                .addScript("db/clients_daily.sql")
                .build();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public EmbeddedDatabase dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public DataSourceTransactionManager transactionManager() {
        return new DataSourceTransactionManager(dataSource);
    }

    public RowBuilder row(String clientId, LocalDate submissionDate, String subsessionStartDate) {
        return new RowBuilder(clientId, submissionDate, subsessionStartDate);
    }

    @Override
    public void close() {
        dataSource.shutdown();
    }

    /**
     * A {@code main_summary} row; unset columns are inserted as null.
     */
    public final class RowBuilder {

        private final String clientId;
        private final LocalDate submissionDate;
        private final String subsessionStartDate;
        private String documentId;
        private String sampleId = "42";
        private String sessionStartDate;
        private Long profileCreationDate;
        private String searchCounts;
        private String os;
        private Boolean syncConfigured;
        private Long firstPaint;
        private Long crashesDetectedContent;

        private RowBuilder(String clientId, LocalDate submissionDate, String subsessionStartDate) {
            this.clientId = clientId;
            this.submissionDate = submissionDate;
            this.subsessionStartDate = subsessionStartDate;
        }

        public RowBuilder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public RowBuilder sampleId(String sampleId) {
            this.sampleId = sampleId;
            return this;
        }

        public RowBuilder sessionStart(String sessionStartDate) {
            this.sessionStartDate = sessionStartDate;
            return this;
        }

        public RowBuilder profileCreatedOnDay(long dayCount) {
            this.profileCreationDate = dayCount;
            return this;
        }

        public RowBuilder searchCounts(String json) {
            this.searchCounts = json;
            return this;
        }

        public RowBuilder os(String os) {
            this.os = os;
            return this;
        }

        public RowBuilder syncConfigured(Boolean syncConfigured) {
            this.syncConfigured = syncConfigured;
            return this;
        }

        public RowBuilder firstPaint(long firstPaint) {
            this.firstPaint = firstPaint;
            return this;
        }

        public RowBuilder crashes(long crashesDetectedContent) {
            this.crashesDetectedContent = crashesDetectedContent;
            return this;
        }

        public void insert() {
            jdbcTemplate.update(SQL_INSERT_PING, clientId, documentId, submissionDate, sampleId, subsessionStartDate,
                    sessionStartDate, profileCreationDate, searchCounts, os, syncConfigured, firstPaint,
                    crashesDetectedContent);
        }
    }
}
