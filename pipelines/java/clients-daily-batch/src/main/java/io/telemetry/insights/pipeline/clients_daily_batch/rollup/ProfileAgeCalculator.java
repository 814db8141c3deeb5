package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public class ProfileAgeCalculator {

    private final ActivityDateConvention convention;
    private final NegativeProfileAgePolicy negativeAgePolicy;

    public ProfileAgeCalculator(ActivityDateConvention convention, NegativeProfileAgePolicy negativeAgePolicy) {
        this.convention = convention;
        this.negativeAgePolicy = negativeAgePolicy;
    }

    /**
     * @param creationDayCount days since 1970-01-01; null or negative means unknown
     */
    public ProfileAge calculate(@Nullable Long creationDayCount, LocalDate activityDate) {
        if (creationDayCount == null || creationDayCount < 0) {
            return new ProfileAge(null, null);
        }
        LocalDate creationDate = convention.dateOfEpochDay(creationDayCount);
        long age = ChronoUnit.DAYS.between(creationDate, activityDate);
        if (age < 0 && negativeAgePolicy == NegativeProfileAgePolicy.NULL) {
            return new ProfileAge(creationDate, null);
        }
        return new ProfileAge(creationDate, Math.toIntExact(age));
    }

    public record ProfileAge(@Nullable LocalDate creationDate, @Nullable Integer ageInDays) {
    }
}
