package io.b2mash.b2b.gobdvault.retention;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retention rules bound from {@code gobd.retention.*}.
 *
 * @param periods statutory years per category; missing categories fall back to the defaults
 * @param gracePeriodDays days after expiry during which deletion is still refused
 * @param nearingExpirationDays window before expiry counted as "nearing expiration"
 * @param schedule cron expression of the nightly retention job
 */
@ConfigurationProperties("gobd.retention")
public record RetentionProperties(
    Map<RetentionCategory, Integer> periods,
    Integer gracePeriodDays,
    Integer nearingExpirationDays,
    String schedule) {

  public static final int DEFAULT_GRACE_PERIOD_DAYS = 90;
  public static final int DEFAULT_NEARING_EXPIRATION_DAYS = 90;

  private static final Map<RetentionCategory, Integer> DEFAULT_PERIODS =
      Map.of(
          RetentionCategory.TAX_RELEVANT, 10,
          RetentionCategory.BUSINESS, 6,
          RetentionCategory.CORRESPONDENCE, 6,
          RetentionCategory.HR, 10,
          RetentionCategory.LEGAL, 30,
          RetentionCategory.TEMPORARY, 1);

  public RetentionProperties {
    var merged = new EnumMap<RetentionCategory, Integer>(DEFAULT_PERIODS);
    if (periods != null) {
      periods.forEach(
          (category, years) -> {
            if (years == null || years < 0) {
              throw new IllegalStateException(
                  "gobd.retention.periods." + category + " must be a non-negative number of years");
            }
            merged.put(category, years);
          });
    }
    periods = Map.copyOf(merged);
    if (gracePeriodDays == null) {
      gracePeriodDays = DEFAULT_GRACE_PERIOD_DAYS;
    }
    if (nearingExpirationDays == null) {
      nearingExpirationDays = DEFAULT_NEARING_EXPIRATION_DAYS;
    }
    if (schedule == null || schedule.isBlank()) {
      schedule = "0 0 2 * * *";
    }
  }

  /** Statutory defaults, as used when nothing is configured. */
  public static RetentionProperties defaults() {
    return new RetentionProperties(null, null, null, null);
  }

  public int yearsFor(RetentionCategory category) {
    return periods.get(category);
  }

  /** {@code archivedAt} plus the category's years, in calendar years on the UTC calendar. */
  public Instant retentionEndDate(RetentionCategory category, Instant archivedAt) {
    return archivedAt.atZone(ZoneOffset.UTC).plusYears(yearsFor(category)).toInstant();
  }
}
