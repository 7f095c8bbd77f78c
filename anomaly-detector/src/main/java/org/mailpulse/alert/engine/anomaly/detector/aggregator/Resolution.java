package org.mailpulse.alert.engine.anomaly.detector.aggregator;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/** Bucket width, picked from the span of the aggregated range. All boundaries are UTC. */
public enum Resolution {
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY;

  static final long HOURLY_MAX_SPAN_DAYS = 30;
  static final long DAILY_MAX_SPAN_DAYS = 365;
  static final long WEEKLY_MAX_SPAN_DAYS = 3650;

  public static Resolution fromSpan(Duration span) {
    long days = span.toDays();
    if (days < HOURLY_MAX_SPAN_DAYS) {
      return HOURLY;
    }
    if (days <= DAILY_MAX_SPAN_DAYS) {
      return DAILY;
    }
    if (days <= WEEKLY_MAX_SPAN_DAYS) {
      return WEEKLY;
    }
    return MONTHLY;
  }

  /** Start of the bucket containing the timestamp. */
  public Instant truncate(Instant timestamp) {
    switch (this) {
      case HOURLY:
        return timestamp.truncatedTo(ChronoUnit.HOURS);
      case DAILY:
        return timestamp.truncatedTo(ChronoUnit.DAYS);
      case WEEKLY:
        return toDate(timestamp)
            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
      case MONTHLY:
        return toDate(timestamp).withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
      default:
        throw new UnsupportedOperationException("Unsupported resolution: " + this);
    }
  }

  /** Start of the bucket following the one starting at {@code bucketStart}. */
  public Instant next(Instant bucketStart) {
    switch (this) {
      case HOURLY:
        return bucketStart.plus(1, ChronoUnit.HOURS);
      case DAILY:
        return bucketStart.plus(1, ChronoUnit.DAYS);
      case WEEKLY:
        return bucketStart.plus(7, ChronoUnit.DAYS);
      case MONTHLY:
        return toDate(bucketStart).plusMonths(1).atStartOfDay(ZoneOffset.UTC).toInstant();
      default:
        throw new UnsupportedOperationException("Unsupported resolution: " + this);
    }
  }

  /** Hourly and daily series carry a bucket for every slot, empty or not. */
  public boolean isZeroFilled() {
    return this == HOURLY || this == DAILY;
  }

  private static LocalDate toDate(Instant timestamp) {
    return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
  }
}
