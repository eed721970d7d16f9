package io.b2mash.timeledger.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Converts start/end instants into durations.
 *
 * <p>Rounding is half-up at the 30-second boundary: {@code minutes = whole minutes + (leftover
 * seconds >= 30 ? 1 : 0)}. Negative intervals (end before start, i.e. clock skew) clamp to zero.
 * {@link #billableMinutes(Instant, Instant)} additionally records at least one minute for any
 * session that was started and stopped.
 */
public final class DurationPolicy {

  public static final int MINIMUM_BILLABLE_MINUTES = 1;

  private static final long SECONDS_PER_MINUTE = 60;
  private static final long ROUND_UP_AT_SECONDS = 30;
  private static final long MINUTES_PER_HOUR = 60;

  private DurationPolicy() {}

  /** Whole seconds between the two instants, never negative. For live display only. */
  public static long elapsedSeconds(Instant start, Instant end) {
    long seconds = Duration.between(start, end).getSeconds();
    return Math.max(0, seconds);
  }

  /** Elapsed time rounded half-up to whole minutes, floored at zero. */
  public static int roundedMinutes(Instant start, Instant end) {
    return Math.toIntExact(roundHalfUp(elapsedSeconds(start, end)));
  }

  /** Minutes recorded when a session is stopped: the rounded duration, but never below one. */
  public static int billableMinutes(Instant start, Instant end) {
    return Math.max(MINIMUM_BILLABLE_MINUTES, roundedMinutes(start, end));
  }

  /**
   * Converts a legacy seconds-denominated value to minutes with the same half-up rule. The sign is
   * kept and the magnitude rounded, so -90 becomes -2. No minimum is applied.
   */
  public static int minutesFromLegacySeconds(long seconds) {
    long minutes = roundHalfUp(Math.abs(seconds));
    return Math.toIntExact(seconds < 0 ? -minutes : minutes);
  }

  /** Formats seconds as {@code HH:MM:SS}; hours are not wrapped at 24. */
  public static String formatHms(long totalSeconds) {
    long seconds = Math.max(0, totalSeconds);
    return String.format(
        "%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % SECONDS_PER_MINUTE);
  }

  /** Formats a signed minute total as {@code HH:MM}, prefixed with {@code -} when negative. */
  public static String formatHoursMinutes(long totalMinutes) {
    long magnitude = Math.abs(totalMinutes);
    String formatted =
        String.format("%02d:%02d", magnitude / MINUTES_PER_HOUR, magnitude % MINUTES_PER_HOUR);
    return totalMinutes < 0 ? "-" + formatted : formatted;
  }

  private static long roundHalfUp(long seconds) {
    long whole = seconds / SECONDS_PER_MINUTE;
    long leftover = seconds % SECONDS_PER_MINUTE;
    return leftover >= ROUND_UP_AT_SECONDS ? whole + 1 : whole;
  }
}
