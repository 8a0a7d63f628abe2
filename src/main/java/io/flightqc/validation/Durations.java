package io.flightqc.validation;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly duration settings: {@code 500ms}, {@code 30s}, {@code 5m}, or bare seconds.
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern DURATION = Pattern.compile("^(\\d+)\\s*(ms|s|m)?$");

  private Durations() {
    // Utility
  }

  /**
   * Parses a strictly positive duration.
   *
   * @param name logical parameter name for diagnostics
   * @param value text such as {@code 30s}
   * @return parsed duration
   * @throws IllegalArgumentException if the text is malformed or the duration is zero
   */
  public static Duration parsePositive(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    Matcher m = DURATION.matcher(sanitized);
    if (!m.matches()) {
      throw new IllegalArgumentException(
          name + " must be a duration like 500ms, 30s, 5m or a number of seconds (was " + value + ")");
    }
    long amount;
    try {
      amount = Long.parseLong(m.group(1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " is out of range (was " + value + ")", ex);
    }
    String unit = m.group(2) == null ? "s" : m.group(2);
    Duration parsed = switch (unit) {
      case "ms" -> Duration.ofMillis(amount);
      case "m" -> Duration.ofMinutes(amount);
      default -> Duration.ofSeconds(amount);
    };
    if (parsed.isZero()) {
      throw new IllegalArgumentException(name + " must be greater than zero");
    }
    return parsed;
  }

  /**
   * Formats a duration in the shortest unit that represents it exactly.
   *
   * @param duration duration to format
   * @return text accepted by {@link #parsePositive(String, String)}
   */
  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 60_000L == 0) {
      return (millis / 60_000L) + "m";
    }
    if (millis % 1_000L == 0) {
      return (millis / 1_000L) + "s";
    }
    return millis + "ms";
  }
}
