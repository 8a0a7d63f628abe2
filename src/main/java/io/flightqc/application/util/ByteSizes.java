package io.flightqc.application.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Human-readable byte sizes with 1024-based units.
 *
 * @since 0.1.0
 */
public final class ByteSizes {
  private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

  private ByteSizes() {}

  /**
   * Formats a byte count, e.g. {@code 1536 -> "1.5 KB"}.
   *
   * @param bytes non-negative byte count
   * @return value rounded to at most two decimals plus unit; {@code "0 B"} for zero
   */
  public static String format(long bytes) {
    if (bytes <= 0) {
      return "0 B";
    }
    int unit = 0;
    BigDecimal value = BigDecimal.valueOf(bytes);
    BigDecimal base = BigDecimal.valueOf(1024);
    while (unit < UNITS.length - 1 && value.compareTo(base) >= 0) {
      value = value.divide(base);
      unit++;
    }
    BigDecimal rounded = value.setScale(2, RoundingMode.HALF_EVEN).stripTrailingZeros();
    return rounded.toPlainString() + " " + UNITS[unit];
  }
}
