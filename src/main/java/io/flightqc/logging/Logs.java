package io.flightqc.logging;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Logging hygiene helpers shared by the pool, scheduler and CLI.
 * <p><strong>Why:</strong> Keeps secrets and oversized remote error text out of operator logs and gives every
 * stage the same MDC keys.
 * <p><strong>Thread-safety:</strong> Stateless; MDC access is per-thread by definition.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** MDC key naming the running pipeline (e.g. {@code analyze}). */
  public static final String MDC_PIPELINE = "pipeline";
  /** MDC key holding the site id under analysis. */
  public static final String MDC_SITE = "site";
  /** MDC key holding the folder currently being extracted. */
  public static final String MDC_FOLDER = "folder";

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // back off to a code point boundary
    while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
      end--;
    }
    return new String(bytes, 0, end, StandardCharsets.UTF_8)
        + "... (truncated, " + end + " of " + bytes.length + ")";
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent call sites
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Describes an exception for a single log line: simple class name plus truncated message.
   *
   * @param error failure to describe; may be {@code null}
   * @return compact description
   */
  public static String describe(Throwable error) {
    if (error == null) {
      return NULL_PLACEHOLDER;
    }
    String message = error.getMessage();
    String name = error.getClass().getSimpleName();
    return message == null ? name : name + ": " + truncate(message, 256);
  }

  /**
   * Wraps a task so it runs with the supplied MDC context and restores the worker's previous context.
   *
   * @param context MDC snapshot captured on the submitting thread; may be {@code null}
   * @param task task to run
   * @return wrapped task
   */
  public static Runnable withMdc(Map<String, String> context, Runnable task) {
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      if (context == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(context);
      }
      try {
        task.run();
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    };
  }
}
