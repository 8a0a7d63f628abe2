package io.flightqc.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by FlightQC configuration and CLI layers.
 * <p><strong>Why:</strong> Ensures host names, user names, remote paths and list-valued settings are sanitized
 * before the SFTP adapter or the extractor sees them.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Validate environment variable names used to locate secrets.</li>
 *   <li>Split comma separated list settings into trimmed, non-empty tokens.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern ENV_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an environment variable name such as {@code FLIGHTQC_SECRET}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate variable name
   * @return the validated name
   * @throws IllegalArgumentException if the name is blank or uses characters outside {@code [A-Za-z0-9_]}
   */
  public static String requireEnvName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!ENV_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter or underscore and contain only letters, digits, or underscore"));
    }
    return sanitized;
  }

  /**
   * Splits a comma separated setting into trimmed, non-empty tokens.
   *
   * @param name logical parameter name for diagnostics
   * @param value comma separated text, e.g. {@code "jpg, jpeg,png"}
   * @param lowerCase whether tokens are normalised to lower case
   * @return immutable list of tokens in input order
   * @throws IllegalArgumentException if the value contains no tokens
   */
  public static List<String> splitList(String name, String value, boolean lowerCase) {
    String sanitized = requireNonBlank(name, value);
    List<String> tokens = new ArrayList<>();
    for (String part : sanitized.split(",")) {
      String token = part.trim();
      if (token.isEmpty()) {
        continue;
      }
      tokens.add(lowerCase ? token.toLowerCase(Locale.ROOT) : token);
    }
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must list at least one value"));
    }
    return List.copyOf(tokens);
  }

  /**
   * Validates that a value is printable ASCII and at most {@code maxLength} characters.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength inclusive upper bound on length
   * @return the trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or contains other characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
