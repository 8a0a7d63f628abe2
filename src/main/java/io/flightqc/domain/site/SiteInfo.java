package io.flightqc.domain.site;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pilot and site identifiers parsed from a site root such as {@code /homes/JaneDoe/10001291-08-20-2025-ATT}.
 *
 * @param siteId first run of 8 to 10 digits found in any path segment, or {@code Unknown}
 * @param pilot segment following {@code homes}, or {@code Unknown}
 * @param path the original path
 * @since 0.1.0
 */
public record SiteInfo(String siteId, String pilot, String path) {
  public static final String UNKNOWN = "Unknown";

  private static final Pattern SITE_ID = Pattern.compile("(\\d{8,10})");

  public SiteInfo {
    siteId = Objects.requireNonNullElse(siteId, UNKNOWN);
    pilot = Objects.requireNonNullElse(pilot, UNKNOWN);
    path = Objects.requireNonNullElse(path, "");
  }

  /**
   * Parses a remote site root path.
   *
   * @param path remote path
   * @return parsed info; never {@code null}
   */
  public static SiteInfo parse(String path) {
    if (path == null) {
      return new SiteInfo(UNKNOWN, UNKNOWN, "");
    }
    String[] parts = trimSlashes(path).split("/");
    String pilot = null;
    for (int i = 0; i < parts.length - 1; i++) {
      if ("homes".equals(parts[i])) {
        pilot = parts[i + 1].isEmpty() ? null : parts[i + 1];
        break;
      }
    }
    String siteId = null;
    for (String part : parts) {
      Matcher m = SITE_ID.matcher(part);
      if (m.find()) {
        siteId = m.group(1);
        break;
      }
    }
    return new SiteInfo(siteId, pilot, path);
  }

  private static String trimSlashes(String path) {
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end);
  }
}
