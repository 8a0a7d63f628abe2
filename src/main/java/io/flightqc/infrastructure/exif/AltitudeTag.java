package io.flightqc.infrastructure.exif;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the altitude precedence list.
 *
 * <p>Accepted forms are {@code xmp:<prefix>:<name>} for an XMP property (for example
 * {@code xmp:drone-dji:RelativeAltitude}) and {@code gps:altitude} for the EXIF GPS altitude.</p>
 *
 * @param source where the value is read from
 * @param property qualified XMP property name; empty for GPS
 */
public record AltitudeTag(Source source, String property) {

  /** Metadata block holding the altitude value. */
  public enum Source {
    XMP,
    GPS
  }

  public AltitudeTag {
    Objects.requireNonNull(source, "source");
    property = Objects.requireNonNullElse(property, "");
  }

  /**
   * Parses one precedence entry.
   *
   * @param entry entry text
   * @return parsed tag
   * @throws IllegalArgumentException for unknown forms
   */
  public static AltitudeTag parse(String entry) {
    String trimmed = entry == null ? "" : entry.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.equals("gps:altitude")) {
      return new AltitudeTag(Source.GPS, "");
    }
    if (lower.startsWith("xmp:") && trimmed.indexOf(':', 4) > 4 && !trimmed.endsWith(":")) {
      return new AltitudeTag(Source.XMP, trimmed.substring(4));
    }
    throw new IllegalArgumentException(
        "altitude source must be gps:altitude or xmp:<prefix>:<name> (was " + entry + ")");
  }

  /**
   * Parses an ordered precedence list.
   *
   * @param entries entries in priority order
   * @return parsed tags in the same order
   */
  public static List<AltitudeTag> parseAll(List<String> entries) {
    List<AltitudeTag> tags = new ArrayList<>(entries.size());
    for (String entry : entries) {
      tags.add(parse(entry));
    }
    return List.copyOf(tags);
  }

  @Override
  public String toString() {
    return source == Source.GPS ? "gps:altitude" : "xmp:" + property;
  }
}
