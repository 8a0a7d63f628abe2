package io.flightqc.application.port;

import io.flightqc.domain.geo.GeoFix;
import java.util.Optional;

/**
 * <strong>What:</strong> Decodes an embedded geotag from the leading bytes of an image.
 * <p><strong>Contract:</strong> never throws for bad input. Missing tags, malformed values and truncated prefixes
 * all return {@link Optional#empty()}, which callers count as an image without GPS.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; workers share one
 * instance.</p>
 *
 * @since 0.1.0
 */
public interface GeotagExtractor {

  /**
   * Extracts the geotag.
   *
   * @param fileName image file name, used for format hints and diagnostics
   * @param prefix leading bytes of the file, possibly truncated
   * @return decoded fix, or empty when none is usable
   */
  Optional<GeoFix> extract(String fileName, byte[] prefix);
}
