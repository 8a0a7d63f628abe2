package io.flightqc.infrastructure.exif;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.lang.ByteArrayReader;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifReader;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.xmp.XmpDirectory;
import com.drew.metadata.xmp.XmpReader;
import io.flightqc.application.port.GeotagExtractor;
import io.flightqc.domain.geo.Coordinates;
import io.flightqc.domain.geo.GeoFix;
import io.flightqc.logging.Logs;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GeotagExtractor} backed by the metadata-extractor library.
 * <p><strong>Formats:</strong>
 * <ul>
 *   <li>JPEG: APP1 segments inside the prefix, the last one possibly cut short, are fed to the EXIF and XMP
 *   readers; offsets past the cut are ignored.</li>
 *   <li>TIFF and DNG: the prefix is parsed in place as a TIFF structure; offsets past its end are ignored.</li>
 *   <li>Anything else: best effort through {@link ImageMetadataReader}.</li>
 * </ul>
 * <p><strong>Altitude:</strong> sources are tried in the configured order; the first finite value wins and is
 * converted from metres to feet. No source means altitude 0.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration; readers are created per call.</p>
 *
 * @since 0.1.0
 */
public final class ExifGeotagExtractor implements GeotagExtractor {
  private static final Logger log = LoggerFactory.getLogger(ExifGeotagExtractor.class);
  private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
  private static final int MIN_PREFIX = 8;

  private final List<AltitudeTag> altitudePrecedence;

  public ExifGeotagExtractor(List<AltitudeTag> altitudePrecedence) {
    this.altitudePrecedence = List.copyOf(Objects.requireNonNull(altitudePrecedence, "altitudePrecedence"));
  }

  /**
   * Builds an extractor from textual precedence entries such as {@code xmp:drone-dji:RelativeAltitude}.
   *
   * @param entries entries in priority order
   * @return extractor
   * @throws IllegalArgumentException when an entry is malformed
   */
  public static ExifGeotagExtractor fromPrecedence(List<String> entries) {
    return new ExifGeotagExtractor(AltitudeTag.parseAll(entries));
  }

  @Override
  public Optional<GeoFix> extract(String fileName, byte[] prefix) {
    if (prefix == null || prefix.length < MIN_PREFIX) {
      return Optional.empty();
    }
    Metadata metadata;
    try {
      metadata = read(prefix);
    } catch (ImageProcessingException | IOException | RuntimeException ex) {
      log.debug("No readable metadata in {}: {}", fileName, Logs.describe(ex));
      return Optional.empty();
    }
    return decode(fileName, metadata);
  }

  private Metadata read(byte[] prefix) throws ImageProcessingException, IOException {
    Metadata metadata = new Metadata();
    if (JpegSegmentScanner.isJpeg(prefix)) {
      List<byte[]> segments = JpegSegmentScanner.app1Segments(prefix);
      new ExifReader().readJpegSegments(segments, metadata, JpegSegmentType.APP1);
      new XmpReader().readJpegSegments(segments, metadata, JpegSegmentType.APP1);
      return metadata;
    }
    if (isTiff(prefix)) {
      new ExifReader().extract(new ByteArrayReader(prefix), metadata);
      return metadata;
    }
    return ImageMetadataReader.readMetadata(new ByteArrayInputStream(prefix));
  }

  private Optional<GeoFix> decode(String fileName, Metadata metadata) {
    GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
    if (gps == null) {
      return Optional.empty();
    }
    OptionalDouble latitude = coordinate(gps, GpsDirectory.TAG_LATITUDE, GpsDirectory.TAG_LATITUDE_REF);
    OptionalDouble longitude = coordinate(gps, GpsDirectory.TAG_LONGITUDE, GpsDirectory.TAG_LONGITUDE_REF);
    if (latitude.isEmpty() || longitude.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new GeoFix(
          latitude.getAsDouble(), longitude.getAsDouble(), altitudeFeet(metadata, gps), capturedAt(metadata)));
    } catch (IllegalArgumentException ex) {
      log.debug("Discarding implausible geotag in {}: {}", fileName, ex.getMessage());
      return Optional.empty();
    }
  }

  private static OptionalDouble coordinate(GpsDirectory gps, int valueTag, int refTag) {
    Rational[] parts = gps.getRationalArray(valueTag);
    String reference = gps.getString(refTag);
    if (parts == null || parts.length == 0 || reference == null) {
      return OptionalDouble.empty();
    }
    double degrees = parts[0].doubleValue();
    double minutes = parts.length > 1 ? parts[1].doubleValue() : 0d;
    double seconds = parts.length > 2 ? parts[2].doubleValue() : 0d;
    return Coordinates.toDecimalDegrees(degrees, minutes, seconds, reference);
  }

  private double altitudeFeet(Metadata metadata, GpsDirectory gps) {
    for (AltitudeTag tag : altitudePrecedence) {
      OptionalDouble metres = tag.source() == AltitudeTag.Source.GPS
          ? gpsAltitude(gps)
          : xmpValue(metadata, tag.property());
      if (metres.isPresent()) {
        return Coordinates.metresToFeet(metres.getAsDouble());
      }
    }
    return 0d;
  }

  private static OptionalDouble gpsAltitude(GpsDirectory gps) {
    Rational altitude = gps.getRational(GpsDirectory.TAG_ALTITUDE);
    if (altitude == null || altitude.getDenominator() == 0) {
      return OptionalDouble.empty();
    }
    double value = altitude.doubleValue();
    Integer reference = gps.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
    // reference 1 means below sea level
    return OptionalDouble.of(reference != null && reference == 1 ? -value : value);
  }

  private static OptionalDouble xmpValue(Metadata metadata, String property) {
    for (XmpDirectory xmp : metadata.getDirectoriesOfType(XmpDirectory.class)) {
      for (Map.Entry<String, String> entry : xmp.getXmpProperties().entrySet()) {
        if (!entry.getKey().equalsIgnoreCase(property) || entry.getValue() == null) {
          continue;
        }
        try {
          double value = Double.parseDouble(entry.getValue().trim());
          if (Double.isFinite(value)) {
            return OptionalDouble.of(value);
          }
        } catch (NumberFormatException ex) {
          log.debug("Ignoring non-numeric XMP {}={}", property, entry.getValue());
        }
      }
    }
    return OptionalDouble.empty();
  }

  private static Optional<LocalDateTime> capturedAt(Metadata metadata) {
    ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
    if (exif == null) {
      return Optional.empty();
    }
    String raw = exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDateTime.parse(raw.trim(), EXIF_DATE_TIME));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  private static boolean isTiff(byte[] data) {
    boolean intel = data[0] == 'I' && data[1] == 'I' && data[2] == 0x2A && data[3] == 0x00;
    boolean motorola = data[0] == 'M' && data[1] == 'M' && data[2] == 0x00 && data[3] == 0x2A;
    return intel || motorola;
  }
}
