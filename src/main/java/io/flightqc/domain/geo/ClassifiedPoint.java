package io.flightqc.domain.geo;

import io.flightqc.domain.site.FolderCategory;
import java.util.Objects;

/**
 * A geotagged image after outlier classification.
 *
 * @param latitude signed decimal degrees
 * @param longitude signed decimal degrees
 * @param altitudeFeet altitude in feet, used only for vertical placement
 * @param folder originating folder name
 * @param filename image file name
 * @param category category inferred from the folder name
 * @param outlier whether the point lies outside the horizontal bounds
 * @since 0.1.0
 */
public record ClassifiedPoint(
    double latitude,
    double longitude,
    double altitudeFeet,
    String folder,
    String filename,
    FolderCategory category,
    boolean outlier) {

  public ClassifiedPoint {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(category, "category");
  }
}
