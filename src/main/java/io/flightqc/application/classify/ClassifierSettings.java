package io.flightqc.application.classify;

import io.flightqc.domain.site.FolderCategory;
import io.flightqc.validation.Numbers;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Outlier classification tuning.
 *
 * @param multiplier IQR multiplier {@code m} in {@code Q1 - m*IQR .. Q3 + m*IQR}
 * @param groundReference categories whose keyword in a folder name marks the folder as ground reference: never
 *     used for bounds, never drawn and always kept as inliers
 * @param minEligiblePoints classification is skipped below this many eligible points
 * @since 0.1.0
 */
public record ClassifierSettings(double multiplier, Set<FolderCategory> groundReference, int minEligiblePoints) {

  public ClassifierSettings {
    Numbers.requirePositive("classifier.multiplier", multiplier);
    groundReference = groundReference.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(groundReference));
    Numbers.requireRange("classifier.minEligiblePoints", minEligiblePoints, 2, Integer.MAX_VALUE);
  }

  public static ClassifierSettings defaults() {
    return new ClassifierSettings(4.0d, EnumSet.of(FolderCategory.CIVIL, FolderCategory.ROAD), 2);
  }

  /**
   * Tests a folder name against every ground-reference keyword. Independent of the colour category, so
   * {@code 05_Road_Downlook} is ground reference even though it is drawn as a downlook.
   *
   * @param folderName folder name, may be {@code null}
   * @return {@code true} when the name contains any configured ground keyword, ignoring case
   */
  public boolean isGroundReference(String folderName) {
    if (folderName == null) {
      return false;
    }
    String lower = folderName.toLowerCase(Locale.ROOT);
    for (FolderCategory category : groundReference) {
      if (lower.contains(category.keyword())) {
        return true;
      }
    }
    return false;
  }
}
