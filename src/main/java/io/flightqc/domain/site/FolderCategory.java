package io.flightqc.domain.site;

import java.util.Locale;

/**
 * Flight category inferred from a folder name, with the colour used to draw it.
 *
 * <p>Matching is a case-insensitive substring test in declaration order; the first keyword found wins. The
 * category only picks colours and report labels; ground-reference folders are matched on the raw name.</p>
 */
public enum FolderCategory {
  ORBIT("orbit", "#ff4136"),
  SCAN("scan", "#2ecc40"),
  CENTER("center", "#0074d9"),
  DOWNLOOK("downlook", "#ffdc00"),
  UPLOOK("uplook", "#b10dc9"),
  CIVIL("civil", "#ff851b"),
  ROAD("road", "#39cccc"),
  DEFAULT("default", "#aaaaaa");

  private final String keyword;
  private final String color;

  FolderCategory(String keyword, String color) {
    this.keyword = keyword;
    this.color = color;
  }

  /** Lower-case keyword, also used as the configuration name of the category. */
  public String keyword() {
    return keyword;
  }

  /** Hex colour such as {@code #ff4136}. */
  public String color() {
    return color;
  }

  /**
   * Infers the category of a folder.
   *
   * @param folderName folder name, e.g. {@code "02_Orbit_150ft"}
   * @return first matching category, or {@link #DEFAULT}
   */
  public static FolderCategory fromFolderName(String folderName) {
    if (folderName == null) {
      return DEFAULT;
    }
    String lower = folderName.toLowerCase(Locale.ROOT);
    for (FolderCategory category : values()) {
      if (category != DEFAULT && lower.contains(category.keyword)) {
        return category;
      }
    }
    return DEFAULT;
  }

  /**
   * Resolves a category by its keyword.
   *
   * @param keyword keyword such as {@code civil}
   * @return matching category
   * @throws IllegalArgumentException when no category uses the keyword
   */
  public static FolderCategory fromKeyword(String keyword) {
    String lower = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    for (FolderCategory category : values()) {
      if (category.keyword.equals(lower)) {
        return category;
      }
    }
    throw new IllegalArgumentException("unknown folder category: " + keyword);
  }
}
