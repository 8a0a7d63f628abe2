package io.flightqc.domain.site;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class FolderCategoryTest {

  @Test
  void matchesKeywordsIgnoringCase() {
    assertEquals(FolderCategory.ORBIT, FolderCategory.fromFolderName("02_ORBIT_150ft"));
    assertEquals(FolderCategory.DOWNLOOK, FolderCategory.fromFolderName("downlook-east"));
    assertEquals(FolderCategory.ROAD, FolderCategory.fromFolderName("Access Road"));
    assertEquals(FolderCategory.DEFAULT, FolderCategory.fromFolderName("misc"));
    assertEquals(FolderCategory.DEFAULT, FolderCategory.fromFolderName(null));
  }

  @Test
  void firstDeclaredKeywordWins() {
    assertEquals(FolderCategory.ORBIT, FolderCategory.fromFolderName("orbit_then_scan"));
    assertEquals(FolderCategory.SCAN, FolderCategory.fromFolderName("civil_scan"));
  }

  @Test
  void keywordLookupRejectsUnknownNames() {
    assertEquals(FolderCategory.CIVIL, FolderCategory.fromKeyword(" Civil "));
    assertThrows(IllegalArgumentException.class, () -> FolderCategory.fromKeyword("bridge"));
  }
}
