package io.flightqc.domain.site;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SiteInfoTest {

  @Test
  void parsesPilotAndSiteId() {
    SiteInfo info = SiteInfo.parse("/homes/JaneDoe/10001291-08-20-2025-ATT");

    assertEquals("10001291", info.siteId());
    assertEquals("JaneDoe", info.pilot());
    assertEquals("/homes/JaneDoe/10001291-08-20-2025-ATT", info.path());
  }

  @Test
  void siteIdMayAppearInAnySegment() {
    SiteInfo info = SiteInfo.parse("/data/archive/1234567890/raw/");

    assertEquals("1234567890", info.siteId());
    assertEquals(SiteInfo.UNKNOWN, info.pilot());
  }

  @Test
  void shortDigitRunsAreIgnored() {
    SiteInfo info = SiteInfo.parse("/homes/bob/2025-08-20");

    assertEquals(SiteInfo.UNKNOWN, info.siteId());
    assertEquals("bob", info.pilot());
  }

  @Test
  void homesWithoutFollowingSegmentLeavesPilotUnknown() {
    assertEquals(SiteInfo.UNKNOWN, SiteInfo.parse("/homes").pilot());
    assertEquals(SiteInfo.UNKNOWN, SiteInfo.parse(null).siteId());
  }
}
