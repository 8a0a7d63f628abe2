package io.flightqc.infrastructure.exif;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Collects APP1 segments from a possibly truncated JPEG prefix.
 *
 * <p>Scanning stops at start-of-scan, end-of-image, or the first segment that runs past the end of the buffer. An
 * APP1 segment cut by the end of the buffer is returned with the bytes that arrived: cameras write EXIF segments
 * close to the 64 KiB limit, and the GPS directory usually sits near their start.</p>
 */
final class JpegSegmentScanner {
  private static final int MARKER_PREFIX = 0xFF;
  private static final int SOI = 0xD8;
  private static final int EOI = 0xD9;
  private static final int SOS = 0xDA;
  private static final int APP1 = 0xE1;
  private static final int TEM = 0x01;
  private static final int RST0 = 0xD0;
  private static final int RST7 = 0xD7;

  private JpegSegmentScanner() {}

  static boolean isJpeg(byte[] data) {
    return data.length >= 2 && (data[0] & 0xFF) == MARKER_PREFIX && (data[1] & 0xFF) == SOI;
  }

  /**
   * Returns the payloads (without marker and length) of every APP1 segment; the last one may be truncated.
   *
   * @param data JPEG prefix starting with SOI
   * @return APP1 payloads in file order; empty when none start inside the prefix
   */
  static List<byte[]> app1Segments(byte[] data) {
    List<byte[]> segments = new ArrayList<>();
    if (!isJpeg(data)) {
      return segments;
    }
    int pos = 2;
    while (pos + 1 < data.length) {
      if ((data[pos] & 0xFF) != MARKER_PREFIX) {
        // not positioned on a marker: corrupt or unexpected layout
        break;
      }
      int marker = data[pos + 1] & 0xFF;
      if (marker == MARKER_PREFIX) {
        pos++;
        continue;
      }
      pos += 2;
      if (marker == SOS || marker == EOI) {
        break;
      }
      if (marker == TEM || (marker >= RST0 && marker <= RST7)) {
        continue;
      }
      if (pos + 2 > data.length) {
        break;
      }
      int length = ((data[pos] & 0xFF) << 8) | (data[pos + 1] & 0xFF);
      if (length < 2) {
        break;
      }
      if (pos + length > data.length) {
        if (marker == APP1 && pos + 2 < data.length) {
          segments.add(Arrays.copyOfRange(data, pos + 2, data.length));
        }
        break;
      }
      if (marker == APP1) {
        segments.add(Arrays.copyOfRange(data, pos + 2, pos + length));
      }
      pos += length;
    }
    return segments;
  }
}
