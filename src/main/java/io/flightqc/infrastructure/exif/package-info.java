/**
 * <strong>Purpose:</strong> Geotag decoding from image prefixes using metadata-extractor.
 * <p>Only the leading bytes of each image are available, so JPEG segments are scanned by hand and anything that
 * does not fit in the prefix is ignored rather than reported.</p>
 *
 * @since 0.1.0
 */
package io.flightqc.infrastructure.exif;
