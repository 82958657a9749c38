package org.waabox.protocache.normalize;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the timestamp formats used by the upstream API.
 *
 * <p>Two formats are accepted:
 * <ul>
 *   <li>The upstream database format, {@code yyyy-MM-dd HH:mm:ss.f}, with
 *       one or more fraction digits and no zone. It is always Japan
 *       Standard Time; the fraction is truncated to milliseconds.</li>
 *   <li>W3C-DTF with a mandatory zone designator, such as
 *       {@code 2024-01-01T09:00:00+09:00} or {@code 2024-01-01T00:00Z}.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class UpstreamTimestamps {

  /** The fixed offset of the upstream database timestamps. */
  static final ZoneOffset JST = ZoneOffset.ofHours(9);

  /** The upstream database format. */
  private static final Pattern UPSTREAM_PATTERN = Pattern.compile(
      "^(\\d{4})-(\\d{2})-(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2})\\.(\\d+)$");

  /** W3C-DTF, levels 4 to 6. */
  private static final Pattern W3C_DTF_PATTERN = Pattern.compile(
      "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2})?(\\.\\d+)?"
      + "([Zz]|[+-]\\d{2}:\\d{2})$");

  private UpstreamTimestamps() {
  }

  /**
   * Parses the given value.
   *
   * @param value the upstream value, may be null
   *
   * @return the instant, or null when the value is null, empty or not in a
   *         supported format
   */
  static Instant parse(final String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    final Instant upstream = parseUpstream(value);
    if (upstream != null) {
      return upstream;
    }
    return parseW3cDtf(value);
  }

  private static Instant parseUpstream(final String value) {
    final Matcher matcher = UPSTREAM_PATTERN.matcher(value);
    if (!matcher.matches()) {
      return null;
    }
    final String fraction = (matcher.group(7) + "00").substring(0, 3);
    try {
      final LocalDateTime local = LocalDateTime.of(
          Integer.parseInt(matcher.group(1)),
          Integer.parseInt(matcher.group(2)),
          Integer.parseInt(matcher.group(3)),
          Integer.parseInt(matcher.group(4)),
          Integer.parseInt(matcher.group(5)),
          Integer.parseInt(matcher.group(6)),
          Integer.parseInt(fraction) * 1_000_000);
      return local.toInstant(JST);
    } catch (final DateTimeException e) {
      return null;
    }
  }

  private static Instant parseW3cDtf(final String value) {
    if (!W3C_DTF_PATTERN.matcher(value).matches()) {
      return null;
    }
    final String normalized = value.endsWith("z")
        ? value.substring(0, value.length() - 1) + "Z" : value;
    try {
      return OffsetDateTime.parse(normalized,
          DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (final DateTimeException e) {
      return null;
    }
  }
}
