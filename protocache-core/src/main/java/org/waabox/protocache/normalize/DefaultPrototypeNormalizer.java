package org.waabox.protocache.normalize;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.protocache.model.Prototype;
import org.waabox.protocache.model.UpstreamPrototype;

/**
 * The default {@link PrototypeNormalizer}.
 *
 * <p>Splits the pipe-separated fields into trimmed lists without blank
 * entries, converts the upstream timestamps to UTC instants, collects the
 * related links into one list and applies the upstream defaults to the
 * optional fields: release flag 2, license type 1, thanks flag 0, revision
 * 0 and the empty string for text.
 *
 * <p>A timestamp in an unknown format is logged and left null.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class DefaultPrototypeNormalizer implements PrototypeNormalizer {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DefaultPrototypeNormalizer.class);

  /** {@inheritDoc} */
  @Override
  public Prototype normalize(final UpstreamPrototype upstream) {
    Objects.requireNonNull(upstream, "upstream must not be null");
    final int id = upstream.getId();

    return Prototype.builder(id)
        .prototypeNm(upstream.getPrototypeNm())
        .summary(upstream.getSummary())
        .freeComment(upstream.getFreeComment())
        .systemDescription(upstream.getSystemDescription())
        .teamNm(upstream.getTeamNm())
        .users(splitPipes(upstream.getUsers()))
        .tags(splitPipes(upstream.getTags()))
        .materials(splitPipes(upstream.getMaterials()))
        .events(splitPipes(upstream.getEvents()))
        .awards(splitPipes(upstream.getAwards()))
        .relatedLinks(relatedLinks(upstream))
        .status(upstream.getStatus())
        .releaseFlg(valueOr(upstream.getReleaseFlg(), 2))
        .createDate(timestamp(id, "createDate", upstream.getCreateDate()))
        .updateDate(timestamp(id, "updateDate", upstream.getUpdateDate()))
        .releaseDate(timestamp(id, "releaseDate",
            upstream.getReleaseDate()))
        .createId(upstream.getCreateId())
        .updateId(upstream.getUpdateId())
        .mainUrl(upstream.getMainUrl())
        .officialLink(upstream.getOfficialLink())
        .videoUrl(upstream.getVideoUrl())
        .viewCount(upstream.getViewCount())
        .goodCount(upstream.getGoodCount())
        .commentCount(upstream.getCommentCount())
        .licenseType(valueOr(upstream.getLicenseType(), 1))
        .thanksFlg(valueOr(upstream.getThanksFlg(), 0))
        .revision(valueOr(upstream.getRevision(), 0))
        .uuid(upstream.getUuid())
        .nid(upstream.getNid())
        .slideMode(upstream.getSlideMode())
        .build();
  }

  /**
   * Splits a pipe-separated value.
   *
   * @param value the value, may be null
   *
   * @return the trimmed, non blank parts, never null
   */
  static List<String> splitPipes(final String value) {
    if (value == null || value.isEmpty()) {
      return Collections.emptyList();
    }
    final List<String> parts = new ArrayList<>();
    for (String part : value.split("\\|")) {
      final String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return parts;
  }

  private Instant timestamp(final int id, final String field,
      final String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    final Instant parsed = UpstreamTimestamps.parse(value);
    if (parsed == null) {
      log.warn("Prototype {} has an unparseable {} '{}', leaving it empty",
          id, field, value);
    }
    return parsed;
  }

  private static List<String> relatedLinks(final UpstreamPrototype upstream) {
    final List<String> links = new ArrayList<>(5);
    addIfPresent(links, upstream.getRelatedLink());
    addIfPresent(links, upstream.getRelatedLink2());
    addIfPresent(links, upstream.getRelatedLink3());
    addIfPresent(links, upstream.getRelatedLink4());
    addIfPresent(links, upstream.getRelatedLink5());
    return links;
  }

  private static void addIfPresent(final List<String> target,
      final String value) {
    if (value != null && !value.isBlank()) {
      target.add(value);
    }
  }

  private static int valueOr(final Integer value, final int fallback) {
    return value == null ? fallback : value;
  }
}
