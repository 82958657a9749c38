package org.waabox.protocache.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A normalized catalog record, as held by the snapshot store.
 *
 * <p>Instances are immutable. All list fields are unmodifiable and never
 * null; text fields default to the empty string when the upstream value is
 * absent. Timestamps are expressed as UTC {@link Instant}s and may be null
 * when the upstream did not provide a parseable value.
 *
 * <p>Instances are created through {@link #builder(int)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Prototype {

  /** The upstream identifier, always positive. */
  private final int id;

  /** The display name. */
  private final String prototypeNm;

  /** The short summary, empty when absent. */
  private final String summary;

  /** The free-form description, empty when absent. */
  private final String freeComment;

  /** The system description, empty when absent. */
  private final String systemDescription;

  /** The team name, empty when absent. */
  private final String teamNm;

  /** The member names, never null. */
  private final List<String> users;

  /** The tags, never null. */
  private final List<String> tags;

  /** The materials, never null. */
  private final List<String> materials;

  /** The events the record took part in, never null. */
  private final List<String> events;

  /** The awards, never null. */
  private final List<String> awards;

  /** The related links, never null. */
  private final List<String> relatedLinks;

  /** The development status code. */
  private final int status;

  /** The release flag, 2 (released) when absent. */
  private final int releaseFlg;

  /** The creation timestamp, may be null. */
  private final Instant createDate;

  /** The last update timestamp, may be null. */
  private final Instant updateDate;

  /** The release timestamp, may be null. */
  private final Instant releaseDate;

  /** The identifier of the creating user. */
  private final int createId;

  /** The identifier of the last updating user. */
  private final int updateId;

  /** The main image url, may be null. */
  private final String mainUrl;

  /** The official site link, may be null. */
  private final String officialLink;

  /** The video url, may be null. */
  private final String videoUrl;

  private final int viewCount;

  private final int goodCount;

  private final int commentCount;

  /** The license type, 1 when absent. */
  private final int licenseType;

  /** The thanks flag, 0 when absent. */
  private final int thanksFlg;

  /** The upstream revision, 0 when absent. */
  private final int revision;

  /** The upstream uuid, may be null. */
  private final String uuid;

  /** The upstream node id, may be null. */
  private final Integer nid;

  /** The slide mode flag, may be null. */
  private final Integer slideMode;

  /**
   * Creates a new prototype from the given builder.
   *
   * @param builder the builder holding the values, never null
   */
  private Prototype(final Builder builder) {
    id = builder.id;
    prototypeNm = builder.prototypeNm;
    summary = builder.summary;
    freeComment = builder.freeComment;
    systemDescription = builder.systemDescription;
    teamNm = builder.teamNm;
    users = builder.users;
    tags = builder.tags;
    materials = builder.materials;
    events = builder.events;
    awards = builder.awards;
    relatedLinks = builder.relatedLinks;
    status = builder.status;
    releaseFlg = builder.releaseFlg;
    createDate = builder.createDate;
    updateDate = builder.updateDate;
    releaseDate = builder.releaseDate;
    createId = builder.createId;
    updateId = builder.updateId;
    mainUrl = builder.mainUrl;
    officialLink = builder.officialLink;
    videoUrl = builder.videoUrl;
    viewCount = builder.viewCount;
    goodCount = builder.goodCount;
    commentCount = builder.commentCount;
    licenseType = builder.licenseType;
    thanksFlg = builder.thanksFlg;
    revision = builder.revision;
    uuid = builder.uuid;
    nid = builder.nid;
    slideMode = builder.slideMode;
  }

  /**
   * Starts a builder for a prototype with the given identifier.
   *
   * @param theId the upstream identifier, must be positive
   *
   * @return a new builder, never null
   *
   * @throws IllegalArgumentException if theId is not positive
   */
  public static Builder builder(final int theId) {
    if (theId <= 0) {
      throw new IllegalArgumentException("id must be positive, got "
          + theId);
    }
    return new Builder(theId);
  }

  public int getId() {
    return id;
  }

  public String getPrototypeNm() {
    return prototypeNm;
  }

  public String getSummary() {
    return summary;
  }

  public String getFreeComment() {
    return freeComment;
  }

  public String getSystemDescription() {
    return systemDescription;
  }

  public String getTeamNm() {
    return teamNm;
  }

  public List<String> getUsers() {
    return users;
  }

  public List<String> getTags() {
    return tags;
  }

  public List<String> getMaterials() {
    return materials;
  }

  public List<String> getEvents() {
    return events;
  }

  public List<String> getAwards() {
    return awards;
  }

  public List<String> getRelatedLinks() {
    return relatedLinks;
  }

  public int getStatus() {
    return status;
  }

  public int getReleaseFlg() {
    return releaseFlg;
  }

  public Instant getCreateDate() {
    return createDate;
  }

  public Instant getUpdateDate() {
    return updateDate;
  }

  public Instant getReleaseDate() {
    return releaseDate;
  }

  public int getCreateId() {
    return createId;
  }

  public int getUpdateId() {
    return updateId;
  }

  public String getMainUrl() {
    return mainUrl;
  }

  public String getOfficialLink() {
    return officialLink;
  }

  public String getVideoUrl() {
    return videoUrl;
  }

  public int getViewCount() {
    return viewCount;
  }

  public int getGoodCount() {
    return goodCount;
  }

  public int getCommentCount() {
    return commentCount;
  }

  public int getLicenseType() {
    return licenseType;
  }

  public int getThanksFlg() {
    return thanksFlg;
  }

  /**
   * Returns the display label of {@link #getStatus()}.
   *
   * @return the label, or the code as a string when it is unknown
   */
  public String statusLabel() {
    return PrototypeStatus.labelOf(status);
  }

  public String releaseFlagLabel() {
    return ReleaseFlag.labelOf(releaseFlg);
  }

  public String licenseTypeLabel() {
    return LicenseType.labelOf(licenseType);
  }

  public String thanksFlagLabel() {
    return ThanksFlag.labelOf(thanksFlg);
  }

  public int getRevision() {
    return revision;
  }

  public String getUuid() {
    return uuid;
  }

  public Integer getNid() {
    return nid;
  }

  public Integer getSlideMode() {
    return slideMode;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Prototype)) {
      return false;
    }
    final Prototype other = (Prototype) o;
    return id == other.id
        && revision == other.revision
        && Objects.equals(prototypeNm, other.prototypeNm)
        && Objects.equals(updateDate, other.updateDate);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(id, revision, prototypeNm, updateDate);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Prototype{id=" + id + ", prototypeNm='" + prototypeNm
        + "', revision=" + revision + "}";
  }

  /**
   * Fluent builder for {@link Prototype}.
   *
   * <p>Unset text fields resolve to the empty string, unset list fields to
   * an empty list, and the flags to their upstream defaults.
   */
  public static final class Builder {

    private final int id;
    private String prototypeNm = "";
    private String summary = "";
    private String freeComment = "";
    private String systemDescription = "";
    private String teamNm = "";
    private List<String> users = Collections.emptyList();
    private List<String> tags = Collections.emptyList();
    private List<String> materials = Collections.emptyList();
    private List<String> events = Collections.emptyList();
    private List<String> awards = Collections.emptyList();
    private List<String> relatedLinks = Collections.emptyList();
    private int status;
    private int releaseFlg = 2;
    private Instant createDate;
    private Instant updateDate;
    private Instant releaseDate;
    private int createId;
    private int updateId;
    private String mainUrl;
    private String officialLink;
    private String videoUrl;
    private int viewCount;
    private int goodCount;
    private int commentCount;
    private int licenseType = 1;
    private int thanksFlg;
    private int revision;
    private String uuid;
    private Integer nid;
    private Integer slideMode;

    /**
     * Creates a builder for the given identifier.
     *
     * @param theId the identifier, already validated
     */
    private Builder(final int theId) {
      id = theId;
    }

    public Builder prototypeNm(final String thePrototypeNm) {
      prototypeNm = textOrEmpty(thePrototypeNm);
      return this;
    }

    public Builder summary(final String theSummary) {
      summary = textOrEmpty(theSummary);
      return this;
    }

    public Builder freeComment(final String theFreeComment) {
      freeComment = textOrEmpty(theFreeComment);
      return this;
    }

    public Builder systemDescription(final String theSystemDescription) {
      systemDescription = textOrEmpty(theSystemDescription);
      return this;
    }

    public Builder teamNm(final String theTeamNm) {
      teamNm = textOrEmpty(theTeamNm);
      return this;
    }

    public Builder users(final List<String> theUsers) {
      users = copyOf(theUsers);
      return this;
    }

    public Builder tags(final List<String> theTags) {
      tags = copyOf(theTags);
      return this;
    }

    public Builder materials(final List<String> theMaterials) {
      materials = copyOf(theMaterials);
      return this;
    }

    public Builder events(final List<String> theEvents) {
      events = copyOf(theEvents);
      return this;
    }

    public Builder awards(final List<String> theAwards) {
      awards = copyOf(theAwards);
      return this;
    }

    public Builder relatedLinks(final List<String> theRelatedLinks) {
      relatedLinks = copyOf(theRelatedLinks);
      return this;
    }

    public Builder status(final int theStatus) {
      status = theStatus;
      return this;
    }

    public Builder releaseFlg(final int theReleaseFlg) {
      releaseFlg = theReleaseFlg;
      return this;
    }

    public Builder createDate(final Instant theCreateDate) {
      createDate = theCreateDate;
      return this;
    }

    public Builder updateDate(final Instant theUpdateDate) {
      updateDate = theUpdateDate;
      return this;
    }

    public Builder releaseDate(final Instant theReleaseDate) {
      releaseDate = theReleaseDate;
      return this;
    }

    public Builder createId(final int theCreateId) {
      createId = theCreateId;
      return this;
    }

    public Builder updateId(final int theUpdateId) {
      updateId = theUpdateId;
      return this;
    }

    public Builder mainUrl(final String theMainUrl) {
      mainUrl = theMainUrl;
      return this;
    }

    public Builder officialLink(final String theOfficialLink) {
      officialLink = theOfficialLink;
      return this;
    }

    public Builder videoUrl(final String theVideoUrl) {
      videoUrl = theVideoUrl;
      return this;
    }

    public Builder viewCount(final int theViewCount) {
      viewCount = theViewCount;
      return this;
    }

    public Builder goodCount(final int theGoodCount) {
      goodCount = theGoodCount;
      return this;
    }

    public Builder commentCount(final int theCommentCount) {
      commentCount = theCommentCount;
      return this;
    }

    public Builder licenseType(final int theLicenseType) {
      licenseType = theLicenseType;
      return this;
    }

    public Builder thanksFlg(final int theThanksFlg) {
      thanksFlg = theThanksFlg;
      return this;
    }

    public Builder revision(final int theRevision) {
      revision = theRevision;
      return this;
    }

    public Builder uuid(final String theUuid) {
      uuid = theUuid;
      return this;
    }

    public Builder nid(final Integer theNid) {
      nid = theNid;
      return this;
    }

    public Builder slideMode(final Integer theSlideMode) {
      slideMode = theSlideMode;
      return this;
    }

    /**
     * Builds the immutable prototype.
     *
     * @return the prototype, never null
     */
    public Prototype build() {
      return new Prototype(this);
    }

    private static String textOrEmpty(final String value) {
      return value == null ? "" : value;
    }

    private static List<String> copyOf(final List<String> values) {
      if (values == null || values.isEmpty()) {
        return Collections.emptyList();
      }
      return Collections.unmodifiableList(List.copyOf(values));
    }
  }
}
