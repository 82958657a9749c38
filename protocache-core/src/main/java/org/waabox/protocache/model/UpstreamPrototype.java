package org.waabox.protocache.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The raw shape of a catalog record as returned by the upstream API.
 *
 * <p>Multi-valued fields arrive as pipe-separated strings and timestamps as
 * upstream formatted strings. Optional numeric fields are boxed so that an
 * absent value can be told apart from zero. Unknown properties are ignored
 * on decoding.
 *
 * <p>Use {@link #builder(int)} to create instances outside of JSON
 * decoding.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class UpstreamPrototype {

  private int id;
  private String prototypeNm;
  private String summary;
  private String freeComment;
  private String systemDescription;
  private String teamNm;
  private String users;
  private String tags;
  private String materials;
  private String events;
  private String awards;
  private int status;
  private Integer releaseFlg;
  private String createDate;
  private String updateDate;
  private String releaseDate;
  private int createId;
  private int updateId;
  private String mainUrl;
  private String officialLink;
  private String videoUrl;
  private String relatedLink;
  private String relatedLink2;
  private String relatedLink3;
  private String relatedLink4;
  private String relatedLink5;
  private int viewCount;
  private int goodCount;
  private int commentCount;
  private Integer licenseType;
  private Integer thanksFlg;
  private Integer revision;
  private String uuid;
  private Integer nid;
  private Integer slideMode;

  /** Jackson constructor. */
  private UpstreamPrototype() {
  }

  /**
   * Starts a builder for an upstream record with the given identifier.
   *
   * @param theId the upstream identifier
   *
   * @return a new builder, never null
   */
  public static Builder builder(final int theId) {
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

  public String getUsers() {
    return users;
  }

  public String getTags() {
    return tags;
  }

  public String getMaterials() {
    return materials;
  }

  public String getEvents() {
    return events;
  }

  public String getAwards() {
    return awards;
  }

  public int getStatus() {
    return status;
  }

  public Integer getReleaseFlg() {
    return releaseFlg;
  }

  public String getCreateDate() {
    return createDate;
  }

  public String getUpdateDate() {
    return updateDate;
  }

  public String getReleaseDate() {
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

  public String getRelatedLink() {
    return relatedLink;
  }

  public String getRelatedLink2() {
    return relatedLink2;
  }

  public String getRelatedLink3() {
    return relatedLink3;
  }

  public String getRelatedLink4() {
    return relatedLink4;
  }

  public String getRelatedLink5() {
    return relatedLink5;
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

  public Integer getLicenseType() {
    return licenseType;
  }

  public Integer getThanksFlg() {
    return thanksFlg;
  }

  public Integer getRevision() {
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
  public String toString() {
    return "UpstreamPrototype{id=" + id + ", prototypeNm='" + prototypeNm
        + "'}";
  }

  /** Fluent builder for {@link UpstreamPrototype}. */
  public static final class Builder {

    /** The instance being populated. */
    private final UpstreamPrototype target = new UpstreamPrototype();

    private Builder(final int theId) {
      target.id = theId;
    }

    public Builder prototypeNm(final String value) {
      target.prototypeNm = value;
      return this;
    }

    public Builder summary(final String value) {
      target.summary = value;
      return this;
    }

    public Builder freeComment(final String value) {
      target.freeComment = value;
      return this;
    }

    public Builder systemDescription(final String value) {
      target.systemDescription = value;
      return this;
    }

    public Builder teamNm(final String value) {
      target.teamNm = value;
      return this;
    }

    public Builder users(final String value) {
      target.users = value;
      return this;
    }

    public Builder tags(final String value) {
      target.tags = value;
      return this;
    }

    public Builder materials(final String value) {
      target.materials = value;
      return this;
    }

    public Builder events(final String value) {
      target.events = value;
      return this;
    }

    public Builder awards(final String value) {
      target.awards = value;
      return this;
    }

    public Builder status(final int value) {
      target.status = value;
      return this;
    }

    public Builder releaseFlg(final Integer value) {
      target.releaseFlg = value;
      return this;
    }

    public Builder createDate(final String value) {
      target.createDate = value;
      return this;
    }

    public Builder updateDate(final String value) {
      target.updateDate = value;
      return this;
    }

    public Builder releaseDate(final String value) {
      target.releaseDate = value;
      return this;
    }

    public Builder mainUrl(final String value) {
      target.mainUrl = value;
      return this;
    }

    public Builder officialLink(final String value) {
      target.officialLink = value;
      return this;
    }

    public Builder videoUrl(final String value) {
      target.videoUrl = value;
      return this;
    }

    public Builder relatedLink(final String value) {
      target.relatedLink = value;
      return this;
    }

    public Builder viewCount(final int value) {
      target.viewCount = value;
      return this;
    }

    public Builder goodCount(final int value) {
      target.goodCount = value;
      return this;
    }

    public Builder commentCount(final int value) {
      target.commentCount = value;
      return this;
    }

    public Builder licenseType(final Integer value) {
      target.licenseType = value;
      return this;
    }

    public Builder thanksFlg(final Integer value) {
      target.thanksFlg = value;
      return this;
    }

    public Builder revision(final Integer value) {
      target.revision = value;
      return this;
    }

    public Builder uuid(final String value) {
      target.uuid = value;
      return this;
    }

    public UpstreamPrototype build() {
      return target;
    }
  }
}
