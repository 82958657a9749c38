package org.waabox.protocache.model;

import java.util.Optional;

/**
 * The visibility of a prototype, as reported in
 * {@link Prototype#getReleaseFlg()}.
 *
 * <p>The public listing only ever returns {@link #PUBLIC} records; the
 * other values exist upstream for drafts and limited shares.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ReleaseFlag {

  DRAFT(1, "下書き保存"),

  PUBLIC(2, "一般公開"),

  LIMITED(3, "限定共有");

  /** The upstream numeric code. */
  private final int code;

  /** The display label. */
  private final String label;

  ReleaseFlag(final int theCode, final String theLabel) {
    code = theCode;
    label = theLabel;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  public static Optional<ReleaseFlag> fromCode(final int code) {
    for (ReleaseFlag flag : values()) {
      if (flag.code == code) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the label of the given code.
   *
   * @param code the upstream code
   *
   * @return the label, or the code as a string when it is unknown
   */
  public static String labelOf(final int code) {
    return fromCode(code).map(ReleaseFlag::label)
        .orElse(String.valueOf(code));
  }
}
