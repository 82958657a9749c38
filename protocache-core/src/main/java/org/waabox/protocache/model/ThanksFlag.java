package org.waabox.protocache.model;

import java.util.Optional;

/**
 * Whether the "thanks for posting" message was shown to the author, as
 * reported in {@link Prototype#getThanksFlg()}.
 *
 * <p>Old records may carry no flag at all; {@link #labelOf(Integer)}
 * renders that as {@link #MISSING_LABEL}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ThanksFlag {

  /** The message was already shown. */
  SHOWN(1, "初回表示済");

  /** The label of a record without a flag. */
  public static final String MISSING_LABEL = "不明";

  /** The upstream numeric code. */
  private final int code;

  /** The display label. */
  private final String label;

  ThanksFlag(final int theCode, final String theLabel) {
    code = theCode;
    label = theLabel;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  public static Optional<ThanksFlag> fromCode(final int code) {
    for (ThanksFlag flag : values()) {
      if (flag.code == code) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the label of the given code.
   *
   * @param code the upstream code, may be null
   *
   * @return the label, the code as a string when it is unknown, or
   *         {@link #MISSING_LABEL} when there is no code
   */
  public static String labelOf(final Integer code) {
    if (code == null) {
      return MISSING_LABEL;
    }
    return fromCode(code).map(ThanksFlag::label)
        .orElse(String.valueOf(code));
  }
}
