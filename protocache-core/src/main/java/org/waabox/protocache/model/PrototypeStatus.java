package org.waabox.protocache.model;

import java.util.Optional;

/**
 * The development status of a prototype, as reported in
 * {@link Prototype#getStatus()}.
 *
 * <p>Labels are the ones the catalog shows to its users. Codes outside
 * this enum are rendered as the number itself, see {@link #labelOf(int)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum PrototypeStatus {

  /** Just an idea. */
  IDEA(1, "アイデア"),

  /** Under development. */
  IN_DEVELOPMENT(2, "開発中"),

  /** Finished. */
  COMPLETED(3, "完成"),

  /** Retired by its team. */
  RETIRED(4, "供養");

  /** The upstream numeric code. */
  private final int code;

  /** The display label. */
  private final String label;

  PrototypeStatus(final int theCode, final String theLabel) {
    code = theCode;
    label = theLabel;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  /**
   * Finds the status for the given code.
   *
   * @param code the upstream code
   *
   * @return the status, or empty when the code is unknown
   */
  public static Optional<PrototypeStatus> fromCode(final int code) {
    for (PrototypeStatus status : values()) {
      if (status.code == code) {
        return Optional.of(status);
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
    return fromCode(code).map(PrototypeStatus::label)
        .orElse(String.valueOf(code));
  }
}
