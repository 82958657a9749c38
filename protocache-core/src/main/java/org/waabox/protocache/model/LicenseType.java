package org.waabox.protocache.model;

import java.util.Optional;

/**
 * The license of a prototype, as reported in
 * {@link Prototype#getLicenseType()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LicenseType {

  /** No license. */
  NONE(0, "なし"),

  /** Creative Commons Attribution. */
  CC_BY(1, "表示(CC:BY)");

  /** The upstream numeric code. */
  private final int code;

  /** The display label. */
  private final String label;

  LicenseType(final int theCode, final String theLabel) {
    code = theCode;
    label = theLabel;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  public static Optional<LicenseType> fromCode(final int code) {
    for (LicenseType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public static String labelOf(final int code) {
    return fromCode(code).map(LicenseType::label)
        .orElse(String.valueOf(code));
  }
}
