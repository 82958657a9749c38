package org.waabox.protocache;

/**
 * The smallest and largest record id held by a snapshot.
 *
 * @param min the smallest id
 * @param max the largest id
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record IdRange(int min, int max) {

  /**
   * Creates a new range.
   *
   * @throws IllegalArgumentException if min is greater than max
   */
  public IdRange {
    if (min > max) {
      throw new IllegalArgumentException("min (" + min
          + ") must not be greater than max (" + max + ")");
    }
  }
}
