package org.waabox.protocache.store;

/**
 * Thrown when a {@link StoreConfig} holds values the store cannot honor.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigurationException extends StoreException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   */
  public ConfigurationException(final String message) {
    super(message, DataState.UNCHANGED);
  }
}
