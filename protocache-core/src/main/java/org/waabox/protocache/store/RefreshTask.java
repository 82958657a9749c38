package org.waabox.protocache.store;

/**
 * A unit of work executed under {@link PrototypeStore#runExclusive}.
 *
 * @param <R> the type of the task result
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RefreshTask<R> {

  /**
   * Runs the task.
   *
   * @return the task result, may be null
   *
   * @throws Exception if the task fails
   */
  R run() throws Exception;
}
