package org.waabox.protocache.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when told to.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MutableClock extends Clock {

  /** The current instant. */
  private volatile Instant now;

  public MutableClock(final Instant start) {
    now = start;
  }

  public void advance(final Duration duration) {
    now = now.plus(duration);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(final ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return now;
  }
}
