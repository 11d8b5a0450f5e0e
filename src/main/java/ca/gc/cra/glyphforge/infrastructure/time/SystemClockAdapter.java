package ca.gc.cra.glyphforge.infrastructure.time;

import ca.gc.cra.glyphforge.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
