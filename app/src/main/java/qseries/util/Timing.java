package qseries.util;

import java.util.concurrent.TimeUnit;

/** Wall-clock stopwatch for workflow logging and profiling. */
public record Timing(long startedAtNanos) {

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAtNanos;
  }

  public long elapsedMillis() {
    return TimeUnit.NANOSECONDS.toMillis(elapsedNanos());
  }

  /** Elapsed time in milliseconds with microsecond precision, for short searches. */
  public double elapsedMillisPrecise() {
    return TimeUnit.NANOSECONDS.toMicros(elapsedNanos()) / 1000.0;
  }
}
