package water;

import java.util.concurrent.TimeUnit;

// Rock-simple Timer, for reporting how long a step took
public class Timer {
  public final long _start = System.nanoTime();

  /** Milliseconds since the timer was made. */
  public long time() { return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - _start); }

  @Override public String toString() { return toHuman(time()); }

  public static String toHuman(long msecs) {
    final long min = TimeUnit.MILLISECONDS.toMinutes(msecs);  msecs -= TimeUnit.MINUTES.toMillis(min);
    final long sec = TimeUnit.MILLISECONDS.toSeconds(msecs);  msecs -= TimeUnit.SECONDS.toMillis(sec);
    if( min != 0 ) return String.format("%d min %02d.%03d sec", min, sec, msecs);
    return String.format("%d.%03d sec", sec, msecs);
  }
}
