package water;

/**
 * Console output of the command line tools. Normal output goes to
 * System.out, fatal errors to System.err.
 */
public final class Log {
  private Log() { }

  // Print to STDERR & die
  public static void die( String s ) {
    System.err.println(s);
    System.exit(-1);
  }
}
