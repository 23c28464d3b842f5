package hex.id3;

/** Thrown when a column name is not visible where it is looked up.
 *
 * Callers are expected to only use names they know are visible, so this is
 * an invariant violation rather than a recoverable condition.
 */
public class ColumnNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public final String _column;

  public ColumnNotFoundException(String column) {
    super("Column '" + column + "' not found");
    _column = column;
  }
}
