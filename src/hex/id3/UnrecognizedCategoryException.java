package hex.id3;

/** Thrown when a row holds a value the decision tree has no case for, i.e. a
 * category never seen under that column during training.
 */
public class UnrecognizedCategoryException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public final String _column;
  public final String _value;

  public UnrecognizedCategoryException(String column, String value) {
    super("No rule for value '" + value + "' of column '" + column + "'");
    _column = column;
    _value = value;
  }
}
