package hex.id3;

/** A distinct column value and its probability in a view. */
public final class Distinct {
  public final String _value;
  public final double _probability;

  public Distinct(String value, double probability) {
    _value = value;  _probability = probability;
  }

  @Override public String toString() { return _value + "=" + Utils.p5d(_probability); }
}
