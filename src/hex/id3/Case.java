package hex.id3;

import java.io.IOException;

import com.google.gson.JsonObject;

/** One distinct value of a decision's column and what it leads to: either a
 * class ({@link Leaf}) or a further decision ({@link Branch}).
 */
public abstract class Case {
  /** The distinct column value. */
  public final String _value;

  Case(String value) {
    if( value == null ) throw new IllegalArgumentException("Case value is null");
    _value = value;
  }

  abstract String classify(String[] header, String[] row);
  abstract int depth();         // Depth below this case
  abstract int leaves();        // Number of leaves
  abstract StringBuilder toString(StringBuilder sb);
  abstract void print(TreePrinter p, Decision parent) throws IOException;
  abstract JsonObject toJson();

  /** A case decided to a class. */
  public static final class Leaf extends Case {
    public final String _class;

    public Leaf(String value, String clazz) {
      super(value);
      if( clazz == null || clazz.isEmpty() ) throw new IllegalArgumentException("Leaf for '" + value + "' has no class");
      _class = clazz;
    }

    @Override String classify(String[] header, String[] row) { return _class; }
    @Override int depth()  { return 0; }
    @Override int leaves() { return 1; }
    @Override StringBuilder toString(StringBuilder sb) {
      return sb.append(_value).append(':').append(_class);
    }
    @Override void print(TreePrinter p, Decision parent) throws IOException { p.printLeaf(parent, this); }
    @Override JsonObject toJson() {
      JsonObject res = new JsonObject();
      res.addProperty(Decision.JSON_VALUE, _value);
      res.addProperty(Decision.JSON_CLASS, _class);
      return res;
    }

    @Override public boolean equals(Object o) {
      if( !(o instanceof Leaf) ) return false;
      Leaf l = (Leaf) o;
      return _value.equals(l._value) && _class.equals(l._class);
    }
    @Override public int hashCode() { return 31 * _value.hashCode() + _class.hashCode(); }
    @Override public String toString() { return toString(new StringBuilder()).toString(); }
  }

  /** A case needing another decision. */
  public static final class Branch extends Case {
    public final Decision _decide;

    public Branch(String value, Decision decide) {
      super(value);
      if( decide == null ) throw new IllegalArgumentException("Branch for '" + value + "' has no decision");
      _decide = decide;
    }

    @Override String classify(String[] header, String[] row) { return _decide.classify(header, row); }
    @Override int depth()  { return _decide.depth(); }
    @Override int leaves() { return _decide.leaves(); }
    @Override StringBuilder toString(StringBuilder sb) {
      return _decide.toString(sb.append(_value).append(':'));
    }
    @Override void print(TreePrinter p, Decision parent) throws IOException { p.printBranch(parent, this); }
    @Override JsonObject toJson() {
      JsonObject res = new JsonObject();
      res.addProperty(Decision.JSON_VALUE, _value);
      res.add(Decision.JSON_DECIDE, _decide.toJson());
      return res;
    }

    @Override public boolean equals(Object o) {
      if( !(o instanceof Branch) ) return false;
      Branch b = (Branch) o;
      return _value.equals(b._value) && _decide.equals(b._decide);
    }
    @Override public int hashCode() { return 31 * _value.hashCode() + _decide.hashCode(); }
    @Override public String toString() { return toString(new StringBuilder()).toString(); }
  }
}
