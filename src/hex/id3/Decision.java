package hex.id3;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.gson.*;

/** A decision on a single column of the data.
 *
 * Each distinct value seen in that column during training is a {@link Case},
 * in decreasing probability. A decision is immutable once built and can be
 * used from any number of threads.
 */
public final class Decision {
  static final String JSON_COLUMN = "column";
  static final String JSON_CASES  = "cases";
  static final String JSON_VALUE  = "value";
  static final String JSON_CLASS  = "class";
  static final String JSON_DECIDE = "decide";

  /** The name of the column decided on. */
  public final String _column;
  /** The cases of that column, most likely first. */
  public final List<Case> _cases;

  private final int _depth, _leaves;

  public Decision(String column, List<? extends Case> cases) {
    if( column == null || column.isEmpty() ) throw new IllegalArgumentException("Decision has no column");
    if( cases.isEmpty() ) throw new IllegalArgumentException("Decision on '" + column + "' has no cases");
    _column = column;
    _cases = ImmutableList.copyOf(cases);
    int d = 0, l = 0;
    for( Case c : _cases ) {
      d = Math.max(d, c.depth());
      l += c.leaves();
    }
    _depth = d + 1;
    _leaves = l;
  }

  /** Classifies a single row; the header gives the column names of the row.
   * @throws IllegalArgumentException if the row and header differ in length
   * @throws ColumnNotFoundException if a decided column is not in the header
   * @throws UnrecognizedCategoryException if the tree has no case for a value
   */
  public String classify(String[] header, String[] row) {
    if( row.length != header.length )
      throw new IllegalArgumentException("Row has " + row.length + " fields, expected " + header.length);
    String value = row[View.find(header, _column)];
    for( Case c : _cases )
      if( c._value.equals(value) ) return c.classify(header, row);
    throw new UnrecognizedCategoryException(_column, value);
  }

  /** Classifies CSV conformant data. The first row must be the column names;
   * returns one class per following row, in order.
   * @throws IllegalArgumentException if a row has not as many fields as the header
   */
  public List<String> decide(List<String[]> data) {
    if( data.isEmpty() ) return Collections.emptyList();
    String[] header = data.get(0);
    for( int i = 1; i < data.size(); ++i )
      if( data.get(i).length != header.length )
        throw new IllegalArgumentException("Row " + i + " has " + data.get(i).length + " fields, expected " + header.length);
    List<String> res = Lists.newArrayListWithCapacity(data.size() - 1);
    for( int i = 1; i < data.size(); ++i ) res.add(classify(header, data.get(i)));
    return res;
  }

  /** Classifies every row of the view. Rewinds the view. */
  public List<String> decide(View view) {
    String[] header = view.columns();
    List<String> res = Lists.newArrayList();
    view.reset();
    for( String[] row = view.next(); row != null; row = view.next() )
      res.add(classify(header, row));
    return res;
  }

  /** Depth of the deepest leaf; a decision of leaves only has depth 1. */
  public int depth() { return _depth; }

  /** Number of leaves. */
  public int leaves() { return _leaves; }

  public void print(TreePrinter p) throws IOException { p.printDecision(this); }

  StringBuilder toString(StringBuilder sb) {
    sb.append(_column).append('(');
    for( int i = 0; i < _cases.size(); ++i ) {
      if( i > 0 ) sb.append(',');
      _cases.get(i).toString(sb);
    }
    return sb.append(')');
  }
  @Override public String toString() { return toString(new StringBuilder()).toString(); }

  @Override public boolean equals(Object o) {
    if( !(o instanceof Decision) ) return false;
    Decision d = (Decision) o;
    return _column.equals(d._column) && _cases.equals(d._cases);
  }
  @Override public int hashCode() { return 31 * _column.hashCode() + _cases.hashCode(); }

  // ---
  // JSON form: {"column":c, "cases":[{"value":v, "class":k} | {"value":v, "decide":{...}}]}

  public JsonObject toJson() {
    JsonObject res = new JsonObject();
    res.addProperty(JSON_COLUMN, _column);
    JsonArray cases = new JsonArray();
    for( Case c : _cases ) cases.add(c.toJson());
    res.add(JSON_CASES, cases);
    return res;
  }

  public String toJsonString(boolean pretty) {
    Gson gson = pretty ? new GsonBuilder().setPrettyPrinting().create() : new Gson();
    return gson.toJson(toJson());
  }

  /** Parses a decision from its JSON text.
   * @throws JsonParseException if the text is not a well formed decision
   */
  public static Decision parse(String json) {
    return fromJson(JsonParser.parseString(json));
  }

  /** Builds a decision from its JSON form.
   * @throws JsonParseException if the element is not a well formed decision
   */
  public static Decision fromJson(JsonElement e) {
    if( e == null || !e.isJsonObject() ) throw new JsonParseException("Decision must be a JSON object: " + e);
    JsonObject o = e.getAsJsonObject();
    String column = string(o, JSON_COLUMN);
    if( column == null || column.isEmpty() ) throw new JsonParseException("Decision has no column: " + o);
    JsonElement cs = o.get(JSON_CASES);
    if( cs == null || !cs.isJsonArray() || cs.getAsJsonArray().size() == 0 )
      throw new JsonParseException("Decision on '" + column + "' has no cases");
    List<Case> cases = Lists.newArrayList();
    for( JsonElement ce : cs.getAsJsonArray() ) {
      if( !ce.isJsonObject() ) throw new JsonParseException("Case must be a JSON object: " + ce);
      JsonObject c = ce.getAsJsonObject();
      String value = string(c, JSON_VALUE);
      if( value == null ) throw new JsonParseException("Case of '" + column + "' has no value");
      String clazz = string(c, JSON_CLASS);
      JsonElement decide = c.get(JSON_DECIDE);
      boolean hasClass = clazz != null && !clazz.isEmpty();
      boolean hasDecide = decide != null && !decide.isJsonNull();
      if( hasClass == hasDecide )
        throw new JsonParseException("Case '" + value + "' of '" + column + "' needs exactly one of class or decide");
      cases.add(hasClass ? new Case.Leaf(value, clazz) : new Case.Branch(value, fromJson(decide)));
    }
    return new Decision(column, cases);
  }

  private static String string(JsonObject o, String name) {
    JsonElement e = o.get(name);
    if( e == null || e.isJsonNull() ) return null;
    if( !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString() )
      throw new JsonParseException("Field '" + name + "' must be a string: " + e);
    return e.getAsString();
  }
}
