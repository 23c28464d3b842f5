package hex.id3;

import java.io.IOException;
import java.io.Reader;
import java.util.HashSet;
import java.util.List;

import water.parser.CsvReader;
import water.parser.CsvReader.CsvParseException;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;

/** A cursor over rows of categorical data.
 *
 * Views are composed by wrapping a parent: a {@link SelectView} yields only
 * the parent rows holding a given value in one column, a {@link DropView}
 * shows the parent rows with one column hidden. Nothing is ever copied; only
 * the {@link Table} at the root of the chain owns row storage.
 *
 * Column positions are stable across the chain. A hidden column keeps its
 * position in {@link #columns()} but its name is replaced by "", so rows can
 * always be indexed with the positions of the base table.
 *
 * A view's cursor is plain mutable state; do not iterate one instance from
 * two readers at the same time.
 */
public abstract class View {

  /** Column names visible in this view; hidden columns are "". */
  public abstract String[] columns();

  /** Moves the cursor to before the first row. */
  public abstract void reset();

  /** Returns the next row of this view, or null if there are no more. The
   * array is shared with the base table and must not be modified.
   */
  public abstract String[] next();

  /** Returns a view showing only rows having the given value in the column. */
  public View select(String column, String value) {
    return new SelectView(this, find(columns(), column), value);
  }

  /** Returns a view hiding the named column. */
  public View drop(String column) {
    return new DropView(this, find(columns(), column));
  }

  /** True if the column is visible in this view. */
  public boolean has(String column) {
    if( Strings.isNullOrEmpty(column) ) return false;
    for( String c : columns() ) if( c.equals(column) ) return true;
    return false;
  }

  /** Returns the position of the named column.
   * @throws ColumnNotFoundException if the column is not in the array
   */
  public static int find(String[] columns, String column) {
    if( !Strings.isNullOrEmpty(column) )
      for( int i = 0; i < columns.length; ++i )
        if( columns[i].equals(column) ) return i;
    throw new ColumnNotFoundException(column);
  }

  /** The base view; holds the header and the data rows. */
  public static final class Table extends View {
    private final String[] _columns;
    private final List<String[]> _rows;
    private int _next;          // Index of the next row to return

    /** Creates a table from CSV conformant data. The first row holds the
     * column names, which must be non-empty and unique; every other row must
     * have as many fields as the header. The rows are copied, later changes
     * to the given arrays do not show in the table.
     */
    public static Table make(List<String[]> data) {
      if( data.isEmpty() ) throw new IllegalArgumentException("No header row");
      String[] header = data.get(0);
      HashSet<String> seen = new HashSet<String>();
      for( String c : header ) {
        if( Strings.isNullOrEmpty(c) ) throw new IllegalArgumentException("Empty column name in header");
        if( !seen.add(c) ) throw new IllegalArgumentException("Duplicate column '" + c + "' in header");
      }
      List<String[]> rows = Lists.newArrayListWithCapacity(data.size() - 1);
      for( int i = 1; i < data.size(); ++i ) {
        String[] row = data.get(i);
        if( row.length != header.length )
          throw new IllegalArgumentException("Row " + i + " has " + row.length + " fields, expected " + header.length);
        rows.add(row.clone());
      }
      return new Table(header.clone(), rows);
    }

    /** Reads CSV text, see {@link #make(List)}. */
    public static Table read(Reader reader) throws IOException, CsvParseException {
      return make(new CsvReader(reader).readAll());
    }

    private Table(String[] columns, List<String[]> rows) {
      _columns = columns;
      _rows = rows;
    }

    /** Number of data rows. */
    public int rows() { return _rows.size(); }

    @Override public String[] columns() { return _columns.clone(); }
    @Override public void reset() { _next = 0; }
    @Override public String[] next() {
      return _next < _rows.size() ? _rows.get(_next++) : null;
    }
  }

  /** Filters the parent rows on the value of one column. */
  static final class SelectView extends View {
    final View _parent;
    final int _col;             // Column position to select on
    final String _val;          // Value to keep

    SelectView(View parent, int col, String val) {
      _parent = parent;  _col = col;  _val = val;
    }

    @Override public String[] columns() { return _parent.columns(); }
    @Override public void reset() { _parent.reset(); }
    @Override public String[] next() {
      for( String[] row = _parent.next(); row != null; row = _parent.next() )
        if( _val.equals(row[_col]) ) return row;
      return null;
    }
  }

  /** Hides one column of the parent. Rows pass through untouched. */
  static final class DropView extends View {
    final View _parent;
    final int _drop;            // Column position to hide

    DropView(View parent, int drop) {
      _parent = parent;  _drop = drop;
    }

    @Override public String[] columns() {
      String[] c = _parent.columns();
      c[_drop] = "";
      return c;
    }
    @Override public void reset() { _parent.reset(); }
    @Override public String[] next() { return _parent.next(); }
  }
}
