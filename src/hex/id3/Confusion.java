package hex.id3;

import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Confusion Matrix of a decision tree over labeled data: a NxN matrix of
 * [actual] -vs- [predicted] classes, referenced as _matrix[actual][predicted].
 * Classes are numbered in the order they are first seen, actual before
 * predicted. Rows the tree has no rule for are errors, counted apart from the
 * matrix.
 */
public class Confusion {
  /** Class names, indexing the matrix. */
  public final String[] _classes;
  public final long[][] _matrix;
  /** Rows holding a category the tree does not know. */
  public final long _unrecognized;
  private final long _rows;
  private final long _errors;

  private Confusion(String[] classes, long[][] matrix, long unrecognized, long rows, long errors) {
    _classes = classes;  _matrix = matrix;  _unrecognized = unrecognized;
    _rows = rows;  _errors = errors;
  }

  /** Classifies every row of the view and compares with its class column.
   * Rewinds the view.
   */
  public static Confusion make(Decision tree, View view, String classColumn) {
    String[] header = view.columns();
    int ci = View.find(header, classColumn);
    Map<String, Integer> index = Maps.newLinkedHashMap();
    List<int[]> pairs = Lists.newArrayList();
    long unrecognized = 0, rows = 0, errors = 0;
    view.reset();
    for( String[] row = view.next(); row != null; row = view.next() ) {
      rows++;
      int actual = index(index, row[ci]);
      String predicted;
      try {
        predicted = tree.classify(header, row);
      } catch( UnrecognizedCategoryException e ) {
        unrecognized++;
        errors++;
        continue;
      }
      if( !predicted.equals(row[ci]) ) errors++;
      pairs.add(new int[] { actual, index(index, predicted) });
    }
    int n = index.size();
    long[][] matrix = new long[n][n];
    for( int[] p : pairs ) matrix[p[0]][p[1]]++;
    return new Confusion(index.keySet().toArray(new String[n]), matrix, unrecognized, rows, errors);
  }

  private static int index(Map<String, Integer> index, String c) {
    Integer i = index.get(c);
    if( i == null ) index.put(c, i = index.size());
    return i;
  }

  /** Number of rows classified. */
  public long rows()   { return _rows; }
  /** Number of mistaken or unrecognized rows. */
  public long errors() { return _errors; }
  public double errorRate() { return _rows == 0 ? 0 : _errors / (double) _rows; }

  /** Text form of the confusion matrix */
  @Override public String toString() {
    final int N = _classes.length, K = N + 1;
    String[][] cms = new String[K][K + 1];
    cms[0][0] = "";
    for( int i = 1; i < K; i++ ) cms[0][i] = _classes[i - 1];
    cms[0][K] = "err/class";
    for( int j = 1; j < K; j++ ) {
      cms[j][0] = _classes[j - 1];
      long tot = 0;
      for( int i = 1; i < K; i++ ) {
        cms[j][i] = "" + _matrix[j - 1][i - 1];
        tot += _matrix[j - 1][i - 1];
      }
      long err = tot - _matrix[j - 1][j - 1];
      cms[j][K] = tot == 0 ? "-" : Utils.p2d(err / (double) tot);
    }
    int maxlen = 0;
    for( String[] r : cms )
      for( String s : r ) maxlen = Math.max(maxlen, s.length());
    StringBuilder sb = new StringBuilder();
    for( String[] r : cms ) {
      for( String s : r ) sb.append(' ').append(Strings.padStart(s, maxlen, ' '));
      sb.append('\n');
    }
    if( _unrecognized > 0 ) sb.append("Unrecognized rows: ").append(_unrecognized).append('\n');
    return sb.toString();
  }
}
