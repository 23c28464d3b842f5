package hex.id3;

import java.util.List;

import com.google.common.collect.Lists;

/** The ID3 algorithm.
 *
 * At each level the attribute column with the largest information gain is
 * chosen, the view is partitioned on each of its distinct values (most likely
 * first) and every partition that still holds more than one class is learned
 * recursively with the chosen column dropped. Ties in gain go to the column
 * that comes first in the header.
 *
 * A partition that is impure but has no attribute columns left (the same
 * attribute values map to different classes) becomes a leaf holding its most
 * likely class.
 */
public final class Learner {
  private Learner() { }

  /** Learns a decision tree for the class column from the rows of the view. */
  public static Decision learn(View view, String classColumn) {
    View.find(view.columns(), classColumn);
    view.reset();
    if( view.next() == null ) throw new IllegalArgumentException("cannot learn from an empty dataset");
    if( attributes(view, classColumn).isEmpty() )
      throw new IllegalArgumentException("no attribute columns to learn from, class column is '" + classColumn + "'");
    return decide(view, classColumn);
  }

  // The view is non-empty and has at least one attribute column.
  private static Decision decide(View view, String classColumn) {
    double h = Entropy.totalEntropy(view, classColumn);
    double maxGain = -1;
    String maxColumn = null;
    for( String c : attributes(view, classColumn) ) {
      double gain = h - Entropy.averageEntropy(view, c, classColumn);
      if( gain > maxGain ) {
        maxGain = gain;
        maxColumn = c;
      }
    }
    assert maxColumn != null;
    List<Case> cases = Lists.newArrayList();
    for( Distinct d : Entropy.likelihood(view, maxColumn) ) {
      View sub = view.select(maxColumn, d._value);
      if( Entropy.totalEntropy(sub, classColumn) == 0 ) {
        sub.reset();
        String[] row = sub.next();
        cases.add(new Case.Leaf(d._value, row[View.find(sub.columns(), classColumn)]));
        continue;
      }
      View rest = sub.drop(maxColumn);
      if( attributes(rest, classColumn).isEmpty() ) {
        // Nothing left to split on; go with the most likely class
        String majority = Entropy.likelihood(rest, classColumn).get(0)._value;
        cases.add(new Case.Leaf(d._value, majority));
      } else {
        cases.add(new Case.Branch(d._value, decide(rest, classColumn)));
      }
    }
    return new Decision(maxColumn, cases);
  }

  /** Visible columns of the view other than the class column, in order. */
  static List<String> attributes(View view, String classColumn) {
    List<String> res = Lists.newArrayList();
    for( String c : view.columns() )
      if( !c.isEmpty() && !c.equals(classColumn) ) res.add(c);
    return res;
  }
}
