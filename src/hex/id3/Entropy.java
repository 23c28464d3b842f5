package hex.id3;

import java.util.*;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/** Shannon entropy over the class column of a view.
 *
 * The entropy of a view is the classic
 *
 *   - \sum(p_i * log2(p_i))
 *
 * where p_i is the probability of the i-th class value among the view's rows.
 * The average entropy of an attribute is the class entropy of each partition
 * induced by the attribute's distinct values, weighted by the probability of
 * that value. Information gain is the difference of the two.
 */
public final class Entropy {
  private Entropy() { }

  static final Comparator<Distinct> DECREASING = new Comparator<Distinct>() {
    @Override public int compare(Distinct a, Distinct b) {
      return Double.compare(b._probability, a._probability);
    }
  };

  /** Returns the probability of each distinct value of the column in the view,
   * in decreasing probability. Equally likely values keep the order they were
   * first seen in, so the result is reproducible. Rewinds the view.
   */
  public static List<Distinct> likelihood(View view, String column) {
    int i = View.find(view.columns(), column);
    LinkedHashMap<String, int[]> counts = Maps.newLinkedHashMap();
    int total = 0;
    view.reset();
    for( String[] row = view.next(); row != null; row = view.next() ) {
      int[] cnt = counts.get(row[i]);
      if( cnt == null ) counts.put(row[i], cnt = new int[1]);
      cnt[0]++;
      total++;
    }
    List<Distinct> sorted = Lists.newArrayListWithCapacity(counts.size());
    for( Map.Entry<String, int[]> e : counts.entrySet() )
      sorted.add(new Distinct(e.getKey(), e.getValue()[0] / (double) total));
    Collections.sort(sorted, DECREASING); // Stable
    return sorted;
  }

  /** Entropy term of a single probability; zero for p of 0 and 1. */
  public static double entropy(double p) {
    if( p == 0 || p == 1 ) return 0;
    return -p * Math.log(p) / LN2;
  }
  private static final double LN2 = Math.log(2);

  /** Entropy of the class column in the view. */
  public static double totalEntropy(View view, String classColumn) {
    double h = 0;
    for( Distinct d : likelihood(view, classColumn) ) h += entropy(d._probability);
    return h;
  }

  /** Expected class entropy after splitting the view on the attribute. */
  public static double averageEntropy(View view, String attribute, String classColumn) {
    View.find(view.columns(), classColumn); // Class column must be visible
    double h = 0;
    for( Distinct d : likelihood(view, attribute) )
      h += d._probability * totalEntropy(view.select(attribute, d._value), classColumn);
    return h;
  }

  /** Information gain of splitting the view on the attribute. */
  public static double gain(View view, String attribute, String classColumn) {
    return totalEntropy(view, classColumn) - averageEntropy(view, attribute, classColumn);
  }
}
