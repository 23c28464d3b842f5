package hex.id3;

import hex.id3.Case.Branch;
import hex.id3.Case.Leaf;

import java.io.Flushable;
import java.io.IOException;

/** Renders a decision tree. The tree walks itself, calling back into the
 * printer for each decision and case.
 */
public abstract class TreePrinter {
  protected final Appendable _dest;

  public TreePrinter(Appendable dest) { _dest = dest; }

  public abstract void printTree(Decision d) throws IOException;
  abstract void printDecision(Decision d) throws IOException;
  abstract void printLeaf(Decision parent, Leaf c) throws IOException;
  abstract void printBranch(Decision parent, Branch c) throws IOException;

  final void flush() throws IOException {
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  // Quote for both Graphviz labels and Java string literals
  static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
