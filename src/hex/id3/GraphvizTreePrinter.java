package hex.id3;

import hex.id3.Case.Branch;
import hex.id3.Case.Leaf;

import java.io.*;

/** Prints a decision tree in the Graphviz dot language. Decisions are boxes
 * labeled with their column, leaves are ellipses labeled with their class and
 * each edge is labeled with the case value.
 */
public class GraphvizTreePrinter extends TreePrinter {
  private int _ids;             // Node ids, in print order

  public GraphvizTreePrinter(OutputStream dest) {
    this(new OutputStreamWriter(dest));
  }

  public GraphvizTreePrinter(Appendable dest) { super(dest); }

  @Override public void printTree(Decision d) throws IOException {
    _ids = 0;
    _dest.append("digraph {\n");
    d.print(this);
    _dest.append("}\n");
    flush();
  }

  // Prints the decision node and everything below it; the node takes the
  // next id, children follow.
  @Override void printDecision(Decision d) throws IOException {
    int obj = _ids++;
    _dest.append(String.format("%d [shape=box,label=%s];\n", obj, quote(d._column)));
    for( Case c : d._cases ) {
      int child = _ids;
      c.print(this, d);
      _dest.append(String.format("%d -> %d [label=%s];\n", obj, child, quote(c._value)));
    }
  }

  @Override void printLeaf(Decision parent, Leaf c) throws IOException {
    _dest.append(String.format("%d [label=%s];\n", _ids++, quote(c._class)));
  }

  @Override void printBranch(Decision parent, Branch c) throws IOException {
    printDecision(c._decide);
  }
}
