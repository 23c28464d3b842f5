package hex.id3;

import hex.id3.Case.Branch;
import hex.id3.Case.Leaf;

import java.io.*;

import com.google.common.base.Strings;

/** Prints a decision tree as Java-like code over a map of column values.
 * Every decision is a switch on its column; values the tree has no case for
 * fall to a default that throws {@link UnrecognizedCategoryException}.
 */
public class CodeTreePrinter extends TreePrinter {
  private int _indent;

  public CodeTreePrinter(OutputStream dest) {
    this(new OutputStreamWriter(dest));
  }

  public CodeTreePrinter(Appendable dest) { super(dest); }

  @Override public void printTree(Decision d) throws IOException {
    _indent = 0;
    line("String classify(Map<String,String> row) {");
    _indent++;
    d.print(this);
    _indent--;
    line("}");
    flush();
  }

  @Override void printDecision(Decision d) throws IOException {
    line("switch (row.get(" + quote(d._column) + ")) {");
    for( Case c : d._cases ) c.print(this, d);
    line("default: throw new UnrecognizedCategoryException(" + quote(d._column) + ", row.get(" + quote(d._column) + "));");
    line("}");
  }

  @Override void printLeaf(Decision parent, Leaf c) throws IOException {
    line("case " + quote(c._value) + ": return " + quote(c._class) + ";");
  }

  @Override void printBranch(Decision parent, Branch c) throws IOException {
    line("case " + quote(c._value) + ":");
    _indent++;
    printDecision(c._decide);
    _indent--;
  }

  private void line(String s) throws IOException {
    _dest.append(Strings.repeat("  ", _indent)).append(s).append('\n');
  }
}
