package hex.id3;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

import water.Arguments;
import water.Log;
import water.Timer;
import water.parser.CsvReader;
import water.parser.CsvReader.CsvParseException;

import com.google.common.base.Strings;
import com.google.common.io.Files;
import com.google.gson.JsonParseException;

/**
 * Command line driver.
 *
 * Learns a tree:     -train weather.csv -class play [-model tree.json] [-pretty] [-graphviz tree.dot] [-code]
 * Classifies rows:   -model tree.json -classify rows.csv
 *
 * Both can be given at once, in which case the freshly learned tree is used
 * for classification.
 */
public class ID3 {

  public static class OptArgs extends Arguments.Opt {
    public String train;  // CSV file to learn from
    public String clazz;  // Class column; -class on the command line
    public String model;  // JSON tree; written after training, read otherwise
    public String classify;  // CSV file to classify
    public String graphviz;  // Dot file to render the tree to
    public boolean code;  // Print the tree as code
    public boolean pretty;  // Indent the JSON tree
  }

  public static void main(String[] args) {
    OptArgs opts = new OptArgs();
    try {
      new Arguments(rename(args)).extract(opts);
      run(opts, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    } catch( IllegalArgumentException e ) {
      Log.die("[ID3] " + e.getMessage());
    } catch( ColumnNotFoundException e ) {
      Log.die("[ID3] " + e.getMessage());
    } catch( UnrecognizedCategoryException e ) {
      Log.die("[ID3] " + e.getMessage());
    } catch( JsonParseException e ) {
      Log.die("[ID3] Malformed tree: " + e.getMessage());
    } catch( CsvParseException e ) {
      Log.die("[ID3] Malformed CSV, " + e.getMessage());
    } catch( IOException e ) {
      Log.die("[ID3] " + e);
    }
  }

  // "class" is a keyword, so the option lands in the clazz field
  static String[] rename(String[] args) {
    String[] res = args.clone();
    for( int i = 0; i < res.length; ++i )
      if( res[i].equals("-class") || res[i].equals("--class") ) res[i] = "-clazz";
    return res;
  }

  /** Runs the driver; classifications are written to out, one per line.
   * Returns the tree learned or loaded.
   */
  public static Decision run(OptArgs opts, PrintWriter out) throws IOException, CsvParseException {
    Decision tree;
    if( opts.train != null ) {
      if( Strings.isNullOrEmpty(opts.clazz) ) throw new IllegalArgumentException("-class is required with -train");
      tree = train(opts);
    } else if( opts.model != null ) {
      tree = Decision.parse(Files.asCharSource(new File(opts.model), StandardCharsets.UTF_8).read());
      Utils.pln("[ID3] Loaded " + opts.model + ", depth=" + tree.depth() + " leaves=" + tree.leaves());
    } else {
      throw new IllegalArgumentException("Nothing to do, give -train or -model");
    }
    if( opts.classify != null ) {
      Timer t = new Timer();
      List<String> classes = tree.decide(CsvReader.read(new File(opts.classify)));
      for( String c : classes ) out.println(c);
      out.flush();
      Utils.pln("[ID3] Classified " + classes.size() + " rows in " + t);
    }
    return tree;
  }

  private static Decision train(OptArgs opts) throws IOException, CsvParseException {
    Timer t = new Timer();
    View.Table data = View.Table.make(CsvReader.read(new File(opts.train)));
    Utils.pln("[ID3] Read " + data.rows() + " rows of " + opts.train + " in " + t);
    t = new Timer();
    Decision tree = Learner.learn(data, opts.clazz);
    Utils.pln("[ID3] Tree d=" + tree.depth() + " leaves=" + tree.leaves() + " built in " + t);
    Confusion cm = Confusion.make(tree, data, opts.clazz);
    Utils.pln("[ID3] Training error rate " + Utils.p5d(cm.errorRate()) + " on " + cm.rows() + " rows\n" + cm);
    if( opts.model != null ) {
      Files.asCharSink(new File(opts.model), StandardCharsets.UTF_8).write(tree.toJsonString(opts.pretty));
      Utils.pln("[ID3] Wrote " + opts.model);
    } else {
      Utils.pln(tree.toJsonString(opts.pretty));
    }
    if( opts.graphviz != null ) {
      Writer w = Files.newWriter(new File(opts.graphviz), StandardCharsets.UTF_8);
      try {
        new GraphvizTreePrinter(w).printTree(tree);
      } finally {
        w.close();
      }
      Utils.pln("[ID3] Wrote " + opts.graphviz);
    }
    if( opts.code ) {
      StringBuilder sb = new StringBuilder();
      new CodeTreePrinter(sb).printTree(tree);
      Utils.pln(sb.toString());
    }
    return tree;
  }
}
