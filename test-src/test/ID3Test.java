package test;

import static org.junit.Assert.*;
import hex.id3.Decision;
import hex.id3.ID3;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import water.Arguments;

import com.google.common.io.Files;

public class ID3Test {
  @Rule public TemporaryFolder _tmp = new TemporaryFolder();

  static ID3.OptArgs opts(String... args) {
    ID3.OptArgs o = new ID3.OptArgs();
    new Arguments(args).extract(o);
    return o;
  }

  @Test public void testTrainThenClassify() throws Exception {
    String weather = TestUtil.find_test_file("smalldata/weather/weather.csv").getPath();
    File model = _tmp.newFile("tree.json");
    File dot = new File(_tmp.getRoot(), "tree.dot");
    StringWriter out = new StringWriter();
    Decision learned = ID3.run(opts("-train", weather, "-clazz", "play", "-model", model.getPath(),
                                    "-graphviz", dot.getPath(), "-pretty"), new PrintWriter(out));
    assertEquals(LearnerTest.weatherTree(), learned);
    assertEquals(learned, Decision.parse(Files.asCharSource(model, StandardCharsets.UTF_8).read()));
    assertTrue(Files.asCharSource(dot, StandardCharsets.UTF_8).read().startsWith("digraph {"));
    assertEquals("", out.toString());

    File rows = _tmp.newFile("rows.csv");
    Files.asCharSink(rows, StandardCharsets.UTF_8).write(
        "outlook,temperature,humidity,wind\nsunny,hot,high,weak\novercast,mild,normal,strong\nrain,cool,high,strong\n");
    out = new StringWriter();
    Decision loaded = ID3.run(opts("-model", model.getPath(), "-classify", rows.getPath()), new PrintWriter(out));
    assertEquals(learned, loaded);
    assertEquals("no\nyes\nno\n", out.toString().replace("\r\n", "\n"));
  }

  @Test public void testClassifyRejectsRaggedRows() throws Exception {
    File model = _tmp.newFile("tree.json");
    Files.asCharSink(model, StandardCharsets.UTF_8).write(LearnerTest.weatherTree().toJsonString(false));
    File rows = _tmp.newFile("rows.csv");
    Files.asCharSink(rows, StandardCharsets.UTF_8).write("outlook,temperature,humidity,wind\nsunny,hot\n");
    StringWriter out = new StringWriter();
    try {
      ID3.run(opts("-model", model.getPath(), "-classify", rows.getPath()), new PrintWriter(out));
      fail();
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage(), e.getMessage().contains("Row 1 has 2 fields, expected 4"));
    }
    assertEquals("", out.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNothingToDo() throws Exception {
    ID3.run(opts(), new PrintWriter(new StringWriter()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTrainNeedsClass() throws Exception {
    ID3.run(opts("-train", "x.csv"), new PrintWriter(new StringWriter()));
  }
}
