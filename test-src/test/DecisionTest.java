package test;

import static org.junit.Assert.*;
import hex.id3.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

public class DecisionTest {
  static final String[] HEADER = TestUtil.row("outlook","temperature","humidity","wind","play");

  @Test public void testDecide() {
    Decision rule = LearnerTest.weatherTree();
    List<String[]> data = Arrays.asList(HEADER, TestUtil.row("sunny","hot","high","weak","no"));
    List<String> answer = rule.decide(data);
    assertEquals(1, answer.size());
    assertEquals(data.get(1)[4], answer.get(0));
  }

  @Test public void testDecideKeepsRowOrder() {
    Decision rule = LearnerTest.weatherTree();
    List<String[]> data = Arrays.asList(
        TestUtil.row("wind","outlook","humidity"),
        TestUtil.row("strong","rain","high"),
        TestUtil.row("weak","sunny","normal"),
        TestUtil.row("weak","overcast","high"),
        TestUtil.row("weak","rain","high"));
    assertEquals(Arrays.asList("no","yes","yes","yes"), rule.decide(data));
    assertTrue(rule.decide(Collections.<String[]>emptyList()).isEmpty());
  }

  @Test public void testDecideView() {
    Decision rule = LearnerTest.weatherTree();
    View view = TestUtil.weather().select("outlook", "rain");
    assertEquals(Arrays.asList("yes","yes","no","yes","no"), rule.decide(view));
  }

  @Test public void testUnrecognizedCategory() {
    Decision rule = LearnerTest.weatherTree();
    try {
      rule.classify(HEADER, TestUtil.row("sunny","hot","muggy","weak","no"));
      fail();
    } catch( UnrecognizedCategoryException e ) {
      assertEquals("humidity", e._column);
      assertEquals("muggy", e._value);
    }
    try {
      rule.classify(HEADER, TestUtil.row("fog","hot","high","weak","no"));
      fail();
    } catch( UnrecognizedCategoryException e ) {
      assertEquals("outlook", e._column);
    }
  }

  @Test(expected = ColumnNotFoundException.class)
  public void testDecidedColumnMissing() {
    LearnerTest.weatherTree().classify(TestUtil.row("outlook","wind"), TestUtil.row("sunny","weak"));
  }

  @Test public void testDecideRejectsRaggedRows() {
    List<String[]> data = Arrays.asList(
        TestUtil.row("outlook","temperature","humidity","wind"),
        TestUtil.row("overcast","mild","normal","strong"),
        TestUtil.row("sunny","hot"));
    try {
      LearnerTest.weatherTree().decide(data);
      fail();
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Row 2 has 2 fields"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testClassifyRejectsShortRow() {
    LearnerTest.weatherTree().classify(TestUtil.row("outlook","temperature","humidity","wind"), TestUtil.row("sunny","hot"));
  }

  @Test public void testDepthAndLeavesOfParsedTree() {
    Decision d = Decision.parse(LearnerTest.weatherTree().toJsonString(false));
    assertEquals(2, d.depth());
    assertEquals(5, d.leaves());
    Decision flat = new Decision("wind", Arrays.asList(new Case.Leaf("weak","yes"), new Case.Leaf("strong","no")));
    assertEquals(1, flat.depth());
    assertEquals(2, flat.leaves());
  }

  @Test public void testInvalidTrees() {
    try {
      new Decision("outlook", Collections.<Case>emptyList());
      fail();
    } catch( IllegalArgumentException e ) { }
    try {
      new Case.Leaf("sunny", "");
      fail();
    } catch( IllegalArgumentException e ) { }
    try {
      new Case.Branch("sunny", null);
      fail();
    } catch( IllegalArgumentException e ) { }
  }

  @Test public void testJsonFields() {
    JsonObject o = LearnerTest.weatherTree().toJson();
    assertEquals("outlook", o.get("column").getAsString());
    JsonArray cases = o.getAsJsonArray("cases");
    assertEquals(3, cases.size());
    JsonObject sunny = cases.get(0).getAsJsonObject();
    assertEquals("sunny", sunny.get("value").getAsString());
    assertFalse(sunny.has("class"));
    assertEquals("humidity", sunny.getAsJsonObject("decide").get("column").getAsString());
    JsonObject overcast = cases.get(2).getAsJsonObject();
    assertEquals("yes", overcast.get("class").getAsString());
    assertFalse(overcast.has("decide"));
  }

  @Test public void testJsonRoundTrip() {
    Decision tree = Learner.learn(TestUtil.weather(), "play");
    for( boolean pretty : new boolean[] { false, true } ) {
      String json = tree.toJsonString(pretty);
      Decision d = Decision.parse(json);
      assertEquals(tree, d);
      assertEquals(tree.toString(), d.toString());
      assertEquals(json, d.toJsonString(pretty));
      List<String[]> data = TestUtil.load_test_file("smalldata/weather/weather.csv");
      assertEquals(tree.decide(data), d.decide(data));
    }
  }

  @Test public void testParseAcceptsEmptyClassAndNullDecide() {
    Decision d = Decision.parse(
        "{\"column\":\"a\",\"cases\":[" +
        "{\"value\":\"x\",\"class\":\"\",\"decide\":{\"column\":\"b\",\"cases\":[{\"value\":\"1\",\"class\":\"k\",\"decide\":null}]}}," +
        "{\"value\":\"y\",\"class\":\"j\"}]}");
    assertEquals("a(x:b(1:k),y:j)", d.toString());
  }

  @Test public void testParseMalformed() {
    assertMalformed("[]");
    assertMalformed("{\"cases\":[{\"value\":\"x\",\"class\":\"k\"}]}");
    assertMalformed("{\"column\":\"a\",\"cases\":[]}");
    assertMalformed("{\"column\":\"a\"}");
    assertMalformed("{\"column\":\"a\",\"cases\":[{\"class\":\"k\"}]}");
    assertMalformed("{\"column\":\"a\",\"cases\":[{\"value\":\"x\"}]}");
    assertMalformed("{\"column\":\"a\",\"cases\":[{\"value\":\"x\",\"class\":\"k\",\"decide\":{\"column\":\"b\",\"cases\":[{\"value\":\"1\",\"class\":\"k\"}]}}]}");
    assertMalformed("{\"column\":\"a\",\"cases\":[{\"value\":\"x\",\"decide\":{\"column\":\"b\",\"cases\":[]}}]}");
    assertMalformed("{\"column\":[1],\"cases\":[{\"value\":\"x\",\"class\":\"k\"}]}");
    assertMalformed("{\"column\":\"a\",\"cases\":[");
  }

  private static void assertMalformed(String json) {
    try {
      Decision.parse(json);
      fail("parsed " + json);
    } catch( JsonParseException e ) { }
  }
}
