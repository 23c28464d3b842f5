package test;

import static org.junit.Assert.fail;

import hex.id3.View;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.junit.Ignore;

import water.parser.CsvReader;
import water.parser.CsvReader.CsvParseException;

@Ignore
public class TestUtil {
  public static File find_test_file( String fname ) {
    // When run from an IDE, the working directory may be different.
    // Try pointing at another likely place
    File file = new File(fname);
    if( !file.exists() ) file = new File("../"+fname);
    return file;
  }

  public static List<String[]> load_test_file( String fname ) {
    File file = find_test_file(fname);
    try {
      return CsvReader.read(file);
    } catch( IOException e ) {
      fail("failed load of "+file+": "+e);
    } catch( CsvParseException e ) {
      fail("failed parse of "+file+": "+e);
    }
    return null;
  }

  /** The 14-row play-tennis data set. */
  public static View.Table weather() {
    return View.Table.make(load_test_file("smalldata/weather/weather.csv"));
  }

  public static String[] row( String... fields ) { return fields; }

  /** Drains the view from the start. */
  public static int count( View v ) {
    int n = 0;
    v.reset();
    while( v.next() != null ) n++;
    return n;
  }
}
