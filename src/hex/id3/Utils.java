package hex.id3;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class Utils {

  public static String p2d(double d) { return df.format(d); }
  static final DecimalFormat df = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
  public static String p5d(double d) { return df5.format(d); }
  static final DecimalFormat df5 = new DecimalFormat("0.#####", DecimalFormatSymbols.getInstance(Locale.ROOT));

  public static void pln(String s) { System.out.println(s); }
}
