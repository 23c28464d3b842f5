package water;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * Command line arguments of the form "-name value" or "-flag".
 *
 * Options are declared as the non-static fields of an {@link Opt} subclass and
 * filled in by {@link #extract(Opt)}; the field name is the option name. A
 * boolean field is a flag and takes no value. Fields of type String, int,
 * long, double and float take the next argument as their value.
 */
public class Arguments {

  /** Base of option holders. */
  public static class Opt {
    @Override public String toString() {
      StringBuilder sb = new StringBuilder();
      for( Field f : fields(getClass()) ) {
        try {
          if( sb.length() > 0 ) sb.append(' ');
          sb.append('-').append(f.getName()).append('=').append(f.get(this));
        } catch( IllegalAccessException e ) { throw new Error(e); }
      }
      return sb.toString();
    }
  }

  private final String[] _args;

  public Arguments(String[] args) { _args = args.clone(); }

  /** Fills the option holder from the arguments.
   * @throws IllegalArgumentException on unknown options, missing or malformed values
   */
  public void extract(Opt opts) {
    List<Field> fields = fields(opts.getClass());
    for( int i = 0; i < _args.length; ++i ) {
      String a = _args[i];
      if( !a.startsWith("-") || a.length() == 1 ) throw new IllegalArgumentException("Unexpected argument '" + a + "'");
      String name = a.substring(a.startsWith("--") ? 2 : 1);
      Field f = field(fields, name);
      if( f == null ) throw new IllegalArgumentException("Unknown option '" + a + "'");
      Class<?> t = f.getType();
      try {
        if( t == boolean.class ) { f.setBoolean(opts, true); continue; }
        if( ++i == _args.length ) throw new IllegalArgumentException("Option '" + a + "' needs a value");
        String v = _args[i];
        if( t == String.class )      f.set(opts, v);
        else if( t == int.class )    f.setInt(opts, Integer.parseInt(v));
        else if( t == long.class )   f.setLong(opts, Long.parseLong(v));
        else if( t == double.class ) f.setDouble(opts, Double.parseDouble(v));
        else if( t == float.class )  f.setFloat(opts, Float.parseFloat(v));
        else throw new IllegalArgumentException("Option '" + a + "' has unsupported type " + t.getSimpleName());
      } catch( NumberFormatException e ) {
        throw new IllegalArgumentException("Option '" + a + "' expects a number, got '" + _args[i] + "'", e);
      } catch( IllegalAccessException e ) {
        throw new Error(e);
      }
    }
  }

  private static Field field(List<Field> fields, String name) {
    for( Field f : fields ) if( f.getName().equals(name) ) return f;
    return null;
  }

  // Option fields of the class and its superclasses, made accessible
  static List<Field> fields(Class<?> c) {
    List<Field> res = Lists.newArrayList();
    for( ; c != Opt.class && c != Object.class; c = c.getSuperclass() )
      for( Field f : c.getDeclaredFields() ) {
        int m = f.getModifiers();
        if( Modifier.isStatic(m) || Modifier.isFinal(m) || f.isSynthetic() ) continue;
        f.setAccessible(true);
        res.add(f);
      }
    return res;
  }
}
