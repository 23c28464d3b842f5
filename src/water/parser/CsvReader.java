package water.parser;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.collect.Lists;
import com.google.common.io.Files;

/**
 * Simple CSV reader, splits character data into records of string fields.
 *
 * Fields are separated by the separator character (a comma by default) and
 * records by a newline; "\r\n" counts as a single newline while a lone '\r'
 * is data. A field may be quoted with '"', in which case it can hold
 * separators and newlines, and a doubled quote stands for a single one. Only
 * spaces may follow the closing quote of a field. Empty lines are skipped.
 * Records are not required to have the same number of fields.
 */
public final class CsvReader {
  private final Reader _in;
  private final char _separator;
  private final char[] _buf = new char[8192];
  private int _len, _pos;

  private final StringBuilder _field = new StringBuilder();
  private List<String> _record = Lists.newArrayList();
  private int _state;           // See addChar
  private int _line = 1;        // Line of the current character, for errors
  private int _quoteLine;       // Line the open quoted field started on
  private boolean _newLineFlag; // A '\r' was read, waiting to see a '\n'

  public CsvReader(Reader in) { this(in, ','); }

  public CsvReader(Reader in, char separator) {
    _in = in;
    _separator = separator;
  }

  /** Reads a UTF-8 CSV file. */
  public static List<String[]> read(File f) throws IOException, CsvParseException {
    Reader r = Files.newReader(f, StandardCharsets.UTF_8);
    try {
      return new CsvReader(r).readAll();
    } finally {
      r.close();
    }
  }

  /** Reads all remaining records. */
  public List<String[]> readAll() throws IOException, CsvParseException {
    List<String[]> res = Lists.newArrayList();
    for( String[] r = next(); r != null; r = next() ) res.add(r);
    return res;
  }

  /** Returns the next record, or null at the end of the input. */
  public String[] next() throws IOException, CsvParseException {
    int c;
    while( (c = read()) != -1 ) {
      char ch = (char) c;
      // Lines can end with \r\n or just \n; a \r that is not followed by \n
      // is kept as data.
      if( _newLineFlag ) {
        _newLineFlag = false;
        if( ch != '\n' ) addChar('\r');
      }
      if( ch == '\r' && _state != 2 ) {
        _newLineFlag = true;
        continue;
      }
      if( addChar(ch) ) return endRecord();
      if( ch == '\n' ) _line++;
    }
    if( _newLineFlag ) {        // Input ended with a \r
      _newLineFlag = false;
      if( addChar('\n') ) return endRecord();
    }
    if( _state == 2 ) throw new CsvParseException(_quoteLine, "unterminated quoted field");
    if( _state == 0 && _record.isEmpty() && _field.length() == 0 ) return null;
    endField();
    return endRecord();
  }

  // Returns true when the character ends a (non-empty) record.
  private boolean addChar(char c) throws CsvParseException {
    switch( _state ) {
    case 0: // the beginning of a field
      if( c == _separator ) {
        endField();
      } else if( c == '\n' ) {
        if( _record.isEmpty() ) return false; // ignore empty line
        endField();
        return true;
      } else if( c == '"' ) {
        _quoteLine = _line;
        _state = 2;
      } else {
        _field.append(c);
        _state = 1;
      }
      return false;
    case 1: // unquoted field
      if( c == _separator ) endField();
      else if( c == '\n' ) { endField(); return true; }
      else _field.append(c);
      return false;
    case 2: // quoted state! anything but " is treated as data
      if( c == '"' ) _state = 3;
      else _field.append(c);
      return false;
    case 3: // either end of a quoted region or a doubled quote inside it
      if( c == '"' ) {
        _field.append('"');
        _state = 2;
      } else if( c == _separator ) {
        endField();
      } else if( c == '\n' ) {
        endField();
        return true;
      } else if( c == ' ' || c == '\t' ) {
        _state = 4;
      } else {
        throw new CsvParseException(_line, "unexpected character '" + c + "' after quoted field '" + _field + "'");
      }
      return false;
    case 4: // spaces appended to the end of a quoted field, nothing else allowed here
      if( c == _separator ) endField();
      else if( c == '\n' ) { endField(); return true; }
      else if( c != ' ' && c != '\t' ) throw new CsvParseException(_line, "unexpected character '" + c + "'");
      return false;
    default:
      throw new CsvParseException(_line, "unexpected state during CSV parsing");
    }
  }

  private void endField() {
    _record.add(_field.toString());
    _field.setLength(0);
    _state = 0;
  }

  private String[] endRecord() {
    String[] res = _record.toArray(new String[_record.size()]);
    _record = Lists.newArrayListWithCapacity(res.length);
    _state = 0;
    _line++;
    return res;
  }

  private int read() throws IOException {
    if( _pos == _len ) {
      _len = _in.read(_buf, 0, _buf.length);
      _pos = 0;
      if( _len <= 0 ) { _len = 0; return -1; }
    }
    return _buf[_pos++];
  }

  public static class CsvParseException extends Exception {
    private static final long serialVersionUID = 1L;

    public final int _line;

    public CsvParseException(int line, String msg) {
      super("line " + line + ": " + msg);
      _line = line;
    }
  }
}
