package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import com.cliffc.lc.term.Term.Apply;
import com.cliffc.lc.term.Term.Ident;
import com.cliffc.lc.util.SB;

/** Parser for one line of lambda calculus.
 *
 *  <pre>
 *  stmt = def | term
 *  def  = ( '{' NAME '}' | DIGITS ) '=' term
 *  term = atom+                        // left-associative juxtaposition
 *  atom = VAR | '(' term ')' | 'λ' VAR '.' term | '{' NAME '}' | DIGITS
 *  </pre>
 *
 *  A VAR is any one character other than whitespace, digits and {@code {}λ.()=}.
 *  A Lambda body runs as far right as it can.  Shorthand references and
 *  numerals are replaced by their terms as they are parsed; all-digit names,
 *  braced or not, are numerals.
 */
public class Parse {
  private final String _src;    // Source for error messages; usually "stdin"
  private final char[] _buf;    // Chars being parsed
  private int _x;               // Parser index
  private final Shorthands _tab;

  public Parse( String src, String line, Shorthands tab ) {
    _src = src;
    _buf = line.toCharArray();
    _x   = 0;
    _tab = tab;
  }

  // Handy for the debugger to print
  @Override public String toString() { return new String(_buf,_x,_buf.length-_x); }

  /** A parsed line: a term, or a definition of {@code _def} as the term. */
  public static class Stmt {
    public final String _def;   // Shorthand name being defined, or null
    public final Term _term;
    Stmt( String def, Term term ) { _def=def; _term=term; }
    public boolean is_def() { return _def!=null; }
  }

  /** Parse the whole line.
   *  @throws ErrMsg ParseError on malformed input, UnknownShorthand on an
   *  undefined reference */
  public Stmt stmt() {
    if( skipWS() == -1 ) throw ErrMsg.syntax(this,"Empty input");
    String def = def_name();
    Term t = term();
    if( t == null ) {
      if( def != null ) throw ErrMsg.syntax(this,"Missing term after '='");
      throw err_unexpected();
    }
    if( skipWS() != -1 ) throw err_unexpected();
    return new Stmt(def,t);
  }

  // Leading "{NAME}=" or "DIGITS=".  Returns null and rewinds if not a def.
  private String def_name() {
    int oldx = _x;
    String name = null;
    if( peek('{') ) name = braced();
    else if( isDigit(_buf[_x]) ) name = digits();
    if( name != null && peek('=') ) return name;
    _x = oldx;
    return null;
  }

  /** An application sequence; null if no atom starts here */
  private Term term() {
    Term t = null;
    Term a;
    while( (a = atom()) != null )
      t = t==null ? a : new Apply(t,a);
    return t;
  }

  private Term atom() {
    int c = skipWS();
    if( c == -1 || c == ')' ) return null;
    int start = _x;

    // Parenthesized term
    if( peek('(') ) {
      Term t = term();
      if( t == null ) throw ErrMsg.syntax(this,"Missing term after '('");
      require(')');
      return t;
    }

    // Parse a Lambda; the body extends to the end of the enclosing scope
    if( peek('λ') ) {
      if( !isVar(skipWS()) ) throw ErrMsg.syntax(this,"Missing parameter after 'λ'");
      String arg = String.valueOf(_buf[_x++]);
      require('.');
      Term body = term();
      if( body == null ) throw ErrMsg.syntax(this,"Missing body after 'λ"+arg+".'");
      return Term.lam(arg,body);
    }

    // Shorthand reference, or braced numeral
    if( peek('{') ) {
      String name = braced();
      if( Shorthands.is_numeral(name) ) return numeral(name,start);
      Term t = _tab.get(name);
      if( t == null ) { _x = start; throw ErrMsg.unknown(this,name); }
      return t;
    }

    if( isDigit(c) ) return numeral(digits(),start);
    if( isVar(c) ) return new Ident(String.valueOf(_buf[_x++]));
    return null;                // Some other delimiter; caller decides
  }

  // After a '{'; the uppercased name up to the closing '}'
  private String braced() {
    int start = _x;
    while( _x < _buf.length && _buf[_x] != '}' ) {
      if( _buf[_x] == '{' ) throw ErrMsg.syntax(this,"Nested '{' in shorthand name");
      _x++;
    }
    if( _x == _buf.length ) { _x = start-1; throw ErrMsg.syntax(this,"Missing '}'"); }
    String name = new String(_buf,start,_x-start).trim();
    if( name.isEmpty() ) throw ErrMsg.syntax(this,"Empty shorthand name");
    _x++;                       // Skip '}'
    return Shorthands.canon(name);
  }

  private String digits() {
    int start = _x;
    while( _x < _buf.length && isDigit(_buf[_x]) ) _x++;
    return new String(_buf,start,_x-start);
  }

  private Term numeral( String digits, int start ) {
    int n;
    try {
      n = Integer.parseInt(digits);
    } catch( NumberFormatException nfe ) {
      n = Integer.MAX_VALUE;    // Too many digits for an int
    }
    if( n > LC.MAX_NUMERAL ) {
      _x = start;
      throw ErrMsg.syntax(this,"Numeral "+digits+" is larger than the limit of "+LC.MAX_NUMERAL);
    }
    return Shorthands.numeral(n);
  }

  private ErrMsg err_unexpected() {
    return switch( _buf[_x] ) {
    case ')' -> ErrMsg.syntax(this,"Unbalanced ')'");
    case '=' -> ErrMsg.syntax(this,"Unexpected '='; only a leading {NAME} can be defined");
    default  -> ErrMsg.syntax(this,"Unexpected '"+_buf[_x]+"'");
    };
  }

  private int skipWS() {
    while( _x < _buf.length && Character.isWhitespace(_buf[_x]) ) _x++;
    return _x == _buf.length ? -1 : _buf[_x];
  }

  private static boolean isDigit(int c) { return '0' <= c && c <= '9'; }
  private static boolean isVar  (int c) {
    return c != -1 && !Character.isWhitespace(c) && !isDigit(c) && "{}λ.()=".indexOf(c) < 0;
  }
  private boolean peek(char c) { if( skipWS()!=c ) return false; _x++; return true; }
  private void require(char c) {
    if( skipWS()!=c ) throw ErrMsg.syntax(this,"Missing '"+c+"'");
    _x++;
  }

  /** The line with a caret under the parse point, prefixed by "src:line:msg" */
  public String errLocMsg(String s) {
    // find line start
    int a=_x;
    while( a > 0 && _buf[a-1] != '\n' ) --a;
    // find line end
    int b=_x;
    while( b < _buf.length && _buf[b] != '\n' ) b++;
    int line=1;
    for( int i=0; i<a; i++ ) if( _buf[i]=='\n' ) line++;
    SB sb = new SB().p(_src).p(':').p(line).p(':').p(s).nl();
    sb.p(new String(_buf,a,b-a)).nl();
    for( int i=a; i<_x; i++ )
      sb.p(' ');
    return sb.p('^').nl().toString();
  }
}
