package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import com.cliffc.lc.term.Term.Apply;
import com.cliffc.lc.term.Term.Ident;
import com.cliffc.lc.term.Term.Lambda;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** The session's shorthand table: uppercased name to closed term.
 *
 *  Built once per session with the builtins, then changed only by {@link
 *  #define}.  References are expanded by the parser, and terms never change,
 *  so a stored entry is independent of later redefinitions of the names it
 *  was written with.
 *
 *  Church numerals are not entries; {@link #numeral} builds them on demand.
 */
public class Shorthands {

  // Builtins, in table order.  Parsed with the table built so far, so each
  // may refer to the ones above it.
  static final String[] BUILTINS = {
    "{succ}=λn.λf.λx.f(nfx)",
    "{add}=λm.λn.(m{succ}n)",
    "{mult}=λm.λn.(m({add}n)0)",
    "{true}=λx.λy.x",
    "{false}=λx.λy.y",
    "{and}=λp.λq.pqp",
    "{or}=λp.λq.ppq",
    "{not}=λp.p{false}{true}",
    "{if}=λp.λa.λb.pab",
    "{cons}=λx.λy.λf.fxy",
    "{car}=λc.c{true}",
    "{cdr}=λc.c{false}",
    "{nil}=λx.{true}",
    "{pred}=λn.λf.λx.n(λg.λh.h(gf))(λu.x)(λu.u)",
    "{sub}=λm.λn.n{pred}m",
    "{zero?}=λn.n(λx.{false}){true}",
    "{nil?}=λp.p(λx.λy.{false})",
    "{lte?}=λm.λn.{zero?}({sub}mn)",
  };

  private final LinkedHashMap<String,Term> _tab = new LinkedHashMap<>();

  public Shorthands() {
    for( String def : BUILTINS ) {
      Parse.Stmt s = new Parse("builtin",def,this).stmt();
      define(s._def,s._term);
    }
  }

  // Canonical spelling
  static String canon( String name ) { return name.toUpperCase(Locale.ROOT); }

  static boolean is_numeral( String name ) {
    if( name.isEmpty() ) return false;
    for( int i=0; i<name.length(); i++ )
      if( name.charAt(i) < '0' || name.charAt(i) > '9' )
        return false;
    return true;
  }

  /** Insert or overwrite {@code name}.  An overwritten entry keeps its place
   *  in table order.
   *  @throws ErrMsg ReservedName for an all-digit name, Unbound for a term
   *  with free variables; the table is unchanged in both cases */
  public void define( String name, Term t ) {
    String key = canon(name);
    if( is_numeral(key) ) throw ErrMsg.reserved(key);
    if( !t.free_vars().isEmpty() )
      throw ErrMsg.unbound("Shorthands may only have fully bound terms; {"+key+"} has free "+t.free_vars());
    if( LC.DEBUG ) LC.p(t,"define {"+key+"} = "+t);
    _tab.put(key,t);
  }

  /** @throws ErrMsg UnknownShorthand if absent */
  public @NotNull Term lookup( String name ) {
    Term t = _tab.get(canon(name));
    if( t==null ) throw ErrMsg.unknown(null,canon(name));
    return t;
  }

  // Null if absent
  Term get( String name ) { return _tab.get(canon(name)); }

  public boolean contains( String name ) { return _tab.containsKey(canon(name)); }
  public int size() { return _tab.size(); }

  /** @return all entries in table order; builtins first, numerals excluded */
  public Map<String,Term> all() { return Collections.unmodifiableMap(_tab); }

  /** @return Church numeral n: {@code λf.λx.f(f(...f(x)...))} */
  public static @NotNull Term numeral( int n ) {
    if( n < 0 ) throw new IllegalArgumentException("Negative numeral "+n);
    Term t = new Ident("x",0);
    for( int i=0; i<n; i++ )
      t = new Apply(new Ident("f",1),t);
    return new Lambda("f",new Lambda("x",t));
  }

  /** @return n if {@code t} is alpha-equivalent to Church numeral n, else -1 */
  public static int church( Term t ) {
    if( !(t instanceof Lambda f) || !(f._body instanceof Lambda x) ) return -1;
    int n=0;
    Term b = x._body;
    while( b instanceof Apply app ) {
      if( !(app._fun instanceof Ident id) || id._dbx!=1 )
        return -1;
      b = app._arg;
      n++;
    }
    return b instanceof Ident id && id._dbx==0 ? n : -1;
  }
}
