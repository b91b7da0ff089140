package com.cliffc.lc.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  // Indent d levels
  public SB i( int d ) { for( int i=0; i<d; i++ ) p("  "); return this; }

  public SB nl( ) { return p(System.lineSeparator()); }

  @Override public String toString() { return _sb.toString(); }
}
