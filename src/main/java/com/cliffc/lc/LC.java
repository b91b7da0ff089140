package com.cliffc.lc;

/** A beta reducer and shorthand recognizer for the untyped lambda calculus.
 *
 *  Usage: {@code lc [--show-ast] [--debug] [--max-steps N] [--max-numeral N] [term...]}.
 *  With a term on the command line, reduce it and exit; otherwise run the REPL
 *  on stdin.
 */
public abstract class LC {
  public static RuntimeException TODO() { return TODO("unimplemented"); }
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Global knobs, set from the command line
  public static int MAX_STEPS   = 10000; // Reduction step cap per input line
  public static int MAX_NUMERAL = 1000000; // Largest numeral literal; one Apply per unit
  public static boolean SHOW_AST = false; // Dump the AST after every printed term

  public static final String USAGE = "Usage: lc [--show-ast] [--debug] [--max-steps N] [--max-numeral N] [term...]";

  public static void main( String[] args ) {
    String term;
    try {
      term = parseArgs(args);
    } catch( IllegalArgumentException iae ) {
      System.err.println("lc: "+iae.getMessage());
      System.err.println(USAGE);
      return;
    }
    if( !term.isEmpty() ) {
      REPL.run(new Shorthands(),term,System.out);
      System.out.flush();
    } else {
      REPL.go();
    }
  }

  // Set the knobs; return the term words joined, or "" to run the REPL
  static String parseArgs( String[] args ) {
    StringBuilder term = new StringBuilder();
    for( int i=0; i<args.length; i++ ) {
      switch( args[i] ) {
      case "--show-ast"   -> SHOW_AST = true;
      case "--debug"      -> DEBUG = true;
      case "--max-steps"  -> MAX_STEPS   = intArg(args,++i);
      case "--max-numeral"-> MAX_NUMERAL = intArg(args,++i);
      default -> term.append(args[i]).append(' ');
      }
    }
    return term.toString().trim();
  }

  private static int intArg( String[] args, int i ) {
    if( i >= args.length ) throw new IllegalArgumentException("Missing value after "+args[i-1]);
    try {
      int x = Integer.parseInt(args[i]);
      if( x < 0 ) throw new IllegalArgumentException(args[i-1]+" must not be negative");
      return x;
    } catch( NumberFormatException nfe ) {
      throw new IllegalArgumentException(args[i-1]+" expects an integer, not '"+args[i]+"'",nfe);
    }
  }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !LC.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
