package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import com.cliffc.lc.util.SB;

import java.io.PrintStream;
import java.util.List;
import java.util.Scanner;

/** Read a line, reduce it, print every step and the shorthands the normal
 *  form matches.  Definitions update the table silently.  Errors are printed
 *  and the session goes on.
 *
 *  Steps print as the reducer makes them; a long reduction shows progress and
 *  never has to fit in memory all at once.
 */
public abstract class REPL {
  public static final String prompt="λ> ";
  public static void go( ) {
    Shorthands tab = new Shorthands();
    init();
    Scanner stdin = new Scanner(System.in);
    while( stdin.hasNextLine() )
      go_one(tab,stdin.nextLine());
    System.out.println();
  }

  static void init() {
    System.out.print(prompt);
    System.out.flush();
  }

  static void go_one( Shorthands tab, String line ) {
    run(tab,line,System.out);
    System.out.print(prompt);
    System.out.flush();
  }

  /** Handle one input line, printing to {@code out}.  A blank line or a
   *  definition prints nothing. */
  public static void run( Shorthands tab, String line, PrintStream out ) {
    if( line.isBlank() ) return;
    try {
      Parse.Stmt s = new Parse("stdin",line,tab).stmt();
      if( !s.is_def() ) show(tab,s._term,out);
      else tab.define(s._def,s._term);
    } catch( ErrMsg.NonTermination nt ) {
      out.println();
      out.print(nt.msg());
    } catch( ErrMsg err ) {
      out.print(err.msg());
    }
  }

  // Reduce and label one closed term
  static void show( Shorthands tab, Term t, PrintStream out ) {
    if( !t.free_vars().isEmpty() )
      throw ErrMsg.unbound("Input is not fully bound");
    Term nf = new Reduce().reduce(t,(x,i) -> out.print(step(new SB(),x,i)));
    SB sb = new SB().nl();
    List<String> labels = Shape.classify(nf,tab);
    if( labels.isEmpty() ) sb.p("No known shorthand representations.").nl();
    else {
      sb.p("Potential shorthand representations:").nl();
      for( String label : labels )
        sb.p("-> As ").p(label).nl();
    }
    out.print(sb);
  }

  private static SB step( SB sb, Term t, int i ) {
    t.str(sb.p(i==0 ? "INPUT " : "β ==> ")).nl();
    return LC.SHOW_AST ? t.tree(sb) : sb;
  }
}
