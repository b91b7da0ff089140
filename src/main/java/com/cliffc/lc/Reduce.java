package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import com.cliffc.lc.term.Term.Apply;
import com.cliffc.lc.term.Term.Lambda;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.ObjIntConsumer;

import static com.cliffc.lc.LC.TODO;

/** Normal-order (leftmost-outermost) beta reduction.
 *
 *  Lambda terms need not normalize, so {@link #reduce} stops at a step cap,
 *  and polls a cancellation token between steps.  Steps are handed out as
 *  they are made and only the current term is kept, so a term that grows
 *  every step costs memory for one term, not the whole sequence.
 */
public class Reduce {
  private final int _max;               // Step cap
  private final BooleanSupplier _cancel; // Polled between steps
  private int _steps;                   // Steps taken on the current term

  public Reduce() { this(LC.MAX_STEPS,() -> false); }
  public Reduce( int max, BooleanSupplier cancel ) { _max=max; _cancel=cancel; }

  public int steps() { return _steps; }

  /** Contract the leftmost-outermost redex.
   *  @return the rewritten term, or null if {@code t} is in normal form */
  public static Term step( Term t ) {
    // Preorder search, function side before argument side.  Each Spot
    // remembers its parent, to rebuild the path once the redex is found.
    ArrayDeque<Spot> work = new ArrayDeque<>();
    work.push(new Spot(t,null,false));
    while( !work.isEmpty() ) {
      Spot s = work.pop();
      if( s._t instanceof Apply app ) {
        if( app._fun instanceof Lambda lam )
          return rebuild(s,Subst.beta(lam,app._arg));
        work.push(new Spot(app._arg,s,true));
        work.push(new Spot(app._fun,s,false));
      } else if( s._t instanceof Lambda lam )
        work.push(new Spot(lam._body,s,false));
    }
    return null;                // Variables never reduce
  }
  private record Spot( Term _t, Spot _par, boolean _is_arg ) { }

  // Replace the term at 's' with 'x', copying the path up to the root
  private static Term rebuild( Spot s, Term x ) {
    for( ; s._par != null; s = s._par ) {
      if( s._par._t instanceof Lambda lam ) x = new Lambda(lam._arg,x);
      else if( s._par._t instanceof Apply app ) x = s._is_arg ? new Apply(app._fun,x) : new Apply(x,app._arg);
      else throw TODO();
    }
    return x;
  }

  /** Reduce to normal form.  {@code each} sees the input as step 0, then
   *  every reduct in order.
   *  @return the normal form
   *  @throws ErrMsg.NonTermination after more than the step cap
   *  @throws ErrMsg Cancelled if the token fires */
  public Term reduce( Term t, ObjIntConsumer<Term> each ) {
    _steps = 0;
    each.accept(t,0);
    while( true ) {
      if( _cancel.getAsBoolean() ) throw ErrMsg.cancelled(_steps);
      Term x = step(t);
      if( x == null ) return t; // Normal form
      if( _steps == _max ) throw new ErrMsg.NonTermination(_steps);
      t = x;
      each.accept(t,++_steps);
      if( LC.DEBUG ) LC.p(t,"β "+_steps+": "+t);
    }
  }

  /** @return {@code t} followed by every reduction step, ending in its normal
   *  form.  Holds the whole sequence; the REPL streams with {@link #reduce}. */
  public List<Term> reduce_all( Term t ) {
    ArrayList<Term> steps = new ArrayList<>();
    reduce(t,(x,i) -> steps.add(x));
    return steps;
  }

  public Term normalize( Term t ) { return reduce(t,(x,i) -> { }); }
}
