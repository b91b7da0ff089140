package com.cliffc.lc.term;

import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.LinkedHashSet;
import java.util.Set;

/** Untyped lambda terms.
 *
 *  Three cases only: {@link Ident}, {@link Lambda} and {@link Apply}.  Terms
 *  are immutable; every rewrite builds a new term and shares the untouched
 *  subtrees.
 *
 *  Variable names are kept for printing only.  Binding is tracked by a
 *  deBruijn index on each {@link Ident}: the count of Lambdas between the
 *  occurrence and its binder, 0 for the nearest.  Free variables carry
 *  {@link Ident#FREE} and compare by name.  So two occurrences can print with
 *  the same name and still refer to different binders.
 *
 *  Terms get arbitrarily deep: a Church numeral nests one Apply per unit, and
 *  a growing reduction adds a level per step.  So every walk here runs off an
 *  explicit work stack, not the Java stack.
 */
public abstract sealed class Term permits Term.Ident, Term.Lambda, Term.Apply {
  private int _hash;            // Lazy alpha-equivalence hash, 0 if not computed

  // Print for the user
  @Override public final String toString() { return str(new SB()).toString(); }
  public final SB str(SB sb) {
    // Work items are Terms to print or literal Strings
    ArrayDeque<Object> work = new ArrayDeque<>();
    work.push(this);
    while( !work.isEmpty() ) {
      Object o = work.pop();
      if( o instanceof String s ) { sb.p(s); continue; }
      if( o instanceof Ident id ) { sb.p(id._name); continue; }
      if( o instanceof Lambda lam ) { sb.p('λ').p(lam._arg).p('.'); work.push(lam._body); continue; }
      // Juxtaposition: a Lambda in function position and any non-variable
      // argument get parens.  Pushed in reverse.
      Apply app = (Apply)o;
      if( app._arg instanceof Ident ) work.push(app._arg);
      else { work.push(")"); work.push(app._arg); work.push("("); }
      if( app._fun instanceof Lambda ) { work.push(")"); work.push(app._fun); work.push("("); }
      else work.push(app._fun);
    }
    return sb;
  }

  // Indented AST dump, one node per line
  public final String tree() { return tree(new SB()).toString(); }
  public final SB tree(SB sb) {
    ArrayDeque<Term> work = new ArrayDeque<>();
    ArrayDeque<Integer> indents = new ArrayDeque<>();
    work.push(this);
    indents.push(0);
    while( !work.isEmpty() ) {
      Term t = work.pop();
      int d = indents.pop();
      sb.i(d);
      if( t instanceof Ident id ) {
        sb.p("Ident ").p(id._name);
        (id.is_free() ? sb.p(" free") : sb.p(" bound:").p(id._dbx)).nl();
      } else if( t instanceof Lambda lam ) {
        sb.p("Lambda ").p(lam._arg).nl();
        work.push(lam._body); indents.push(d+1);
      } else {
        Apply app = (Apply)t;
        sb.p("Apply").nl();
        work.push(app._arg); indents.push(d+1);
        work.push(app._fun); indents.push(d+1);
      }
    }
    return sb;
  }

  /** @return the names of all free variables, in first-occurrence order */
  public final Set<String> free_vars() {
    LinkedHashSet<String> free = new LinkedHashSet<>();
    ArrayDeque<Term> work = new ArrayDeque<>();
    work.push(this);
    while( !work.isEmpty() ) {
      Term t = work.pop();
      if( t instanceof Ident id ) { if( id.is_free() ) free.add(id._name); }
      else if( t instanceof Lambda lam ) work.push(lam._body);
      else { work.push(((Apply)t)._arg); work.push(((Apply)t)._fun); }
    }
    return free;
  }

  /** Equality up to renaming of bound variables.  Bound occurrences compare by
   *  binder position, free ones by name; Lambda parameter spelling is ignored. */
  public final boolean alpha_eq(Term t) {
    if( t==null ) return false;
    // Pairs still to compare, pushed two at a time
    ArrayDeque<Term> work = new ArrayDeque<>();
    work.push(t);
    work.push(this);
    while( !work.isEmpty() ) {
      Term a = work.pop(), b = work.pop();
      if( a==b ) continue;
      if( a.getClass()!=b.getClass() ) return false;
      if( a._hash!=0 && b._hash!=0 && a._hash!=b._hash ) return false;
      if( a instanceof Ident x ) {
        Ident y = (Ident)b;
        if( x._dbx!=y._dbx || (x.is_free() && !x._name.equals(y._name)) ) return false;
      } else if( a instanceof Lambda x ) {
        work.push(((Lambda)b)._body);
        work.push(x._body);
      } else {
        Apply x = (Apply)a, y = (Apply)b;
        work.push(y._arg); work.push(x._arg);
        work.push(y._fun); work.push(x._fun);
      }
    }
    return true;
  }

  @Override public final boolean equals(Object o) { return o instanceof Term t && alpha_eq(t); }
  @Override public final int hashCode() {
    if( _hash!=0 ) return _hash;
    // Hash children first; a node is hashed once all its children are
    ArrayDeque<Term> work = new ArrayDeque<>();
    work.push(this);
    while( !work.isEmpty() ) {
      Term t = work.peek();
      Term kid = t.unhashed_kid();
      if( kid!=null ) { work.push(kid); continue; }
      int h = t.compute_hash();
      t._hash = h==0 ? 0xcafebabe : h;
      work.pop();
    }
    return _hash;
  }
  // Only called once every child has its hash
  abstract int compute_hash();
  abstract Term unhashed_kid();

  /** Rebuild a term one variable at a time.  Walks {@code t} bottom-up,
   *  replacing every {@link Ident} with {@code fcn.ident(id,depth)}, where
   *  depth counts the Lambdas of {@code t} above the occurrence.  A Lambda whose
   *  parameter is {@code shadow} is kept whole.  Unchanged subtrees are
   *  shared. */
  public static Term rewrite( Term t, String shadow, IdentFcn fcn ) {
    ArrayDeque<Frame> work = new ArrayDeque<>();
    work.push(new Frame(t,0));
    Term ret = null;            // Result of the last finished frame
    while( !work.isEmpty() ) {
      Frame f = work.peek();
      if( f._t instanceof Ident id ) {
        ret = fcn.ident(id,f._depth);
        work.pop();
      } else if( f._t instanceof Lambda lam ) {
        if( f._state==0 && !lam._arg.equals(shadow) ) {
          f._state = 1;
          work.push(new Frame(lam._body,f._depth+1));
        } else {
          ret = f._state==0 ? lam : lam.make(ret);
          work.pop();
        }
      } else {
        Apply app = (Apply)f._t;
        switch( f._state++ ) {
        case 0 -> work.push(new Frame(app._fun,f._depth));
        case 1 -> { f._fun = ret; work.push(new Frame(app._arg,f._depth)); }
        default -> { ret = app.make(f._fun,ret); work.pop(); }
        }
      }
    }
    return ret;
  }
  @FunctionalInterface public interface IdentFcn { Term ident( Ident id, int depth ); }
  private static final class Frame {
    final Term _t; final int _depth;
    int _state;                 // Children visited so far
    Term _fun;                  // Rebuilt function side of an Apply
    Frame( Term t, int depth ) { _t=t; _depth=depth; }
  }

  /** Build an abstraction over {@code name}, binding every free occurrence of
   *  {@code name} in {@code body} that is not shadowed by an inner Lambda of
   *  the same name. */
  public static @NotNull Lambda lam( String name, Term body ) {
    return new Lambda(name,rewrite(body,name,(id,depth) ->
      id.is_free() && id._name.equals(name) ? new Ident(name,depth) : id));
  }
  public static @NotNull Apply app( Term fun, Term... args ) {
    Apply a = new Apply(fun,args[0]);
    for( int i=1; i<args.length; i++ )
      a = new Apply(a,args[i]);
    return a;
  }
  public static @NotNull Ident var( String name ) { return new Ident(name); }


  // --- Ident ------------------------
  public static final class Ident extends Term {
    public static final int FREE = -1;
    public final String _name;  // Printed name
    public final int _dbx;      // deBruijn index, or FREE

    public Ident( String name ) { this(name,FREE); }
    public Ident( String name, int dbx ) {
      if( name==null || name.isEmpty() ) throw new IllegalArgumentException("Missing variable name");
      _name = name;
      _dbx = dbx;
    }
    public boolean is_free() { return _dbx==FREE; }

    @Override int compute_hash() { return is_free() ? _name.hashCode() : 0x5bd1e995*(_dbx+1); }
    @Override Term unhashed_kid() { return null; }
  }

  // --- Lambda ------------------------
  public static final class Lambda extends Term {
    public final String _arg;   // Parameter name, for printing
    public final Term _body;

    // Raw constructor; the body's deBruijn indices must already be set.
    // Use Term.lam to bind by name.
    public Lambda( String arg, Term body ) {
      if( arg==null || arg.isEmpty() ) throw new IllegalArgumentException("Missing parameter name");
      _arg = arg;
      _body = body;
    }
    // Same parameter, new body; shares this Lambda if nothing changed
    public Lambda make( Term body ) { return body==_body ? this : new Lambda(_arg,body); }

    @Override int compute_hash() { return _body._hash*31 + 0x1b873593; }
    @Override Term unhashed_kid() { return _body._hash==0 ? _body : null; }
  }

  // --- Apply ------------------------
  public static final class Apply extends Term {
    public final Term _fun, _arg;
    public Apply( Term fun, Term arg ) {
      if( fun==null || arg==null ) throw new IllegalArgumentException("Missing application term");
      _fun = fun;
      _arg = arg;
    }
    public Apply make( Term fun, Term arg ) { return fun==_fun && arg==_arg ? this : new Apply(fun,arg); }

    @Override int compute_hash() { return _fun._hash*0x9e3779b1 + _arg._hash; }
    @Override Term unhashed_kid() {
      if( _fun._hash==0 ) return _fun;
      return _arg._hash==0 ? _arg : null;
    }
  }
}
