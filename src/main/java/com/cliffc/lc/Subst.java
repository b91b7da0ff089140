package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import com.cliffc.lc.term.Term.Ident;
import com.cliffc.lc.term.Term.Lambda;

/** Substitution.
 *
 *  Textual and capture-permitting: a Lambda parameter is never renamed, so a
 *  substituted-in variable can print with the same name as an enclosing
 *  parameter.  The deBruijn indices still keep the two apart in the tree.
 *  Untouched subtrees are shared, not copied.
 *
 *  All three rewrites go through {@link Term#rewrite}, which walks without
 *  recursion, so deep numerals and long reductions do not blow the stack.
 */
public abstract class Subst {

  /** Replace every free occurrence of {@code name} in {@code t} by {@code rep}.
   *  A Lambda over {@code name} shadows it and is returned unchanged. */
  public static Term substitute( Term t, String name, Term rep ) {
    return Term.rewrite(t,name,(id,depth) ->
      id.is_free() && id._name.equals(name) ? shift(rep,depth) : id);
  }

  /** Beta-contract {@code (lam arg)}: the Lambda's body with its own bound
   *  occurrences replaced by {@code arg}. */
  public static Term beta( Lambda lam, Term arg ) {
    // Occurrences bound at 'depth' become 'arg'; occurrences bound outside
    // the redex lose the Lambda being contracted.
    return Term.rewrite(lam._body,null,(id,depth) -> {
      if( id.is_free() || id._dbx < depth ) return id;
      if( id._dbx == depth ) return shift(arg,depth);
      return new Ident(id._name,id._dbx-1);
    });
  }

  // Move a term under 'd' more Lambdas: bound indices reaching outside the
  // term grow by 'd'.
  static Term shift( Term t, int d ) {
    if( d==0 ) return t;
    return Term.rewrite(t,null,(id,depth) ->
      !id.is_free() && id._dbx >= depth ? new Ident(id._name,id._dbx+d) : id);
  }
}
