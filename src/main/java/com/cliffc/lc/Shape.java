package com.cliffc.lc;

import com.cliffc.lc.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Names a normal form: its Church numeral, then every matching shorthand in
// table order.  All matches are up to alpha-equivalence.
public abstract class Shape {

  public static List<String> classify( Term t, Shorthands tab ) {
    ArrayList<String> labels = new ArrayList<>();
    int n = Shorthands.church(t);
    if( n >= 0 ) labels.add("Church numeral "+n);
    for( Map.Entry<String,Term> e : tab.all().entrySet() )
      if( t.alpha_eq(e.getValue()) )
        labels.add("{"+e.getKey()+"}");
    return labels;
  }
}
