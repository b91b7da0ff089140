package com.cliffc.lc;

import com.cliffc.lc.term.Term;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestShape {
  private Shorthands _tab;
  @Before public void reset() { _tab = new Shorthands(); }

  private Term parse( String s ) { return new Parse("test",s,_tab).stmt()._term; }
  private void define( String s ) {
    Parse.Stmt st = new Parse("test",s,_tab).stmt();
    _tab.define(st._def,st._term);
  }
  private List<String> labels( String s ) { return Shape.classify(new Reduce().normalize(parse(s)),_tab); }

  @Test public void testZeroFalseAlias() {
    define("{ABC}=λf.λx.x");
    assertEquals(List.of("Church numeral 0","{FALSE}","{ABC}"),labels("{ABC}"));
  }

  @Test public void testIfFalse() {
    define("{ABC}=λf.λx.x");
    List<Term> steps = new Reduce().reduce_all(parse("{IF}{FALSE}1{ABC}"));
    assertEquals(6,steps.size());
    assertEquals("λf.λx.x",steps.get(5).toString());
    assertEquals(List.of("Church numeral 0","{FALSE}","{ABC}"),Shape.classify(steps.get(5),_tab));
  }

  @Test public void testCarCons() {
    assertEquals(List.of("Church numeral 2"),labels("(λc.c(λx.λy.x))((λx.λy.λf.fxy)(λf.λx.f(fx))(λf.λx.f(f(fx))))"));
  }

  @Test public void testBuiltins() {
    assertEquals(List.of("{TRUE}"),labels("λa.λb.a"));
    assertEquals(List.of("{TRUE}"),labels("{not}{false}"));
    assertEquals(List.of("Church numeral 1"),labels("{succ}0"));
    assertEquals(List.of("{SUCC}"),labels("λn.λf.λx.f(nfx)"));
  }

  @Test public void testNoMatch() {
    assertEquals(List.of(),labels("λx.x"));
    assertEquals(List.of(),labels("λf.λx.xf"));
  }

  @Test public void testOrder() {
    define("{no}={false}");
    define("{zip}=0");
    assertEquals(List.of("Church numeral 0","{FALSE}","{NO}","{ZIP}"),labels("{false}"));
  }
}
