package com.cliffc.lc.term;

import org.junit.Test;

import java.util.List;
import java.util.Set;

import static com.cliffc.lc.term.Term.*;
import static org.junit.Assert.*;

public class TestTerm {
  private static final String NL = System.lineSeparator();

  // λf.λx.f(fx)
  private static Term two() { return lam("f",lam("x",app(var("f"),app(var("f"),var("x"))))); }

  @Test public void testPrint() {
    assertEquals("λf.λx.f(fx)",two().toString());
    assertEquals("fxy",app(var("f"),var("x"),var("y")).toString());
    assertEquals("(λx.x)y",app(lam("x",var("x")),var("y")).toString());
    assertEquals("a(λx.x)b",app(var("a"),lam("x",var("x")),var("b")).toString());
    assertEquals("λn.λf.λx.f(nfx)",
                 lam("n",lam("f",lam("x",app(var("f"),app(var("n"),var("f"),var("x")))))).toString());
  }

  @Test public void testBind() {
    Lambda t = lam("x",app(var("x"),var("y")));
    Apply body = (Apply)t._body;
    assertEquals(0,((Ident)body._fun)._dbx);
    assertTrue(((Ident)body._arg).is_free());

    // Inner binder of the same name wins
    Lambda s = lam("x",lam("x",var("x")));
    assertEquals(0,((Ident)((Lambda)s._body)._body)._dbx);
    assertTrue(s.alpha_eq(lam("a",lam("b",var("b")))));
    assertFalse(s.alpha_eq(lam("a",lam("b",var("a")))));
  }

  @Test public void testFreeVars() {
    assertEquals(Set.of(),two().free_vars());
    assertEquals(List.of("y","z"),List.copyOf(lam("x",app(var("x"),var("y"),var("z"),var("x"))).free_vars()));
    assertEquals(Set.of(),lam("x",app(lam("x",var("x")),var("x"))).free_vars());
    assertEquals(Set.of("x"),app(lam("x",var("x")),var("x")).free_vars());
  }

  @Test public void testAlphaEq() {
    Term a = lam("x",var("x"));
    Term b = lam("y",var("y"));
    Term c = lam("z",var("z"));
    // Reflexive, symmetric, transitive
    assertTrue(a.alpha_eq(a));
    assertTrue(a.alpha_eq(b) && b.alpha_eq(a));
    assertTrue(b.alpha_eq(c) && a.alpha_eq(c));
    // Bound spelling does not matter
    assertTrue(lam("x",lam("y",var("x"))).alpha_eq(lam("y",lam("x",var("y")))));
    assertTrue(lam("x",var("y")).alpha_eq(lam("z",var("y"))));
    // Binder position does
    assertFalse(lam("x",lam("y",var("x"))).alpha_eq(lam("x",lam("y",var("y")))));
    // Free names and shape do
    assertFalse(var("x").alpha_eq(var("y")));
    assertFalse(lam("x",var("y")).alpha_eq(lam("x",var("z"))));
    assertFalse(lam("x",var("x")).alpha_eq(lam("x",app(var("x"),var("x")))));
    assertFalse(app(var("x"),var("y")).alpha_eq(app(var("y"),var("x"))));
    assertFalse(a.alpha_eq(null));
  }

  @Test public void testEqualsHash() {
    Term a = lam("p",lam("q",app(var("p"),var("q"),var("p"))));
    Term b = lam("x",lam("y",app(var("x"),var("y"),var("x"))));
    assertEquals(a,b);
    assertEquals(a.hashCode(),b.hashCode());
    assertNotEquals(a,lam("x",lam("y",app(var("x"),var("y"),var("y")))));
  }

  @Test public void testTree() {
    String exp = "Lambda x"+NL+
      "  Apply"+NL+
      "    Ident x bound:0"+NL+
      "    Ident y free"+NL;
    assertEquals(exp,lam("x",app(var("x"),var("y"))).tree());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoName() { new Ident(""); }

  // Far deeper than the Java stack allows for recursive walks
  @Test public void testDeep() {
    int n = 200000;
    Term xs = var("x"), zs = var("z");
    for( int i=0; i<n; i++ ) {
      xs = new Apply(xs,var("y"));
      zs = new Apply(zs,var("y"));
    }
    Lambda t = lam("x",xs), u = lam("z",zs);
    assertTrue(t.alpha_eq(u));
    assertEquals(t.hashCode(),u.hashCode());
    assertFalse(t.alpha_eq(lam("y",xs)));
    assertEquals(List.of("y"),List.copyOf(t.free_vars()));
    assertEquals("λx.x"+"y".repeat(n),t.toString());

    Term nest = var("v");
    for( int i=0; i<n; i++ ) nest = lam("v",nest);
    assertEquals(n+1,nest.tree().lines().count());
    Term shifted = rewrite(nest,null,(id,d) -> new Ident(id._name,id._dbx+1));
    assertFalse(shifted.alpha_eq(nest));
    while( shifted instanceof Lambda lam ) shifted = lam._body;
    assertEquals(1,((Ident)shifted)._dbx);
  }
}
