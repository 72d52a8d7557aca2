package com.galois.symex;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestPatternMatcher {
    SymbolTable t;
    Wild w, v;
    Symbol x, y, head;

    @Before
    public void setUp() {
        t = new SymbolTable();
        Wild[] wilds = t.wilds("w v");
        w = wilds[0];
        v = wilds[1];
        Symbol[] syms = t.symbols("x y head");
        x = syms[0];
        y = syms[1];
        head = syms[2];
    }

    @Test
    public void wildHeadAndOperands() {
        Bindings m = new Bindings();
        Assert.assertTrue(head.apply(x, t.number(3)).match(w.apply(x, v), m));
        Assert.assertEquals(head, m.get("w"));
        Assert.assertEquals(t.number(3), m.get(v));
    }

    @Test
    public void repeatedWildMustBindEqualValues() {
        Assert.assertFalse(head.apply(x, y).match(head.apply(v, v)));

        Bindings m = new Bindings();
        Assert.assertTrue(head.apply(x, x).match(head.apply(v, v), m));
        Assert.assertEquals(x, m.get("v"));
    }

    @Test
    public void consistencySpansSubtrees() {
        Symbol f = t.symbol("f");
        Expression pattern = head.apply(f.apply(v), f.apply(t.number(1), v));
        Assert.assertTrue(head.apply(f.apply(x), f.apply(t.number(1), x)).match(pattern));
        Assert.assertFalse(head.apply(f.apply(x), f.apply(t.number(1), y)).match(pattern));
    }

    @Test
    public void anonymousWildClearsStaleBindings() {
        Bindings m = new Bindings();
        m.put("should be removed", t.number(1));
        Assert.assertTrue(head.apply(x).match(t.wild().apply(x), m));
        Assert.assertFalse(m.isBound("should be removed"));
        Assert.assertEquals(0, m.size());
    }

    @Test
    public void anonymousWildsDoNotConstrainEachOther() {
        Wild any = t.wild();
        Assert.assertTrue(head.apply(x, y).match(head.apply(any, any)));
    }

    @Test
    public void literalPatterns() {
        Symbol mov = t.symbol("MOV");
        Symbol eax = t.symbol("eax");
        Expression inst = mov.apply(eax, t.symbol("ebx"));
        Assert.assertTrue(inst.match(mov.apply(eax, t.symbol("ebx"))));
        Assert.assertFalse(inst.match(mov.apply(eax, t.symbol("ecx"))));
        Assert.assertTrue(inst.match(mov.apply(eax, w)));
        Assert.assertFalse(inst.match(mov.apply(eax)));
        Assert.assertFalse(eax.match(mov.apply(w)));
        Assert.assertTrue(t.number(4).match(t.number(4)));
        Assert.assertTrue(inst.match(w));
    }

    @Test
    public void failedMatchLeavesNoBindings() {
        Bindings m = new Bindings();
        Assert.assertFalse(head.apply(x, y).match(head.apply(w, x), m));
        Assert.assertEquals(0, m.size());
    }

    @Test(expected = UnboundWildException.class)
    public void readingUnboundWildFails() {
        Bindings m = new Bindings();
        Assert.assertTrue(head.apply(x).match(head.apply(w), m));
        m.get("v");
    }
}
