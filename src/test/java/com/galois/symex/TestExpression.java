package com.galois.symex;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.symex.proto.Protos;

public class TestExpression {
    SymbolTable t;
    Symbol eax, ebx, mov, memory;

    @Before
    public void setUp() {
        t = new SymbolTable();
        eax = t.symbol("eax");
        ebx = t.symbol("ebx");
        mov = t.symbol("MOV");
        memory = t.symbol("MEMORY");
    }

    @Test
    public void operationsCompareStructurally() {
        Assert.assertEquals(mov.apply(eax, ebx), mov.apply(eax, ebx));
        Assert.assertEquals(mov.apply(eax, ebx).hashCode(), mov.apply(eax, ebx).hashCode());
        Assert.assertNotEquals(mov.apply(eax, ebx), mov.apply(ebx, eax));
        Assert.assertNotEquals(mov.apply(eax), mov.apply(eax, ebx));
        Assert.assertEquals("MOV(eax, ebx)", mov.apply(eax, ebx).toString());
    }

    @Test
    public void substituteReplacesWholeSubexpressions() {
        Expression addr = t.add(eax, 8);
        Expression inst = mov.apply(ebx, memory.apply(t.number(4), addr));

        Map<Expression, Expression> m = new HashMap<Expression, Expression>();
        m.put(eax, t.symbol("initial_eax"));
        Expression r = inst.substitute(m);
        Assert.assertEquals(mov.apply(ebx, memory.apply(t.number(4), t.add(t.symbol("initial_eax"), 8))), r);

        m.clear();
        m.put(addr, eax);
        Assert.assertEquals(mov.apply(ebx, memory.apply(t.number(4), eax)), inst.substitute(m));

        m.clear();
        Assert.assertSame(inst, inst.substitute(m));
    }

    @Test
    public void substitutionIsNotRepeated() {
        Map<Expression, Expression> m = new HashMap<Expression, Expression>();
        m.put(eax, ebx);
        m.put(ebx, eax);
        Assert.assertEquals(t.add(ebx, eax), t.add(eax, ebx).substitute(m));
    }

    @Test
    public void evaluate() {
        Map<Expression, BigInteger> env = new HashMap<Expression, BigInteger>();
        env.put(eax, BigInteger.valueOf(10));
        env.put(ebx, BigInteger.valueOf(3));
        Assert.assertEquals(BigInteger.valueOf(3), t.div(eax, ebx).evaluate(env));
        Assert.assertEquals(BigInteger.valueOf(2), t.and(eax, ebx).evaluate(env));
        Assert.assertEquals(BigInteger.valueOf(4),
                            t.applyOperator(Operator.SUB, eax, ebx, ebx).evaluate(env));
    }

    @Test(expected = IllegalArgumentException.class)
    public void evaluateNeedsEveryValue() {
        t.add(eax, ebx).evaluate(new HashMap<Expression, BigInteger>());
    }

    @Test
    public void protocolBufferRepresentation() {
        t.setDefaultRadix(16);
        Expression e = mov.apply(memory.apply(t.number(4), t.add(eax, 0xff)), t.wild("src"));
        Protos.Expr rep = e.getExprRep();
        Assert.assertEquals(Protos.ExprCode.OperationExpr, rep.getCode());
        Assert.assertEquals("MOV", rep.getHead().getName());
        Assert.assertEquals(2, rep.getOperandCount());

        SymbolTable other = new SymbolTable();
        Expression back = other.fromExprRep(rep);
        Assert.assertEquals(e, back);
        Assert.assertSame(other.symbol("eax"),
                          ((Operation) ((Operation) ((Operation) back).getOperand(0)).getOperand(1)).getOperand(0));
        Assert.assertEquals("MOV(MEMORY(0x4, (eax + 0xff)), ?src)", back.toString());
    }

    @Test
    public void delimitedStreams() throws Exception {
        Symbol xor = t.symbol("XOR");
        List<Expression> insts = Arrays.<Expression>asList(
            xor.apply(eax, eax),
            t.symbol("ADD").apply(t.symbol("ecx"), t.number(-4)),
            mov.apply(memory.apply(t.number(4), t.symbol("ecx")), eax));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ExpressionStreams.writeDelimited(out, insts);

        List<Expression> back =
            ExpressionStreams.readDelimited(new ByteArrayInputStream(out.toByteArray()), new SymbolTable());
        Assert.assertEquals(insts, back);
    }
}
