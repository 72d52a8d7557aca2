package com.galois.symex.exec;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.symex.Bindings;
import com.galois.symex.Expression;
import com.galois.symex.NoHandlerFoundException;
import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;
import com.galois.symex.Wild;

public class TestInstructionExecutor {
    SymbolTable t;
    InstructionExecutor exec;
    Symbol nop, set, eax, ebx;
    Wild dst;

    /** Handler storing a fixed value into the captured destination. */
    static Handler store(final Expression value) {
        return new Handler() {
            public MachineState execute(MachineState state, Bindings operands) {
                state.put(operands.get("dst"), value);
                return state;
            }
        };
    }

    @Before
    public void setUp() {
        t = new SymbolTable();
        exec = new InstructionExecutor(t);
        nop = t.symbol("NOP");
        set = t.symbol("SET");
        eax = t.symbol("eax");
        ebx = t.symbol("ebx");
        dst = t.wild("dst");
    }

    @Test
    public void latestMatchingHandlerWins() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        exec.addHandler(set.apply(dst), store(t.number(2)));
        Assert.assertEquals(2, exec.getHandlerCount());

        MachineState s = exec.executeSingle(set.apply(eax), new MachineState());
        Assert.assertEquals(t.number(2), s.get(eax));
    }

    @Test
    public void specificHandlerOverridesGeneralOne() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        // No wilds in the pattern, so nothing is captured.
        exec.addHandler(set.apply(ebx), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    state.put(ebx, t.number(7));
                    return state;
                }
            });

        MachineState s = exec.executeList(Arrays.<Expression>asList(set.apply(eax), set.apply(ebx)), new MachineState());
        Assert.assertEquals(t.number(1), s.get(eax));
        Assert.assertEquals(t.number(7), s.get(ebx));
    }

    @Test
    public void predicateMatcher() {
        exec.addHandler(new Matcher.Predicate() {
                public boolean test(Expression instruction, Bindings bindings) {
                    if (instruction.kind() != Expression.Kind.OPERATION) {
                        return false;
                    }
                    bindings.put("dst", eax);
                    return instruction.toString().startsWith("NOP");
                }
            }, store(t.number(0)));

        MachineState s = exec.executeSingle(nop.apply(), new MachineState());
        Assert.assertEquals(t.number(0), s.get(eax));
    }

    @Test
    public void missingHandlerNamesInstruction() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        Expression inst = nop.apply(eax);
        try {
            exec.executeSingle(inst, new MachineState());
            Assert.fail("expected NoHandlerFoundException");
        } catch (NoHandlerFoundException e) {
            Assert.assertEquals(inst, e.getInstruction());
            Assert.assertTrue(e.getMessage().contains("NOP(eax)"));
        }
    }

    @Test
    public void callerStateIsNotModified() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        MachineState before = new MachineState();
        before.put(eax, t.number(5));

        MachineState after = exec.executeSingle(set.apply(eax), before);
        Assert.assertEquals(t.number(5), before.get(eax));
        Assert.assertEquals(t.number(1), after.get(eax));
        Assert.assertNotSame(before, after);
    }

    @Test
    public void defaultStateComesFromFactory() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        MachineState s = exec.executeSingle(set.apply(ebx));
        Assert.assertEquals(1, s.size());

        exec.setInitialStateFactory(new InitialStateFactory() {
                public MachineState newInitialState() {
                    MachineState m = new MachineState();
                    m.put(eax, t.symbol("initial_eax"));
                    return m;
                }
            });
        s = exec.executeSingle(set.apply(ebx));
        Assert.assertEquals(t.symbol("initial_eax"), s.get(eax));
        Assert.assertEquals(t.number(1), s.get(ebx));
    }

    @Test
    public void runReportsUnhandledInstruction() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        List<Expression> insts = Arrays.<Expression>asList(set.apply(eax), nop.apply(), set.apply(ebx));

        ExecutionResult r = exec.run(insts, new MachineState(), UnhandledPolicy.ABORT);
        Assert.assertFalse(r.isSuccess());
        Assert.assertEquals(ExecutionResult.ErrorKind.NO_HANDLER_FOUND, r.getError());
        Assert.assertEquals(1, r.getFailedIndex());
        Assert.assertEquals(nop.apply(), r.getFailedInstruction());
        Assert.assertEquals(t.number(1), r.getState().get(eax));
        Assert.assertNull(r.getState().get(ebx));

        r = exec.run(insts, new MachineState(), UnhandledPolicy.SKIP);
        Assert.assertTrue(r.isSuccess());
        Assert.assertEquals(Arrays.<Expression>asList(nop.apply()), r.getSkipped());
        Assert.assertEquals(t.number(1), r.getState().get(ebx));
    }

    @Test
    public void runNamesInstructionMissingInsideHandler() {
        final Expression foo = t.symbol("FOO").apply();
        exec.addHandler(set.apply(dst), store(t.number(1)));
        exec.addHandler(t.symbol("MOV").apply(dst), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    return exec.executeSingle(foo, state);
                }
            });
        Expression mov = t.symbol("MOV").apply(eax);
        List<Expression> insts = Arrays.<Expression>asList(set.apply(ebx), mov, set.apply(eax));

        ExecutionResult r = exec.run(insts, new MachineState(), UnhandledPolicy.SKIP);
        Assert.assertFalse(r.isSuccess());
        Assert.assertEquals(foo, r.getFailedInstruction());
        Assert.assertEquals(1, r.getFailedIndex());
        Assert.assertTrue(r.getSkipped().isEmpty());
        Assert.assertEquals(t.number(1), r.getState().get(ebx));
        Assert.assertNull(r.getState().get(eax));

        r = exec.run(insts, new MachineState(), UnhandledPolicy.ABORT);
        Assert.assertEquals(ExecutionResult.ErrorKind.NO_HANDLER_FOUND, r.getError());
        Assert.assertEquals(foo, r.getFailedInstruction());
    }

    @Test
    public void matcherKinds() {
        Matcher p = Matcher.pattern(set.apply(dst));
        Assert.assertEquals(Matcher.Kind.PATTERN, p.getKind());
        Assert.assertEquals(set.apply(dst), p.getPattern());

        Matcher q = Matcher.predicate(new Matcher.Predicate() {
                public boolean test(Expression instruction, Bindings bindings) {
                    return true;
                }
            });
        Assert.assertEquals(Matcher.Kind.PREDICATE, q.getKind());
        try {
            q.getPattern();
            Assert.fail("expected IllegalStateException");
        } catch (IllegalStateException e) {
            // predicates have no pattern
        }
    }

    @Test
    public void removeForgetsValue() {
        MachineState s = new MachineState();
        s.put(eax, t.number(3));
        s.remove(eax);
        Assert.assertFalse(s.containsKey(eax));
        Assert.assertEquals(eax, s.resolve(eax));
    }

    @Test
    public void statusStreamLogsDispatch() {
        exec.addHandler(set.apply(dst), store(t.number(1)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exec.setStatusStream(new PrintStream(out, true));
        exec.executeSingle(set.apply(eax), new MachineState());
        Assert.assertTrue(out.toString().contains("executing SET(eax)"));
    }
}
