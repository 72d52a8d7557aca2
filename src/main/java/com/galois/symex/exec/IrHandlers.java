package com.galois.symex.exec;

import java.util.Arrays;

import com.galois.symex.Bindings;
import com.galois.symex.Expression;
import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;
import com.galois.symex.Wild;

/**
 * The IR that machine instructions are translated into.
 *
 * <p>
 * The IR has four operations over numbered slots, whose values are kept in
 * the machine state under <code>ir_VALUE(n)</code>:
 * <ul>
 * <li><code>ir_LOAD(n, src)</code> stores the current value of
 *     <code>src</code>, or <code>src</code> itself if it is unknown;</li>
 * <li><code>ir_LOAD_CONSTANT(n, e)</code> stores <code>e</code>
 *     simplified;</li>
 * <li><code>ir_SAVE(n, dst)</code> writes the slot's value to
 *     <code>dst</code>;</li>
 * <li><code>ir_CALC(n, e)</code> replaces slots and other known values in
 *     <code>e</code>, simplifies it, and stores it like
 *     <code>ir_LOAD_CONSTANT</code>.</li>
 * </ul>
 * A <code>MEMORY(size, addr)</code> operand of <code>ir_LOAD</code> or
 * <code>ir_SAVE</code> is first rewritten so that <code>addr</code> is
 * expressed in terms of the state and simplified.  Two addresses that
 * compute the same value this way name the same memory cell.
 */
public final class IrHandlers {
    public static final String LOAD = "ir_LOAD";
    public static final String LOAD_CONSTANT = "ir_LOAD_CONSTANT";
    public static final String SAVE = "ir_SAVE";
    public static final String CALC = "ir_CALC";
    public static final String VALUE = "ir_VALUE";
    public static final String MEMORY = "MEMORY";

    private final InstructionExecutor exec;
    private final SymbolTable t;

    private final Symbol load;
    private final Symbol loadConstant;
    private final Symbol save;
    private final Symbol calc;
    private final Symbol value;
    private final Symbol memory;

    private IrHandlers(InstructionExecutor exec) {
        this.exec = exec;
        this.t = exec.getSymbolTable();
        this.load = t.symbol(LOAD);
        this.loadConstant = t.symbol(LOAD_CONSTANT);
        this.save = t.symbol(SAVE);
        this.calc = t.symbol(CALC);
        this.value = t.symbol(VALUE);
        this.memory = t.symbol(MEMORY);
    }

    /**
     * Register the IR handlers with <code>exec</code>.
     *
     * @return helpers for building IR instructions.
     */
    public static IrHandlers install(InstructionExecutor exec) {
        IrHandlers ir = new IrHandlers(exec);
        ir.addLoadSaveHandlers();
        ir.addCalcHandler();
        return ir;
    }

    /**
     * Create an executor that understands the IR.
     */
    public static InstructionExecutor newExecutor(SymbolTable t) {
        InstructionExecutor exec = new InstructionExecutor(t);
        install(exec);
        return exec;
    }

    public InstructionExecutor getExecutor() {
        return exec;
    }

    /** The state key of slot <code>n</code>. */
    public Expression slot(long n) {
        return value.apply(t.number(n));
    }

    public Expression memory(long size, Expression addr) {
        return memory(t.number(size), addr);
    }

    /** Build <code>MEMORY(size, addr)</code>; either may be a wild. */
    public Expression memory(Expression size, Expression addr) {
        return memory.apply(size, addr);
    }

    public Expression load(long n, Expression src) {
        return load.apply(t.number(n), src);
    }

    public Expression loadConstant(long n, Expression e) {
        return loadConstant.apply(t.number(n), e);
    }

    public Expression save(long n, Expression dst) {
        return save.apply(t.number(n), dst);
    }

    public Expression calc(long n, Expression e) {
        return calc.apply(t.number(n), e);
    }

    /**
     * Return <code>operand</code> with the address of a
     * <code>MEMORY(size, addr)</code> term resolved against the state.
     * Other operands are returned unchanged.
     */
    public Expression canonicalOperand(MachineState state, Expression operand) {
        Wild size = t.wild("memsize");
        Wild ptr = t.wild("memptr");
        Bindings b = new Bindings();
        if (!operand.match(memory.apply(size, ptr), b)) {
            return operand;
        }
        Expression addr = b.get(ptr).substitute(state.asMap()).simplify();
        return memory.apply(b.get(size), addr);
    }

    private void addLoadSaveHandlers() {
        Wild n = t.wild("n");
        Wild src = t.wild("src");
        Wild dst = t.wild("dst");

        exec.addHandler(load.apply(n, src), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    Expression s = canonicalOperand(state, operands.get("src"));
                    Expression v = state.resolve(s);
                    state.put(value.apply(operands.get("n")), v);
                    exec.fireHooks(LOAD, v);
                    return state;
                }
            });

        exec.addHandler(loadConstant.apply(n, src), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    Expression v = operands.get("src").simplify();
                    state.put(value.apply(operands.get("n")), v);
                    exec.fireHooks(LOAD_CONSTANT, v);
                    return state;
                }
            });

        exec.addHandler(save.apply(n, dst), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    Expression key = value.apply(operands.get("n"));
                    Expression v = state.get(key);
                    if (v == null) {
                        throw new IllegalStateException("IR slot " + operands.get("n") + " was saved before it was loaded.");
                    }
                    Expression d = canonicalOperand(state, operands.get("dst"));
                    state.put(d, v);
                    exec.fireHooks(SAVE, v, d);
                    return state;
                }
            });
    }

    private void addCalcHandler() {
        Wild n = t.wild("n");
        Wild e = t.wild("exp");

        exec.addHandler(calc.apply(n, e), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    Expression v = operands.get("exp").substitute(state.asMap()).simplify();
                    return exec.executeSingle(loadConstant.apply(operands.get("n"), v), state);
                }
            });
    }

    /** Execute a translated instruction sequence. */
    MachineState executeAll(MachineState state, Expression... ir) {
        return exec.executeList(Arrays.asList(ir), state);
    }
}
