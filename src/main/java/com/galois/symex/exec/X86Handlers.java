package com.galois.symex.exec;

import com.galois.symex.Bindings;
import com.galois.symex.Expression;
import com.galois.symex.Operator;
import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;
import com.galois.symex.Wild;

/**
 * Handlers translating 32-bit x86 instructions into the IR.
 *
 * <p>
 * Supported are <code>MOV</code>, <code>LEA</code>, <code>INC</code>,
 * <code>DEC</code> and the two-operand arithmetic instructions
 * <code>ADD SUB MUL IMUL DIV IDIV AND OR XOR</code>; the arithmetic
 * instructions also store their result in the flags register.  Operands are
 * registers, literals, or <code>MEMORY(size, addr)</code>.  Other
 * instructions have no handler.
 */
public final class X86Handlers {
    private static final String[] ARITHMETIC = {
        "ADD", "SUB", "MUL", "IMUL", "DIV", "IDIV", "AND", "OR", "XOR"
    };

    private static final Operator[] ARITHMETIC_OPS = {
        Operator.ADD, Operator.SUB, Operator.MUL, Operator.MUL,
        Operator.DIV, Operator.DIV, Operator.AND, Operator.OR, Operator.XOR
    };

    private final InstructionExecutor exec;
    private final IrHandlers ir;
    private final X86Registers registers;
    private final SymbolTable t;

    /** Register receiving the result of arithmetic instructions. */
    private Symbol flags;

    private X86Handlers(IrHandlers ir, X86Registers registers) {
        this.ir = ir;
        this.exec = ir.getExecutor();
        this.registers = registers;
        this.t = exec.getSymbolTable();
        this.flags = registers.getFlags();
    }

    /**
     * Register the x86 handlers on an executor that has the IR installed.
     */
    public static X86Handlers install(IrHandlers ir, X86Registers registers) {
        X86Handlers h = new X86Handlers(ir, registers);
        h.addMovHandler();
        h.addLeaHandler();
        h.addArithmeticHandlers();
        h.addIncDecHandlers();
        return h;
    }

    /**
     * Create an executor for x86 instructions whose initial state maps each
     * register to its initial value symbol.
     */
    public static InstructionExecutor newExecutor(SymbolTable t) {
        InstructionExecutor exec = new InstructionExecutor(t);
        X86Registers regs = new X86Registers(t);
        exec.setInitialStateFactory(regs);
        install(IrHandlers.install(exec), regs);
        return exec;
    }

    public X86Registers getRegisters() {
        return registers;
    }

    public Symbol getFlagsRegister() {
        return flags;
    }

    /**
     * Select the register updated by arithmetic instructions.
     */
    public void setFlagsRegister(Symbol flags) {
        if (flags == null) throw new NullPointerException("flags");
        this.flags = flags;
    }

    private void addMovHandler() {
        Wild dst = t.wild("dst");
        Wild src = t.wild("src");

        exec.addHandler(t.symbol("MOV").apply(dst, src), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    return ir.executeAll(state,
                                         ir.load(1, operands.get("src")),
                                         ir.save(1, operands.get("dst")));
                }
            });
    }

    private void addLeaHandler() {
        Wild dst = t.wild("dst");
        Wild src = t.wild("src");
        Wild memsize = t.wild("memsize");

        // The address is computed, not read from memory.
        exec.addHandler(t.symbol("LEA").apply(dst, ir.memory(memsize, src)), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    Expression addr = operands.get("src").substitute(state.asMap());
                    return ir.executeAll(state,
                                         ir.loadConstant(1, addr),
                                         ir.save(1, operands.get("dst")));
                }
            });
    }

    private void addArithmeticHandler(String mnemonic, Operator op) {
        Wild dst = t.wild("dst");
        Wild src = t.wild("src");
        final Expression exp = t.applyOperator(op, ir.slot(1), ir.slot(2));

        exec.addHandler(t.symbol(mnemonic).apply(dst, src), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    return ir.executeAll(state,
                                         ir.load(1, operands.get("dst")),
                                         ir.load(2, operands.get("src")),
                                         ir.calc(3, exp),
                                         ir.save(3, operands.get("dst")),
                                         ir.save(3, flags));
                }
            });
    }

    private void addArithmeticHandlers() {
        for (int i = 0; i != ARITHMETIC.length; ++i) {
            addArithmeticHandler(ARITHMETIC[i], ARITHMETIC_OPS[i]);
        }
    }

    private void addStepHandler(String mnemonic, Operator op) {
        Wild src = t.wild("src");
        final Expression exp = t.applyOperator(op, ir.slot(1), t.number(1));

        exec.addHandler(t.symbol(mnemonic).apply(src), new Handler() {
                public MachineState execute(MachineState state, Bindings operands) {
                    return ir.executeAll(state,
                                         ir.load(1, operands.get("src")),
                                         ir.calc(2, exp),
                                         ir.save(2, operands.get("src")));
                }
            });
    }

    private void addIncDecHandlers() {
        addStepHandler("INC", Operator.ADD);
        addStepHandler("DEC", Operator.SUB);
    }
}
