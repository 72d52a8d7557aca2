package com.galois.symex.exec;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;

/**
 * The 32-bit x86 general purpose registers and flags register.
 */
public final class X86Registers implements InitialStateFactory {
    /** Names of the registers, flags last. */
    public static final String NAMES = "eax ebx ecx edx esi edi esp ebp eflags";

    /** Prefix of the symbols holding each register's value on entry. */
    public static final String INITIAL_PREFIX = "initial_";

    private final SymbolTable t;
    private final List<Symbol> registers;

    public X86Registers(SymbolTable t) {
        this.t = t;
        this.registers = Collections.unmodifiableList(Arrays.asList(t.symbols(NAMES)));
    }

    public List<Symbol> getRegisters() {
        return registers;
    }

    public Symbol get(String name) {
        Symbol s = t.symbol(name);
        if (!registers.contains(s)) {
            throw new IllegalArgumentException("Unknown register " + name);
        }
        return s;
    }

    public Symbol getFlags() {
        return get("eflags");
    }

    /**
     * Return the symbol standing for the value <code>reg</code> had on
     * entry, e.g. <code>initial_eax</code>.
     */
    public Symbol initialValue(Symbol reg) {
        return t.symbol(INITIAL_PREFIX + reg.getName());
    }

    /**
     * Map every register to its initial value symbol.
     */
    public MachineState newInitialState() {
        MachineState s = new MachineState();
        for (Symbol r : registers) {
            s.put(r, initialValue(r));
        }
        return s;
    }
}
