package com.galois.symex.exec;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import com.galois.symex.Bindings;
import com.galois.symex.Expression;
import com.galois.symex.NoHandlerFoundException;
import com.galois.symex.SymbolTable;

/**
 * Executes symbolic instructions by dispatching them to registered handlers.
 *
 * <p>
 * Handlers are tried most recently registered first, so a later handler
 * can override a more general one registered earlier without removing it.
 * Handlers usually translate an instruction into IR instructions and
 * execute those through the same executor.
 *
 * <p>
 * Implementation note: execution never modifies a state passed in by the
 * caller.  Each dispatch step copies the state before handing it to the
 * handler, so several instruction sequences may be explored from one
 * starting state.  Registering handlers and hooks is not synchronized;
 * finish setting up the executor before sharing it between threads.
 */
public class InstructionExecutor {
    private static final class Registration {
        final Matcher matcher;
        final Handler handler;

        Registration(Matcher matcher, Handler handler) {
            this.matcher = matcher;
            this.handler = handler;
        }
    }

    private final SymbolTable symbols;

    /** Registered handlers, most recent first. */
    private final LinkedList<Registration> handlers = new LinkedList<Registration>();

    /** Observers keyed by IR opcode name. */
    private final Map<String, List<ExecutionHook>> hooks = new HashMap<String, List<ExecutionHook>>();

    private InitialStateFactory initialStateFactory = null;

    /** Stream to write any status messages to.  Null indicates no logging */
    private PrintStream statusStream = null;

    public InstructionExecutor(SymbolTable symbols) {
        if (symbols == null) throw new NullPointerException("symbols");
        this.symbols = symbols;
    }

    public SymbolTable getSymbolTable() {
        return symbols;
    }

    /**
     * Set the stream to write logging messages to.
     * @param s The stream.
     */
    public void setStatusStream(PrintStream s) {
        statusStream = s;
    }

    void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("symex: %s\n", msg);
            statusStream.flush();
        }
    }

    /**
     * Set the factory for the state used when none is given.  Without one,
     * execution starts from an empty state.
     */
    public void setInitialStateFactory(InitialStateFactory f) {
        initialStateFactory = f;
    }

    /**
     * Return a fresh initial state.
     */
    public MachineState newInitialState() {
        if (initialStateFactory == null) {
            return new MachineState();
        }
        return initialStateFactory.newInitialState();
    }

    /**
     * Register a handler.  It takes priority over every handler registered
     * before it.
     */
    public void addHandler(Matcher matcher, Handler handler) {
        if (matcher == null) throw new NullPointerException("matcher");
        if (handler == null) throw new NullPointerException("handler");
        handlers.addFirst(new Registration(matcher, handler));
    }

    /**
     * Register a handler for instructions matching <code>pattern</code>.
     */
    public void addHandler(Expression pattern, Handler handler) {
        addHandler(Matcher.pattern(pattern), handler);
    }

    /**
     * Register a handler for instructions accepted by <code>predicate</code>.
     */
    public void addHandler(Matcher.Predicate predicate, Handler handler) {
        addHandler(Matcher.predicate(predicate), handler);
    }

    public int getHandlerCount() {
        return handlers.size();
    }

    /**
     * Register an observer for an IR opcode such as <code>ir_LOAD</code>.
     */
    public void addHook(String opcode, ExecutionHook hook) {
        if (opcode == null) throw new NullPointerException("opcode");
        if (hook == null) throw new NullPointerException("hook");
        List<ExecutionHook> l = hooks.get(opcode);
        if (l == null) {
            l = new LinkedList<ExecutionHook>();
            hooks.put(opcode, l);
        }
        l.add(hook);
    }

    /**
     * Call the hooks registered for <code>opcode</code>.
     */
    public void fireHooks(String opcode, Expression... values) {
        List<ExecutionHook> l = hooks.get(opcode);
        if (l == null) {
            return;
        }
        List<Expression> args = Arrays.asList(values.clone());
        for (ExecutionHook h : l) {
            h.observe(opcode, args);
        }
    }

    /**
     * Execute one instruction.
     *
     * @param instruction The instruction.
     * @param state The state before the instruction, or <code>null</code>
     *   for a fresh initial state.  It is not modified.
     * @return the state after the instruction.
     * @throws NoHandlerFoundException if no handler matches.
     */
    public MachineState executeSingle(Expression instruction, MachineState state) {
        if (instruction == null) throw new NullPointerException("instruction");
        MachineState s = state == null ? newInitialState() : state.copy();

        Bindings operands = new Bindings();
        for (Registration r : handlers) {
            if (r.matcher.matches(instruction, operands)) {
                logStatus("executing " + instruction);
                return r.handler.execute(s, operands);
            }
        }

        logStatus("no handler for " + instruction);
        throw new NoHandlerFoundException(instruction);
    }

    public MachineState executeSingle(Expression instruction) {
        return executeSingle(instruction, null);
    }

    /**
     * Execute instructions in order, threading the state through them.
     *
     * @throws NoHandlerFoundException if an instruction has no handler.
     */
    public MachineState executeList(List<? extends Expression> instructions, MachineState state) {
        if (state == null) {
            state = newInitialState();
        }
        for (Expression inst : instructions) {
            state = executeSingle(inst, state);
        }
        return state;
    }

    public MachineState executeList(List<? extends Expression> instructions) {
        return executeList(instructions, null);
    }

    /**
     * Execute instructions, reporting an instruction without a handler in
     * the result instead of throwing.  Only top-level instructions are
     * skipped; when an instruction emitted by a handler has no handler,
     * execution stops and the result names that instruction.
     *
     * @param instructions The instructions.
     * @param state The initial state or <code>null</code>.
     * @param policy Whether to stop at or skip unhandled instructions.
     */
    public ExecutionResult run(List<? extends Expression> instructions,
                               MachineState state,
                               UnhandledPolicy policy) {
        if (policy == null) throw new NullPointerException("policy");
        if (state == null) {
            state = newInitialState();
        }

        List<Expression> skipped = new ArrayList<Expression>();
        int index = 0;
        for (Expression inst : instructions) {
            try {
                state = executeSingle(inst, state);
            } catch (NoHandlerFoundException e) {
                // A handler matched but something it dispatched did not.
                // That is never skipped.
                boolean nested = !e.getInstruction().equals(inst);
                if (nested || policy == UnhandledPolicy.ABORT) {
                    return new ExecutionResult(state,
                                               ExecutionResult.ErrorKind.NO_HANDLER_FOUND,
                                               e.getInstruction(),
                                               index,
                                               skipped);
                }
                logStatus("skipping " + inst);
                skipped.add(inst);
            }
            ++index;
        }
        return new ExecutionResult(state, ExecutionResult.ErrorKind.NONE, null, -1, skipped);
    }
}
