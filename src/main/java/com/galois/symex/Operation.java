package com.galois.symex;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.galois.symex.proto.Protos;

/**
 * A head applied to an ordered list of operands.
 *
 * <p>
 * Both functions such as <code>MEMORY(size, addr)</code> and instructions
 * such as <code>MOV(dst, src)</code> are operations; an instruction is an
 * operation whose head is a mnemonic symbol.
 */
public final class Operation extends Expression {
    private final Expression head;
    private final Expression[] operands;
    private final int hash;

    Operation(Expression head, Expression[] operands) {
        if (head == null) throw new NullPointerException("head");
        for (int i = 0; i != operands.length; ++i) {
            if (operands[i] == null) {
                throw new NullPointerException("operand " + i);
            }
        }
        this.head = head;
        this.operands = operands.clone();
        this.hash = 31 * head.hashCode() + Arrays.hashCode(this.operands);
    }

    Operation(Expression head, List<Expression> operands) {
        this(head, operands.toArray(new Expression[operands.size()]));
    }

    public Expression getHead() {
        return head;
    }

    /**
     * Return the operator named by the head, or <code>null</code>.
     */
    public Operator getOperator() {
        return Operator.forHead(head);
    }

    public int getArity() {
        return operands.length;
    }

    public Expression getOperand(int i) {
        if (!(0 <= i && i < operands.length)) {
            throw new IllegalArgumentException("Bad operand index " + i);
        }
        return operands[i];
    }

    public List<Expression> getOperands() {
        return Collections.unmodifiableList(Arrays.asList(operands));
    }

    public Kind kind() {
        return Kind.OPERATION;
    }

    Expression substituteOperands(Map<? extends Expression, ? extends Expression> mapping) {
        Expression h = head.substitute(mapping);
        boolean changed = h != head;
        Expression[] args = new Expression[operands.length];
        for (int i = 0; i != operands.length; ++i) {
            args[i] = operands[i].substitute(mapping);
            changed |= args[i] != operands[i];
        }
        return changed ? new Operation(h, args) : this;
    }

    public Protos.Expr getExprRep() {
        Protos.Expr.Builder b
            = Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.OperationExpr)
            .setHead(head.getExprRep());
        for (Expression e : operands) {
            b.addOperand(e.getExprRep());
        }
        return b.build();
    }

    public BigInteger evaluate(Map<? extends Expression, BigInteger> env) {
        BigInteger bound = env.get(this);
        if (bound != null) {
            return bound;
        }
        Operator op = getOperator();
        if (op == null || operands.length == 0) {
            throw new IllegalArgumentException("Cannot evaluate " + this);
        }
        BigInteger r = operands[0].evaluate(env);
        for (int i = 1; i != operands.length; ++i) {
            r = op.fold(r, operands[i].evaluate(env));
        }
        return r;
    }

    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation)) return false;
        Operation r = (Operation) o;
        return hash == r.hash
            && head.equals(r.head)
            && Arrays.equals(operands, r.operands);
    }

    public int hashCode() {
        return hash;
    }

    /**
     * Operators print infix, everything else as <code>head(a, b)</code>.
     */
    public String toString() {
        StringBuilder b = new StringBuilder();
        Operator op = getOperator();
        if (op != null && operands.length >= 2) {
            b.append('(');
            for (int i = 0; i != operands.length; ++i) {
                if (i > 0) {
                    b.append(' ').append(op).append(' ');
                }
                b.append(operands[i]);
            }
            b.append(')');
        } else {
            b.append(head).append('(');
            for (int i = 0; i != operands.length; ++i) {
                if (i > 0) b.append(", ");
                b.append(operands[i]);
            }
            b.append(')');
        }
        return b.toString();
    }
}
