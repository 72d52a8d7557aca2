/**
 * Symbolic expressions for reasoning about what a code sequence computes
 * without running it.
 *
 * <p>
 * Expressions are built from a {@link com.galois.symex.SymbolTable}, which
 * interns symbols and provides the operator constructors.  Expressions are
 * immutable values: {@link com.galois.symex.Expression#simplify simplify}
 * and {@link com.galois.symex.Expression#substitute substitute} always
 * return new expressions.
 */
package com.galois.symex;
