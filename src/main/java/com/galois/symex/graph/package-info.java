/**
 * Directed graphs over symbols, for structural questions such as which
 * values a register depends on.
 */
package com.galois.symex.graph;
