package com.galois.symex;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.symex.proto.Protos;

/**
 * Reads and writes sequences of expressions, such as instruction lists, as
 * length-delimited protocol buffer messages.
 */
public final class ExpressionStreams {
    private ExpressionStreams() {}

    public static void writeDelimited(OutputStream s, List<? extends Expression> exprs) throws IOException {
        for (Expression e : exprs) {
            e.getExprRep().writeDelimitedTo(s);
        }
        s.flush();
    }

    /**
     * Read expressions until the end of the stream, interning their symbols
     * in <code>t</code>.
     */
    public static List<Expression> readDelimited(InputStream s, SymbolTable t) throws IOException {
        List<Expression> r = new ArrayList<Expression>();
        while (true) {
            Protos.Expr rep = Protos.Expr.parseDelimitedFrom(s);
            // null indicates the end of the stream
            if (rep == null) {
                break;
            }
            r.add(t.fromExprRep(rep));
        }
        return r;
    }
}
