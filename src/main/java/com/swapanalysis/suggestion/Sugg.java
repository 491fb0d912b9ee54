package com.swapanalysis.suggestion;

import com.swapanalysis.syntax.*;

import java.util.Optional;

/**
 * An operand of a suggestion: its text plus enough shape information to parenthesize it correctly
 * when it gets embedded in a larger expression.
 */
public record Sugg(String text, Kind kind, boolean placeholder) {

    public enum Kind {
        /** Never needs parentheses: paths, literals, field and index accesses, calls. */
        ATOMIC,
        /** Prefix operators; fine after another prefix, parenthesized as a receiver. */
        PREFIX,
        /** Binary operators, casts and anything unknown. */
        BINARY;

        public static Kind of(Expression e) {
            if (e instanceof PathReference || e instanceof Literal || e instanceof Parenthesized
                    || e instanceof FieldAccess || e instanceof IndexAccess
                    || e instanceof Call || e instanceof MethodCall) {
                return ATOMIC;
            }
            if (e instanceof Dereference d) {
                return d.implicit() ? of(d.target()) : PREFIX;
            }
            if (e instanceof Unary) {
                return PREFIX;
            }
            return BINARY;
        }
    }

    /**
     * Renders {@code e} from its snippet, or by printing the tree; empty if neither works.
     */
    public static Optional<Sugg> hirOpt(Expression e, SourceText source) {
        Optional<String> text = e.span().isKnown() ? source.snippet(e.span()) : Optional.empty();
        if (text.isEmpty()) {
            text = ExpressionPrinter.print(e);
        }
        return text.map(t -> new Sugg(t, Kind.of(e), false));
    }

    /**
     * Like {@link #hirOpt} but falls back to {@code placeholder}, which marks the result as such.
     */
    public static Sugg hir(Expression e, SourceText source, String placeholder) {
        return hirOpt(e, source).orElseGet(() -> new Sugg(placeholder, Kind.ATOMIC, true));
    }

    /** {@code prefix} applied to this operand, e.g. {@code &mut a} or {@code &mut (a + b)}. */
    public String mutAddr(String prefix) {
        return kind == Kind.BINARY ? prefix + "(" + text + ")" : prefix + text;
    }

    /** This operand as a method receiver. */
    public String maybePar() {
        return kind == Kind.ATOMIC ? text : "(" + text + ")";
    }

    @Override
    public String toString() {
        return text;
    }
}
