package com.swapanalysis.suggestion;

import com.swapanalysis.syntax.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders an expression tree back to text when the original snippet is not available.
 * Empty when the tree contains an {@link OpaqueExpression}.
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {
    }

    public static Optional<String> print(Expression e) {
        try {
            return Optional.of(render(e));
        } catch (UnprintableException ex) {
            return Optional.empty();
        }
    }

    private static String render(Expression e) {
        if (e instanceof PathReference p) {
            return p.text();
        }
        if (e instanceof Literal l) {
            return l.text();
        }
        if (e instanceof Parenthesized p) {
            return "(" + render(p.inner()) + ")";
        }
        if (e instanceof FieldAccess f) {
            return operand(f.base()) + "." + f.field();
        }
        if (e instanceof IndexAccess i) {
            return operand(i.base()) + "[" + render(i.index()) + "]";
        }
        if (e instanceof Dereference d) {
            return d.implicit() ? render(d.target()) : "*" + operand(d.target());
        }
        if (e instanceof Cast c) {
            return "(" + c.type() + ") " + operand(c.operand());
        }
        if (e instanceof Unary u) {
            return u.operator().isPostfix()
                    ? operand(u.operand()) + u.operator().symbol()
                    : u.operator().symbol() + operand(u.operand());
        }
        if (e instanceof Binary b) {
            return operand(b.left()) + " " + b.operator().symbol() + " " + operand(b.right());
        }
        if (e instanceof Assign a) {
            return render(a.target()) + " = " + render(a.value());
        }
        if (e instanceof Call c) {
            return operand(c.callee()) + "(" + arguments(c.arguments()) + ")";
        }
        if (e instanceof MethodCall m) {
            return operand(m.receiver()) + "." + m.method() + "(" + arguments(m.arguments()) + ")";
        }
        throw new UnprintableException();
    }

    private static String operand(Expression e) {
        String text = render(e);
        return Sugg.Kind.of(e) == Sugg.Kind.ATOMIC ? text : "(" + text + ")";
    }

    private static String arguments(List<Expression> arguments) {
        return arguments.stream().map(ExpressionPrinter::render).collect(Collectors.joining(", "));
    }

    private static final class UnprintableException extends RuntimeException {
        UnprintableException() {
            super(null, null, false, false);
        }
    }
}
