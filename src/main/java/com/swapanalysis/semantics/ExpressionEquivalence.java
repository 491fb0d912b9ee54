package com.swapanalysis.semantics;

import com.swapanalysis.syntax.*;

import java.util.List;

/**
 * Decides whether two expressions always evaluate to the same value.
 * <p>
 * The comparison is structural, ignores parentheses and spans, and refuses anything that may have a
 * side effect: two calls to the same impure function are not equivalent, because evaluating one of
 * them may change what the other returns. Calls the front end marked as pure are compared like any
 * other node.
 */
public class ExpressionEquivalence {

    public boolean equivalent(Expression a, Expression b) {
        if (a == null || b == null) {
            return false;
        }
        if (!isSideEffectFree(a) || !isSideEffectFree(b)) {
            return false;
        }
        return sameStructure(a, b);
    }

    /**
     * True iff {@code expression} is an unqualified reference to the variable {@code identifier} binds.
     */
    public boolean matchesBinding(Identifier identifier, Expression expression) {
        return expression instanceof PathReference path
                && path.isSingleSegment()
                && path.lastSegment().equals(identifier.name());
    }

    public boolean isSideEffectFree(Expression e) {
        if (e instanceof PathReference || e instanceof Literal) {
            return true;
        }
        if (e instanceof Parenthesized p) {
            return isSideEffectFree(p.inner());
        }
        if (e instanceof FieldAccess f) {
            return isSideEffectFree(f.base());
        }
        if (e instanceof IndexAccess i) {
            return isSideEffectFree(i.base()) && isSideEffectFree(i.index());
        }
        if (e instanceof Dereference d) {
            return isSideEffectFree(d.target());
        }
        if (e instanceof Cast c) {
            return isSideEffectFree(c.operand());
        }
        if (e instanceof Unary u) {
            return !u.operator().isMutating() && isSideEffectFree(u.operand());
        }
        if (e instanceof Binary b) {
            return isSideEffectFree(b.left()) && isSideEffectFree(b.right());
        }
        if (e instanceof Call c) {
            return c.pure() && isSideEffectFree(c.callee()) && allSideEffectFree(c.arguments());
        }
        if (e instanceof MethodCall m) {
            return m.pure() && isSideEffectFree(m.receiver()) && allSideEffectFree(m.arguments());
        }
        // Assign, OpaqueExpression and unknown shapes
        return false;
    }

    private boolean allSideEffectFree(List<Expression> expressions) {
        return expressions.stream().allMatch(this::isSideEffectFree);
    }

    private boolean sameStructure(Expression left, Expression right) {
        Expression a = stripParentheses(left);
        Expression b = stripParentheses(right);

        if (a instanceof PathReference pa && b instanceof PathReference pb) {
            return pa.segments().equals(pb.segments());
        }
        if (a instanceof Literal la && b instanceof Literal lb) {
            return la.text().equals(lb.text());
        }
        if (a instanceof FieldAccess fa && b instanceof FieldAccess fb) {
            return fa.field().equals(fb.field()) && sameStructure(fa.base(), fb.base());
        }
        if (a instanceof IndexAccess ia && b instanceof IndexAccess ib) {
            return sameStructure(ia.base(), ib.base()) && sameStructure(ia.index(), ib.index());
        }
        if (a instanceof Dereference da && b instanceof Dereference db) {
            return sameStructure(da.target(), db.target());
        }
        if (a instanceof Cast ca && b instanceof Cast cb) {
            return ca.type().equals(cb.type()) && sameStructure(ca.operand(), cb.operand());
        }
        if (a instanceof Unary ua && b instanceof Unary ub) {
            return ua.operator() == ub.operator() && sameStructure(ua.operand(), ub.operand());
        }
        if (a instanceof Binary ba && b instanceof Binary bb) {
            return ba.operator() == bb.operator()
                    && sameStructure(ba.left(), bb.left())
                    && sameStructure(ba.right(), bb.right());
        }
        if (a instanceof Call ca && b instanceof Call cb) {
            return sameStructure(ca.callee(), cb.callee()) && sameStructure(ca.arguments(), cb.arguments());
        }
        if (a instanceof MethodCall ma && b instanceof MethodCall mb) {
            return ma.method().equals(mb.method())
                    && sameStructure(ma.receiver(), mb.receiver())
                    && sameStructure(ma.arguments(), mb.arguments());
        }
        return false;
    }

    private boolean sameStructure(List<Expression> left, List<Expression> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!sameStructure(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    public static Expression stripParentheses(Expression e) {
        Expression current = e;
        while (current instanceof Parenthesized p) {
            current = p.inner();
        }
        return current;
    }
}
