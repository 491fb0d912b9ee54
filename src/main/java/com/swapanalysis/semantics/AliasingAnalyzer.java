package com.swapanalysis.semantics;

import com.swapanalysis.syntax.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether two places can be borrowed for mutation at the same time, i.e. whether they are
 * provably disjoint. Anything that cannot be proven disjoint is reported as not aliasable.
 * <p>
 * Each place is split into a root and a chain of projections (field, index, dereference), outermost
 * last. Distinct named roots are disjoint unless one of the chains goes through a dereference, since
 * two different pointers may still point at the same storage. Places with the same root are walked
 * projection by projection until they diverge on a field name.
 */
public class AliasingAnalyzer {

    private final ExpressionEquivalence equivalence;

    public AliasingAnalyzer(ExpressionEquivalence equivalence) {
        this.equivalence = equivalence;
    }

    public boolean canAliasMutably(Expression a, Expression b) {
        Place left = Place.of(a);
        Place right = Place.of(b);

        if (!equivalence.equivalent(left.root(), right.root())) {
            return left.root() instanceof PathReference
                    && right.root() instanceof PathReference
                    && !left.throughDereference()
                    && !right.throughDereference();
        }

        int common = Math.min(left.projections().size(), right.projections().size());
        for (int i = 0; i < common; i++) {
            Expression x = left.projections().get(i);
            Expression y = right.projections().get(i);
            if (x instanceof FieldAccess fx && y instanceof FieldAccess fy) {
                if (!fx.field().equals(fy.field())) {
                    return true;
                }
            } else if (x instanceof IndexAccess ix && y instanceof IndexAccess iy) {
                if (!equivalence.equivalent(ix.index(), iy.index())) {
                    return false;
                }
            } else if (!(x instanceof Dereference && y instanceof Dereference)) {
                return false;
            }
        }
        // same place, or one place contains the other
        return false;
    }

    record Place(Expression root, List<Expression> projections) {

        static Place of(Expression expression) {
            List<Expression> chain = new ArrayList<>();
            Expression current = ExpressionEquivalence.stripParentheses(expression);
            while (true) {
                if (current instanceof FieldAccess f) {
                    chain.add(current);
                    current = f.base();
                } else if (current instanceof IndexAccess i) {
                    chain.add(current);
                    current = i.base();
                } else if (current instanceof Dereference d) {
                    chain.add(current);
                    current = d.target();
                } else {
                    break;
                }
                current = ExpressionEquivalence.stripParentheses(current);
            }
            Collections.reverse(chain);
            return new Place(current, List.copyOf(chain));
        }

        boolean throughDereference() {
            return projections.stream().anyMatch(p -> p instanceof Dereference);
        }
    }
}
