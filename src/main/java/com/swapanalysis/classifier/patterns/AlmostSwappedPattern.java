package com.swapanalysis.classifier.patterns;

import com.swapanalysis.classifier.IdiomClassifier;
import com.swapanalysis.classifier.IdiomKind;
import com.swapanalysis.classifier.SwapMatch;
import com.swapanalysis.scan.ScanContext;
import com.swapanalysis.scan.Window;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.syntax.*;

import java.util.Optional;

/**
 * {@code a = b; b = a;}: two assignments that copy a value back and forth, which loses one of them.
 * The first statement may also be a declaration ({@code let a = b; b = a;}).
 */
public class AlmostSwappedPattern implements IdiomClassifier.IdiomPattern {

    /** "target := value", where a declaration's target is the identifier it binds. */
    record Assignment(Expression target, Identifier binding, Expression value) {

        Expression targetExpression() {
            return target != null ? target : PathReference.local(binding.name(), binding.span());
        }
    }

    @Override
    public Optional<SwapMatch> match(Window window, ScanContext context) {
        Statement firstStatement = window.get(0);
        Statement secondStatement = window.get(1);
        Optional<Assignment> first = parse(firstStatement);
        Optional<Assignment> second = parse(secondStatement);
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        if (!firstStatement.span().eqContext(secondStatement.span())) {
            return Optional.empty();
        }
        ExpressionEquivalence eq = context.equivalence();
        Assignment a0 = first.get();
        Assignment a1 = second.get();
        if (!isSame(eq, a0, a1.value()) || !isSame(eq, a1, a0.value())) {
            return Optional.empty();
        }
        Span span = firstStatement.span().to(a1.value().span());
        return Optional.of(new SwapMatch(IdiomKind.ALMOST_SWAPPED, a0.targetExpression(), a0.value(), span));
    }

    private static boolean isSame(ExpressionEquivalence eq, Assignment lhs, Expression rhs) {
        if (lhs.target() != null) {
            return eq.equivalent(lhs.target(), rhs);
        }
        return eq.matchesBinding(lhs.binding(), rhs);
    }

    static Optional<Assignment> parse(Statement statement) {
        if (statement instanceof ExpressionStatement es) {
            if (es.expression() instanceof Assign assign) {
                return Optional.of(new Assignment(assign.target(), null, assign.value()));
            }
        } else if (statement instanceof LocalDeclaration local) {
            if (local.init().isPresent() && local.pattern() instanceof BindingPattern binding) {
                return Optional.of(new Assignment(null, binding.identifier(), local.init().get()));
            }
        }
        return Optional.empty();
    }

    @Override
    public int windowSize() {
        return 2;
    }
}
