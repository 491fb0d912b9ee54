package com.swapanalysis.classifier.patterns;

import com.swapanalysis.classifier.IdiomClassifier;
import com.swapanalysis.classifier.IdiomKind;
import com.swapanalysis.classifier.SwapMatch;
import com.swapanalysis.scan.ScanContext;
import com.swapanalysis.scan.Window;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.syntax.BinaryOperator;
import com.swapanalysis.syntax.CompoundAssignment;
import com.swapanalysis.syntax.Span;
import com.swapanalysis.syntax.Statement;

import java.util.Optional;

/**
 * <pre>
 * a ^= b;
 * b ^= a;
 * a ^= b;
 * </pre>
 */
public class XorSwapPattern implements IdiomClassifier.IdiomPattern {

    @Override
    public Optional<SwapMatch> match(Window window, ScanContext context) {
        Optional<CompoundAssignment> x0 = xorAssign(window.get(0));
        Optional<CompoundAssignment> x1 = xorAssign(window.get(1));
        Optional<CompoundAssignment> x2 = xorAssign(window.get(2));
        if (x0.isEmpty() || x1.isEmpty() || x2.isEmpty()) {
            return Optional.empty();
        }
        ExpressionEquivalence eq = context.equivalence();
        CompoundAssignment s0 = x0.get();
        CompoundAssignment s1 = x1.get();
        CompoundAssignment s2 = x2.get();
        if (eq.equivalent(s0.lhs(), s1.rhs())
                && eq.equivalent(s2.lhs(), s1.rhs())
                && eq.equivalent(s1.lhs(), s0.rhs())
                && eq.equivalent(s1.lhs(), s2.rhs())) {
            Span span = s0.span().to(s2.span());
            return Optional.of(new SwapMatch(IdiomKind.XOR_SWAP, s0.lhs(), s0.rhs(), span));
        }
        return Optional.empty();
    }

    private static Optional<CompoundAssignment> xorAssign(Statement statement) {
        if (statement instanceof CompoundAssignment ca && ca.operator() == BinaryOperator.BIT_XOR) {
            return Optional.of(ca);
        }
        return Optional.empty();
    }

    @Override
    public int windowSize() {
        return 3;
    }
}
