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
 * <pre>
 * let t = a;
 * a = b;
 * b = t;
 * </pre>
 */
public class TempVariableSwapPattern implements IdiomClassifier.IdiomPattern {

    @Override
    public Optional<SwapMatch> match(Window window, ScanContext context) {
        if (context.constantContext()) {
            return Optional.empty();
        }
        ExpressionEquivalence eq = context.equivalence();

        // let t = foo;
        if (!(window.get(0) instanceof LocalDeclaration tmp)) {
            return Optional.empty();
        }
        Optional<Expression> tmpInit = tmp.init();
        if (tmpInit.isEmpty()
                || !(tmp.pattern() instanceof BindingPattern binding)
                || binding.sub().isPresent()) {
            return Optional.empty();
        }

        // foo = bar;
        if (!(window.get(1) instanceof ExpressionStatement s1) || !(s1.expression() instanceof Assign first)) {
            return Optional.empty();
        }

        // bar = t;
        if (!(window.get(2) instanceof ExpressionStatement s2) || !(s2.expression() instanceof Assign second)) {
            return Optional.empty();
        }
        if (!(second.value() instanceof PathReference rhs2) || !rhs2.isSingleSegment()) {
            return Optional.empty();
        }

        if (!binding.identifier().name().equals(rhs2.lastSegment())
                || !eq.equivalent(tmpInit.get(), first.target())
                || !eq.equivalent(first.value(), second.target())) {
            return Optional.empty();
        }

        Span span = tmp.span().to(second.span());
        return Optional.of(new SwapMatch(IdiomKind.TEMP_VARIABLE_SWAP, first.target(), second.target(), span));
    }

    @Override
    public int windowSize() {
        return 3;
    }
}
