package com.swapanalysis.suggestion;

import com.swapanalysis.classifier.IdiomKind;
import com.swapanalysis.classifier.SwapMatch;
import com.swapanalysis.pojo.Applicability;
import com.swapanalysis.pojo.Edit;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LintKind;
import com.swapanalysis.scan.ScanContext;
import com.swapanalysis.semantics.CollaboratorUnavailableException;
import com.swapanalysis.semantics.ContainerKind;
import com.swapanalysis.syntax.Expression;
import com.swapanalysis.syntax.IndexAccess;
import com.swapanalysis.syntax.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns a {@link SwapMatch} into a {@link Finding} with a concrete rewrite, or decides that no safe
 * rewrite exists.
 */
public class SuggestionBuilder {

    private static final Logger log = LoggerFactory.getLogger(SuggestionBuilder.class);

    static final String HELP = "try";

    private final SwapDialect dialect;

    public SuggestionBuilder(SwapDialect dialect) {
        this.dialect = dialect;
    }

    public SwapDialect getDialect() {
        return dialect;
    }

    public Optional<Finding> build(SwapMatch match, ScanContext context) {
        if (match.idiom() == IdiomKind.ALMOST_SWAPPED) {
            return almostSwapped(match, context);
        }
        return manualSwap(match.first(), match.second(), match.span(), match.idiom() == IdiomKind.XOR_SWAP, context);
    }

    /**
     * Swap of two places. Uses the reference swap when both places can be borrowed mutably at once,
     * falls back to an element swap when both index the same sequence, and gives up otherwise.
     */
    Optional<Finding> manualSwap(Expression e1, Expression e2, Span span, boolean xorBased, ScanContext context) {
        if (!context.aliasing().canAliasMutably(e1, e2)) {
            return elementSwap(e1, e2, span, context);
        }

        Sugg first = Sugg.hir(e1, context.sourceText(), "..");
        Sugg second = Sugg.hir(e2, context.sourceText(), "..");
        Applicability applicability = grade(first).and(grade(second)).and(hostGrade());

        String replacement = dialect.swapFunction() + "("
                + first.mutAddr(dialect.mutableReferencePrefix()) + ", "
                + second.mutAddr(dialect.mutableReferencePrefix()) + ")";
        String note = xorBased ? null : replaceNote().orElse(null);
        return Optional.of(new Finding(
                LintKind.MANUAL_SWAP,
                "this looks like you are swapping `" + first + "` and `" + second + "` manually",
                span,
                HELP,
                List.of(new Edit(span, replacement)),
                note,
                applicability));
    }

    private Optional<Finding> elementSwap(Expression e1, Expression e2, Span span, ScanContext context) {
        if (!(e1 instanceof IndexAccess i1) || !(e2 instanceof IndexAccess i2)) {
            return Optional.empty();
        }
        if (!context.equivalence().equivalent(i1.base(), i2.base())) {
            return Optional.empty();
        }
        Optional<ContainerKind> container = containerKind(i1.base(), context);
        if (container.isEmpty() || !container.get().supportsElementSwap()) {
            return Optional.empty();
        }

        Sugg slice = Sugg.hir(i1.base(), context.sourceText(), "<slice>");
        Sugg idx1 = Sugg.hir(i1.index(), context.sourceText(), "..");
        Sugg idx2 = Sugg.hir(i2.index(), context.sourceText(), "..");
        Applicability applicability = grade(slice).and(grade(idx1)).and(grade(idx2)).and(hostGrade());

        String replacement = dialect.staticElementSwap()
                ? dialect.elementSwapMethod() + "(" + slice + ", " + idx1 + ", " + idx2 + ")"
                : slice.maybePar() + "." + dialect.elementSwapMethod() + "(" + idx1 + ", " + idx2 + ")";
        return Optional.of(new Finding(
                LintKind.MANUAL_SWAP,
                "this looks like you are swapping elements of `" + slice + "` manually",
                span,
                HELP,
                List.of(new Edit(span, replacement)),
                null,
                applicability));
    }

    /**
     * Never auto-applicable: nothing says the author meant to swap.
     */
    Optional<Finding> almostSwapped(SwapMatch match, ScanContext context) {
        Optional<Sugg> lhs = Sugg.hirOpt(match.first(), context.sourceText());
        Optional<Sugg> rhs = Sugg.hirOpt(match.second(), context.sourceText());
        if (lhs.isEmpty() || rhs.isEmpty()) {
            return Optional.empty();
        }
        String prefix = dialect.mutableReferencePrefix();
        String replacement = dialect.swapFunction() + "("
                + lhs.get().mutAddr(prefix) + ", " + rhs.get().mutAddr(prefix) + ")";
        return Optional.of(new Finding(
                LintKind.ALMOST_SWAPPED,
                "this looks like you are trying to swap `" + lhs.get() + "` and `" + rhs.get() + "`",
                match.span(),
                HELP,
                List.of(new Edit(match.span(), replacement)),
                replaceNote().orElse(null),
                Applicability.REVIEW_REQUIRED));
    }

    private Optional<ContainerKind> containerKind(Expression container, ScanContext context) {
        try {
            return context.typeOracle().staticTypeOf(container);
        } catch (CollaboratorUnavailableException e) {
            log.debug("No type for {}, skipping element swap: {}", container.span(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> replaceNote() {
        if (!dialect.hasReplaceFunction()) {
            return Optional.empty();
        }
        return Optional.of("or maybe you should use `" + dialect.replaceFunction() + "`?");
    }

    private Applicability hostGrade() {
        return dialect.autoApplicable() ? Applicability.AUTO_APPLICABLE : Applicability.REVIEW_REQUIRED;
    }

    private static Applicability grade(Sugg sugg) {
        return sugg.placeholder() ? Applicability.REVIEW_REQUIRED : Applicability.AUTO_APPLICABLE;
    }
}
