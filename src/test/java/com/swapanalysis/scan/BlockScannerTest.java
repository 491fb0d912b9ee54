package com.swapanalysis.scan;

import com.swapanalysis.SyntaxFixtures;
import com.swapanalysis.classifier.IdiomClassifier;
import com.swapanalysis.pojo.Applicability;
import com.swapanalysis.pojo.Finding;
import com.swapanalysis.pojo.LintKind;
import com.swapanalysis.pojo.LintLevel;
import com.swapanalysis.pojo.LintLevels;
import com.swapanalysis.semantics.AliasingAnalyzer;
import com.swapanalysis.semantics.CollaboratorUnavailableException;
import com.swapanalysis.semantics.ContainerKind;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.suggestion.SuggestionBuilder;
import com.swapanalysis.suggestion.SwapDialect;
import com.swapanalysis.syntax.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class BlockScannerTest {

    private static final String NOTE = "or maybe you should use `std::mem::replace`?";

    private final SyntaxFixtures t = new SyntaxFixtures();

    private static BlockScanner scanner(LintLevels levels) {
        ExpressionEquivalence equivalence = new ExpressionEquivalence();
        return new BlockScanner(new IdiomClassifier(), new SuggestionBuilder(SwapDialect.DEFAULT),
                equivalence, new AliasingAnalyzer(equivalence), levels);
    }

    private static List<Finding> scan(Block block, TypeOracle oracle) {
        return scanner(LintLevels.defaults()).scan(block, oracle, SourceText.none());
    }

    private static List<Finding> scan(Block block) {
        return scan(block, TypeOracle.untyped());
    }

    private static TypeOracle typedAs(ContainerKind kind) {
        return new TypeOracle() {
            @Override
            public boolean isConstantContext(Block block) {
                return false;
            }

            @Override
            public Optional<ContainerKind> staticTypeOf(Expression expression) {
                return Optional.of(kind);
            }
        };
    }

    private static TypeOracle constantContext() {
        return new TypeOracle() {
            @Override
            public boolean isConstantContext(Block block) {
                return true;
            }

            @Override
            public Optional<ContainerKind> staticTypeOf(Expression expression) {
                return Optional.empty();
            }
        };
    }

    private static TypeOracle unavailable() {
        return new TypeOracle() {
            @Override
            public boolean isConstantContext(Block block) {
                throw new CollaboratorUnavailableException("no body owner");
            }

            @Override
            public Optional<ContainerKind> staticTypeOf(Expression expression) {
                throw new CollaboratorUnavailableException("no typeck results");
            }
        };
    }

    @Test
    public void testTempVariableSwapOfLocals() {
        Block block = t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "t"));

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(LintKind.MANUAL_SWAP, finding.kind());
        assertEquals("this looks like you are swapping `a` and `b` manually", finding.message());
        assertEquals("try", finding.help());
        assertEquals("std::mem::swap(&mut a, &mut b)", finding.suggestion());
        assertEquals(NOTE, finding.note());
        assertEquals(Applicability.AUTO_APPLICABLE, finding.applicability());
        assertEquals(block.statements().get(0).span().start(), finding.span().start());
        assertEquals(block.statements().get(2).span().end(), finding.span().end());
        assertEquals(finding.span(), finding.edits().get(0).span());
    }

    @Test
    public void testTempVariableSwapInsideLongerBlock() {
        Block block = t.block(t.other(), t.let("tmp", "x"), t.assign("x", "y"), t.assign("y", "tmp"), t.other());

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        assertEquals("std::mem::swap(&mut x, &mut y)", findings.get(0).suggestion());
    }

    @Test
    public void testTempVariableSwapOfDistinctFields() {
        Block block = t.block(
                t.let("t", t.field(t.path("s"), "x")),
                t.assign(t.field(t.path("s"), "x"), t.field(t.path("s"), "y")),
                t.assign(t.field(t.path("s"), "y"), t.path("t")));

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        assertEquals("std::mem::swap(&mut s.x, &mut s.y)", findings.get(0).suggestion());
    }

    @Test
    public void testTempVariableRequiresMatchingTemporary() {
        assertTrue(scan(t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "u"))).isEmpty());
        assertTrue(scan(t.block(t.let("t", "c"), t.assign("a", "b"), t.assign("b", "t"))).isEmpty());
        assertTrue(scan(t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("c", "t"))).isEmpty());
    }

    @Test
    public void testTempVariableNeedsAnInitializer() {
        Identifier tmp = t.identifier("t");
        Block block = t.block(
                new LocalDeclaration(BindingPattern.of(tmp), null, tmp.span()),
                t.assign("a", "b"),
                t.assign("b", "t"));
        assertTrue(scan(block).isEmpty());
    }

    @Test
    public void testTempVariableWithSubpatternIsIgnored() {
        Identifier tmp = t.identifier("t");
        OtherPattern sub = new OtherPattern("range", t.leafSpan());
        PathReference init = t.path("a");
        Block block = t.block(
                new LocalDeclaration(new BindingPattern(tmp, sub, tmp.span().to(sub.span())), init,
                        tmp.span().to(init.span())),
                t.assign("a", "b"),
                t.assign("b", "t"));
        assertTrue(scan(block).isEmpty());
    }

    @Test
    public void testElementSwapOfSequence() {
        Block block = t.block(
                t.let("t", t.element("v", t.path("i"))),
                t.assign(t.element("v", t.path("i")), t.element("v", t.path("j"))),
                t.assign(t.element("v", t.path("j")), t.path("t")));

        List<Finding> findings = scan(block, typedAs(ContainerKind.GROWABLE_SEQUENCE));

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(LintKind.MANUAL_SWAP, finding.kind());
        assertEquals("this looks like you are swapping elements of `v` manually", finding.message());
        assertEquals("v.swap(i, j)", finding.suggestion());
        assertNull(finding.note());
        assertEquals(Applicability.AUTO_APPLICABLE, finding.applicability());
    }

    @Test
    public void testElementSwapWithDifferentIndexExpressions() {
        Block block = t.block(
                t.let("t", t.element("v", t.path("i"))),
                t.assign(t.element("v", t.path("i")), t.element("v", t.path("k"))),
                t.assign(t.element("v", t.path("k")), t.path("t")));

        List<Finding> findings = scan(block, typedAs(ContainerKind.ARRAY));

        assertEquals(1, findings.size());
        assertEquals("v.swap(i, k)", findings.get(0).suggestion());
    }

    @Test
    public void testElementSwapNeedsAKnownSequenceType() {
        Block block = t.block(
                t.let("t", t.element("v", t.path("i"))),
                t.assign(t.element("v", t.path("i")), t.element("v", t.path("j"))),
                t.assign(t.element("v", t.path("j")), t.path("t")));

        assertTrue(scan(block, TypeOracle.untyped()).isEmpty());
        assertTrue(scan(block, typedAs(ContainerKind.OTHER)).isEmpty());
    }

    @Test
    public void testElementsOfDifferentSequencesAreNotSwapped() {
        Block block = t.block(
                t.let("t", t.element("v", t.path("i"))),
                t.assign(t.element("v", t.path("i")), t.element("w", t.path("i"))),
                t.assign(t.element("w", t.path("i")), t.path("t")));

        assertTrue(scan(block, typedAs(ContainerKind.ARRAY)).isEmpty());
    }

    @Test
    public void testSwapThroughPossiblyAliasedPointersIsNotReported() {
        Block block = t.block(
                t.let("t", t.deref(t.path("p"))),
                t.assign(t.deref(t.path("p")), t.deref(t.path("q"))),
                t.assign(t.deref(t.path("q")), t.path("t")));

        assertTrue(scan(block, typedAs(ContainerKind.ARRAY)).isEmpty());
    }

    @Test
    public void testNoTempVariableSwapInConstantContext() {
        Block block = t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "t"));
        assertTrue(scan(block, constantContext()).isEmpty());
    }

    @Test
    public void testOtherIdiomsStillReportedInConstantContext() {
        Block block = t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("a", "b"));
        assertEquals(1, scan(block, constantContext()).size());

        Block nearSwap = t.block(t.assign("a", "b"), t.assign("b", "a"));
        assertEquals(1, scan(nearSwap, constantContext()).size());
    }

    @Test
    public void testUnavailableOracleDegradesQuietly() {
        Block temp = t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "t"));
        assertTrue(scan(temp, unavailable()).isEmpty());

        Block xor = t.block(
                t.xorAssign(t.element("v", t.path("i")), t.element("v", t.path("j"))),
                t.xorAssign(t.element("v", t.path("j")), t.element("v", t.path("i"))),
                t.xorAssign(t.element("v", t.path("i")), t.element("v", t.path("j"))));
        assertTrue(scan(xor, unavailable()).isEmpty());

        Block xorOfLocals = t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("a", "b"));
        assertEquals(1, scan(xorOfLocals, unavailable()).size());
    }

    @Test
    public void testNearSwap() {
        Block block = t.block(t.assign("a", "b"), t.assign("b", "a"));

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(LintKind.ALMOST_SWAPPED, finding.kind());
        assertEquals("this looks like you are trying to swap `a` and `b`", finding.message());
        assertEquals("std::mem::swap(&mut a, &mut b)", finding.suggestion());
        assertEquals(NOTE, finding.note());
        assertEquals(Applicability.REVIEW_REQUIRED, finding.applicability());
    }

    @Test
    public void testNearSwapStartingWithDeclaration() {
        Block block = t.block(t.let("a", "b"), t.assign("b", "a"));

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        assertEquals("this looks like you are trying to swap `a` and `b`", findings.get(0).message());
        assertEquals(Applicability.REVIEW_REQUIRED, findings.get(0).applicability());
    }

    @Test
    public void testNearSwapSpanEndsAtSecondValue() {
        ExpressionStatement first = t.assign("a", "b");
        ExpressionStatement second = t.assign("b", "a");
        Assign secondAssign = (Assign) second.expression();

        Finding finding = scan(t.block(first, second)).get(0);

        assertEquals(first.span().start(), finding.span().start());
        assertEquals(secondAssign.value().span().end(), finding.span().end());
    }

    @Test
    public void testTwoNearSwapsInARow() {
        Block block = t.block(t.assign("a", "b"), t.assign("b", "a"), t.assign("c", "d"), t.assign("d", "c"));

        List<Finding> findings = scan(block);

        assertEquals(2, findings.size());
        assertEquals("this looks like you are trying to swap `a` and `b`", findings.get(0).message());
        assertEquals("this looks like you are trying to swap `c` and `d`", findings.get(1).message());
        assertTrue(findings.get(0).span().end() <= findings.get(1).span().start());
    }

    @Test
    public void testNearSwapAcrossSyntaxContextsIsIgnored() {
        PathReference a = t.path("a");
        PathReference b = t.path("b");
        Span expanded = new Span(a.span().start(), b.span().end(), new SyntaxContext("macro#1"));
        Statement first = new ExpressionStatement(new Assign(a, b, expanded), expanded);

        Block block = t.block(first, t.assign("b", "a"));

        assertTrue(scan(block).isEmpty());
    }

    @Test
    public void testNearSwapWithImpureOperandsIsIgnored() {
        Block block = t.block(
                t.assign(t.element("v", t.call("next", false)), t.path("b")),
                t.assign(t.path("b"), t.element("v", t.call("next", false))));
        assertTrue(scan(block).isEmpty());
    }

    @Test
    public void testXorSwap() {
        Block block = t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("a", "b"));

        List<Finding> findings = scan(block);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(LintKind.MANUAL_SWAP, finding.kind());
        assertEquals("this looks like you are swapping `a` and `b` manually", finding.message());
        assertEquals("std::mem::swap(&mut a, &mut b)", finding.suggestion());
        assertNull(finding.note());
        assertEquals(Applicability.AUTO_APPLICABLE, finding.applicability());
    }

    @Test
    public void testXorSwapOfElements() {
        Block block = t.block(
                t.xorAssign(t.element("v", t.path("i")), t.element("v", t.path("j"))),
                t.xorAssign(t.element("v", t.path("j")), t.element("v", t.path("i"))),
                t.xorAssign(t.element("v", t.path("i")), t.element("v", t.path("j"))));

        List<Finding> findings = scan(block, typedAs(ContainerKind.ARRAY));

        assertEquals(1, findings.size());
        assertEquals("v.swap(i, j)", findings.get(0).suggestion());
    }

    @Test
    public void testBrokenXorSequence() {
        assertTrue(scan(t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("b", "a"))).isEmpty());
        assertTrue(scan(t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.assign("a", "b"))).isEmpty());
        CompoundAssignment add = new CompoundAssignment(BinaryOperator.ADD, t.path("b"), t.path("a"), t.leafSpan());
        assertTrue(scan(t.block(t.xorAssign("a", "b"), add, t.xorAssign("a", "b"))).isEmpty());
    }

    @Test
    public void testDisabledLintIsNotReported() {
        BlockScanner scanner = scanner(LintLevels.of(Map.of(LintKind.MANUAL_SWAP, LintLevel.ALLOW)));
        Block block = t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "t"),
                t.assign("c", "d"), t.assign("d", "c"));

        List<Finding> findings = scanner.scan(block, TypeOracle.untyped(), SourceText.none());

        assertEquals(1, findings.size());
        assertEquals(LintKind.ALMOST_SWAPPED, findings.get(0).kind());
    }

    @Test
    public void testSnippetsArePreferredOverPrinting() {
        String source = "let tmp = (a);\na = b;\nb = tmp;";
        PathReference a = PathReference.local("a", Span.of(11, 12));
        Parenthesized parenA = new Parenthesized(a, Span.of(10, 13));
        Identifier tmp = new Identifier("tmp", Span.of(4, 7));
        Statement s0 = new LocalDeclaration(BindingPattern.of(tmp), parenA, Span.of(0, 14));
        PathReference a1 = PathReference.local("a", Span.of(15, 16));
        PathReference b1 = PathReference.local("b", Span.of(19, 20));
        Statement s1 = new ExpressionStatement(new Assign(a1, b1, Span.of(15, 20)), Span.of(15, 21));
        PathReference b2 = PathReference.local("b", Span.of(22, 23));
        PathReference tmp2 = PathReference.local("tmp", Span.of(26, 29));
        Statement s2 = new ExpressionStatement(new Assign(b2, tmp2, Span.of(22, 29)), Span.of(22, 30));
        Block block = new Block(List.of(s0, s1, s2), Span.of(0, 30), "Snippet#block");

        List<Finding> findings = scanner(LintLevels.defaults())
                .scan(block, TypeOracle.untyped(), SourceText.of(source));

        assertEquals(1, findings.size());
        assertEquals("std::mem::swap(&mut a, &mut b)", findings.get(0).suggestion());
        assertEquals(Span.of(0, 29), findings.get(0).span());
    }

    @Test
    public void testSinkReceivesFindingsInScanOrder() {
        Block block = t.block(t.assign("a", "b"), t.assign("b", "a"),
                t.xorAssign("x", "y"), t.xorAssign("y", "x"), t.xorAssign("x", "y"));
        List<Finding> received = new ArrayList<>();

        scanner(LintLevels.defaults()).scan(block, TypeOracle.untyped(), SourceText.none(), received::add);

        assertEquals(2, received.size());
        assertEquals(LintKind.ALMOST_SWAPPED, received.get(0).kind());
        assertEquals(LintKind.MANUAL_SWAP, received.get(1).kind());
    }
}
