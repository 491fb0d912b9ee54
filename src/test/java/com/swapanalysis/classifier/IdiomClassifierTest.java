package com.swapanalysis.classifier;

import com.swapanalysis.SyntaxFixtures;
import com.swapanalysis.scan.ScanContext;
import com.swapanalysis.scan.Window;
import com.swapanalysis.semantics.AliasingAnalyzer;
import com.swapanalysis.semantics.ExpressionEquivalence;
import com.swapanalysis.semantics.TypeOracle;
import com.swapanalysis.suggestion.SourceText;
import com.swapanalysis.syntax.Block;
import com.swapanalysis.syntax.PathReference;
import com.swapanalysis.syntax.Statement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IdiomClassifierTest {

    private final SyntaxFixtures t = new SyntaxFixtures();

    private static ScanContext context(Block block, boolean constantContext) {
        ExpressionEquivalence equivalence = new ExpressionEquivalence();
        return new ScanContext(block, constantContext, TypeOracle.untyped(), SourceText.none(),
                equivalence, new AliasingAnalyzer(equivalence));
    }

    private static Window window(Block block) {
        return new Window(block.statements(), 0);
    }

    private static List<IdiomKind> matching(Block block, boolean constantContext) {
        List<IdiomKind> kinds = new ArrayList<>();
        new IdiomClassifier().getRegisteredPatterns().forEach((kind, pattern) -> {
            if (block.statements().size() < pattern.windowSize()) {
                return;
            }
            Window window = new Window(block.statements().subList(0, pattern.windowSize()), 0);
            if (pattern.match(window, context(block, constantContext)).isPresent()) {
                kinds.add(kind);
            }
        });
        return kinds;
    }

    @Test
    public void testRegisteredPatternsInScanOrder() {
        List<IdiomKind> kinds = List.copyOf(new IdiomClassifier().getRegisteredPatterns().keySet());
        assertEquals(List.of(IdiomKind.TEMP_VARIABLE_SWAP, IdiomKind.ALMOST_SWAPPED, IdiomKind.XOR_SWAP), kinds);
        new IdiomClassifier().getRegisteredPatterns()
                .forEach((kind, p) -> assertEquals(kind == IdiomKind.ALMOST_SWAPPED ? 2 : 3, p.windowSize()));
    }

    @Test
    public void testMatchTempVariableWindow() {
        Block block = t.block(t.let("t", "a"), t.assign("a", "b"), t.assign("b", "t"));
        assertEquals(List.of(IdiomKind.TEMP_VARIABLE_SWAP), matching(block, false));
        assertEquals(List.of(), matching(block, true));
    }

    @Test
    public void testMatchNearSwapWindow() {
        Block block = t.block(t.assign("a", "b"), t.assign("b", "a"));
        assertEquals(List.of(IdiomKind.ALMOST_SWAPPED), matching(block, false));
    }

    @Test
    public void testMatchXorWindow() {
        Block block = t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("a", "b"));
        assertEquals(List.of(IdiomKind.XOR_SWAP), matching(block, false));
    }

    @Test
    public void testMatchCarriesSwappedPlaces() {
        Block block = t.block(t.xorAssign("a", "b"), t.xorAssign("b", "a"), t.xorAssign("a", "b"));
        IdiomClassifier.IdiomPattern xor = new IdiomClassifier().getRegisteredPatterns().get(IdiomKind.XOR_SWAP);

        SwapMatch match = xor.match(window(block), context(block, false)).orElseThrow();

        List<Statement> statements = block.statements();
        assertEquals(IdiomKind.XOR_SWAP, match.idiom());
        assertEquals("a", ((PathReference) match.first()).text());
        assertEquals("b", ((PathReference) match.second()).text());
        assertEquals(statements.get(0).span().start(), match.span().start());
        assertEquals(statements.get(2).span().end(), match.span().end());
    }

    @Test
    public void testUnrelatedStatements() {
        Block block = t.block(t.other(), t.other(), t.other());
        assertTrue(matching(block, false).isEmpty());
    }
}
