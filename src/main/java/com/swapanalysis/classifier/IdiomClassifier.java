package com.swapanalysis.classifier;

import com.swapanalysis.classifier.patterns.AlmostSwappedPattern;
import com.swapanalysis.classifier.patterns.TempVariableSwapPattern;
import com.swapanalysis.classifier.patterns.XorSwapPattern;
import com.swapanalysis.scan.ScanContext;
import com.swapanalysis.scan.Window;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

@Service
public class IdiomClassifier {

    public interface IdiomPattern {

        /** Structural and semantic match of one window; never throws. */
        Optional<SwapMatch> match(Window window, ScanContext context);

        int windowSize();
    }

    private static final Map<IdiomKind, IdiomPattern> PATTERNS;

    static {
        // EnumMap keeps the scan order stable: temp variable, near swap, xor
        Map<IdiomKind, IdiomPattern> patterns = new EnumMap<>(IdiomKind.class);
        patterns.put(IdiomKind.TEMP_VARIABLE_SWAP, new TempVariableSwapPattern());
        patterns.put(IdiomKind.ALMOST_SWAPPED, new AlmostSwappedPattern());
        patterns.put(IdiomKind.XOR_SWAP, new XorSwapPattern());
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    public Map<IdiomKind, IdiomPattern> getRegisteredPatterns() {
        return PATTERNS;
    }
}
