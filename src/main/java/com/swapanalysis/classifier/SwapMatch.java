package com.swapanalysis.classifier;

import com.swapanalysis.syntax.Expression;
import com.swapanalysis.syntax.Span;

/**
 * A window that has the shape of a swap idiom, with the two places it exchanges.
 */
public record SwapMatch(IdiomKind idiom, Expression first, Expression second, Span span) {
}
