package com.swapanalysis.pojo;

import com.swapanalysis.syntax.Span;

/**
 * Replace the text covered by {@code span} with {@code replacement}.
 */
public record Edit(Span span, String replacement) {
}
