package com.swapanalysis.syntax;

public record Identifier(String name, Span span) {
}
