package com.swapanalysis.syntax;

public record OtherStatement(String kind, Span span) implements Statement {
}
