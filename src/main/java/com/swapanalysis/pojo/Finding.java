package com.swapanalysis.pojo;

import com.swapanalysis.syntax.Span;

import java.util.List;
import java.util.Optional;

/**
 * A detected swap idiom together with the rewrite proposed for it.
 */
public record Finding(
        LintKind kind,
        String message,
        Span span,
        String help,
        List<Edit> edits,
        String note,
        Applicability applicability
) {

    public Finding {
        edits = List.copyOf(edits);
    }

    public Optional<String> noteText() {
        return Optional.ofNullable(note);
    }

    /** Replacement text of the first edit, which covers the whole finding. */
    public String suggestion() {
        return edits.isEmpty() ? "" : edits.get(0).replacement();
    }
}
