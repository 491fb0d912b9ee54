package com.swapanalysis.scan;

import com.swapanalysis.pojo.Finding;

/**
 * Receives findings as soon as they are produced. Implementations must not block.
 */
@FunctionalInterface
public interface FindingSink {

    void accept(Finding finding);
}
