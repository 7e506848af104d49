package com.bank.governance.engine;

import java.util.Optional;

/**
 * One stage of the scanning pipeline. Layers run in ascending {@link #getOrder()} and the first
 * detection short-circuits the rest.
 */
public interface DetectionLayer {

    /**
     * Short layer name used in results, metrics and span names.
     */
    String getName();

    int getOrder();

    /**
     * Inspect the text against one pattern snapshot.
     *
     * @param text     non-blank input, already length-checked
     * @param snapshot the snapshot taken when the scan started
     * @return a detection, or empty if this layer found nothing
     */
    Optional<Detection> detect(String text, PatternSnapshot snapshot);
}
