package com.dcruver.clausedrift.pipeline;

/**
 * Receives finished comparisons, e.g. for persistence or alert delivery.
 */
public interface ComparisonResultSink {

    void accept(ComparisonResult result) throws Exception;
}
