package com.expecta.analyzer;

import java.util.List;

import com.expecta.analyzer.engine.AnalysisException;

/** Host hook that receives fatal parse errors instead of having them thrown. */
@FunctionalInterface
public interface AnalysisErrorHandler {
    void onError(AnalysisException error, List<String> words);
}
