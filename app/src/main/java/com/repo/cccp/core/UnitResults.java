package com.repo.cccp.core;

import com.repo.cccp.metrics.UnsupportedConstructException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of analyzing one file: the units that could be scored and, keyed by
 * unit id, the ones that could not.
 */
public record UnitResults(List<UnitScores> scores, Map<String, UnsupportedConstructException> failures) {

    public UnitResults {
        scores = List.copyOf(scores);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
