package com.architecture.memory.flowgraph.service.graph.analyzer;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts build-time gaps of one analysis unit: AST types the extractors did not handle
 * and identifier names that resolved to no binding.
 *
 * An Expression with no DerivesFrom edges is treated as terminal by the validator, so these
 * counters are the only place where an extractor gap stays visible.
 */
@Slf4j
public class ExtractorCoverage {

    private final Map<String, Integer> unhandledTypes = new TreeMap<>();
    private final Map<String, Integer> unresolvedIdentifiers = new TreeMap<>();

    public void recordUnhandled(String astType) {
        unhandledTypes.merge(astType, 1, Integer::sum);
        log.debug("[coverage] Unhandled AST type {}", astType);
    }

    public void recordUnresolved(String name) {
        unresolvedIdentifiers.merge(name, 1, Integer::sum);
        log.debug("[coverage] Unresolved identifier {}", name);
    }

    public Map<String, Integer> getUnhandledTypes() {
        return Collections.unmodifiableMap(unhandledTypes);
    }

    public Map<String, Integer> getUnresolvedIdentifiers() {
        return Collections.unmodifiableMap(unresolvedIdentifiers);
    }

    public boolean isComplete() {
        return unhandledTypes.isEmpty() && unresolvedIdentifiers.isEmpty();
    }

    public void mergeFrom(Map<String, Integer> unhandled, Map<String, Integer> unresolved) {
        unhandled.forEach((type, count) -> unhandledTypes.merge(type, count, Integer::sum));
        unresolved.forEach((name, count) -> unresolvedIdentifiers.merge(name, count, Integer::sum));
    }

    @Override
    public String toString() {
        return "unhandled=" + unhandledTypes + ", unresolved=" + unresolvedIdentifiers;
    }
}
