package com.platform.governance.policy;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves named thresholds (e.g. {@code drift.accuracyDropHigh}) for one evaluation.
 */
@FunctionalInterface
public interface ThresholdLookup {
    
    ThresholdLookup NONE = name -> Optional.empty();
    
    Optional<BigDecimal> resolve(String name);
}
