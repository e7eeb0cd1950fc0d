package com.acme.resilience.policy;

import java.util.Map;

/** The outbound call to a policy engine. */
@FunctionalInterface
public interface PolicyEvaluator {
  PolicyDecision evaluate(Map<String, Object> input) throws Exception;
}
