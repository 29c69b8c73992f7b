package com.capitalallocator.guardrail;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.model.CheckResult;

/**
 * One independent pre-trade risk check.
 *
 * <p>Implementations are pure functions of the context and report through {@link CheckResult}:
 * PASS, WARNING or CRITICAL plus structured findings. They never mutate state. An exception
 * escaping {@link #evaluate} is treated by {@link GuardrailEvaluator} as a CRITICAL outcome.
 */
public interface GuardrailCheck {

    GuardrailCheckType getType();

    CheckResult evaluate(GuardrailContext context);
}
