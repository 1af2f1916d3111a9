package org.hivemind.runtime.behavior;

import java.util.function.BiPredicate;

import org.hivemind.runtime.model.AgentState;
import org.hivemind.runtime.model.component.AiComponent;

/**
 * One row of the transition table.
 *
 * @param from The state the rule applies to.
 * @param to The state entered when the rule fires.
 * @param priority Higher priorities win over lower ones firing in the same evaluation.
 * @param condition Decides whether the rule fires.
 */
public record StateTransition(
    AgentState from,
    AgentState to,
    int priority,
    BiPredicate<AiContext, AiComponent> condition
) {
}
