package org.hivemind.runtime.behavior.tree;

import org.hivemind.runtime.behavior.AiContext;
import org.hivemind.runtime.model.Agent;

/**
 * A node of a behavior tree. Composite, decorator, condition and action nodes are created
 * through {@link BehaviorTrees}.
 * <p>
 * Trees run after the state machine on every update of their agent. An exception thrown by
 * any node aborts the tree for that agent and update only.
 */
@FunctionalInterface
public interface BehaviorNode {

    /**
     * @param agent The agent the tree belongs to.
     * @param context The context the state machine evaluated this update.
     * @return {@code true} on success.
     */
    boolean execute(Agent agent, AiContext context);
}
