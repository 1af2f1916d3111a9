package org.hivemind.runtime.behavior.tree;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

import org.hivemind.runtime.behavior.AiContext;
import org.hivemind.runtime.model.Agent;

/**
 * Factories for behavior tree nodes.
 */
public final class BehaviorTrees {

    private BehaviorTrees() {
    }

    /**
     * Runs children in order until one fails.
     *
     * @return Success if every child succeeded; an empty sequence succeeds.
     */
    public static BehaviorNode sequence(BehaviorNode... children) {
        List<BehaviorNode> nodes = List.of(children);
        return (agent, context) -> {
            for (BehaviorNode child : nodes) {
                if (!child.execute(agent, context)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Runs children in order until one succeeds.
     *
     * @return Success if any child succeeded; an empty selector fails.
     */
    public static BehaviorNode selector(BehaviorNode... children) {
        List<BehaviorNode> nodes = List.of(children);
        return (agent, context) -> {
            for (BehaviorNode child : nodes) {
                if (child.execute(agent, context)) {
                    return true;
                }
            }
            return false;
        };
    }

    /**
     * Runs every child.
     *
     * @return Success if more than half of the children succeeded; an empty parallel succeeds.
     */
    public static BehaviorNode parallel(BehaviorNode... children) {
        List<BehaviorNode> nodes = List.of(children);
        return (agent, context) -> {
            if (nodes.isEmpty()) {
                return true;
            }
            int successes = 0;
            for (BehaviorNode child : nodes) {
                if (child.execute(agent, context)) {
                    successes++;
                }
            }
            return successes * 2 > nodes.size();
        };
    }

    public static BehaviorNode invert(BehaviorNode child) {
        return (agent, context) -> !child.execute(agent, context);
    }

    /** Runs the child and succeeds regardless of its result. */
    public static BehaviorNode succeed(BehaviorNode child) {
        return (agent, context) -> {
            child.execute(agent, context);
            return true;
        };
    }

    /** Runs the child and fails regardless of its result. */
    public static BehaviorNode fail(BehaviorNode child) {
        return (agent, context) -> {
            child.execute(agent, context);
            return false;
        };
    }

    /**
     * Runs the child {@code times} times (at least once) and succeeds.
     */
    public static BehaviorNode repeat(BehaviorNode child, int times) {
        int runs = Math.max(1, times);
        return (agent, context) -> {
            for (int i = 0; i < runs; i++) {
                child.execute(agent, context);
            }
            return true;
        };
    }

    public static BehaviorNode condition(Predicate<AiContext> predicate) {
        return (agent, context) -> predicate.test(context);
    }

    public static BehaviorNode action(BiPredicate<Agent, AiContext> action) {
        return action::test;
    }
}
