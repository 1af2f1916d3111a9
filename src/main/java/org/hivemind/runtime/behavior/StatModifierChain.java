package org.hivemind.runtime.behavior;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.spi.IStatModifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the registered {@link IStatModifier}s to a base stat value in registration order.
 * <p>
 * A modifier that throws or yields a non-finite value is skipped: the value it received is
 * passed on unchanged and the failure is logged at WARN.
 */
public class StatModifierChain {

    private static final Logger LOG = LoggerFactory.getLogger(StatModifierChain.class);

    private final List<IStatModifier> modifiers = new CopyOnWriteArrayList<>();

    public void add(IStatModifier modifier) {
        modifiers.add(modifier);
    }

    public boolean remove(IStatModifier modifier) {
        return modifiers.remove(modifier);
    }

    public boolean isEmpty() {
        return modifiers.isEmpty();
    }

    /**
     * @param agent The agent whose stat is evaluated.
     * @param stat The stat name, see {@link IStatModifier}.
     * @param base The unmodified value.
     * @return The modified value.
     */
    public double apply(Agent agent, String stat, double base) {
        double value = base;
        for (IStatModifier modifier : modifiers) {
            try {
                double modified = modifier.modify(agent, stat, value);
                if (Double.isFinite(modified)) {
                    value = modified;
                } else {
                    LOG.warn("Stat modifier '{}' returned {} for '{}' of agent {}, keeping {}",
                            modifier.getClass().getSimpleName(), modified, stat, agent.getId(), value);
                }
            } catch (RuntimeException e) {
                LOG.warn("Stat modifier '{}' failed for '{}' of agent {}, keeping {}: {}",
                        modifier.getClass().getSimpleName(), stat, agent.getId(), value, e.getMessage());
            }
        }
        return value;
    }
}
