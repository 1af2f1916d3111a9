package org.hivemind.runtime.spi;

import java.util.Optional;

/**
 * Read-only view of an entity owned by the host's component store.
 * <p>
 * The engine never keeps references to entities across ticks; it holds ids and resolves them
 * through {@link IWorld} when needed.
 */
public interface IEntity {

    /**
     * @return The entity's stable id.
     */
    int getId();

    /**
     * Looks up a component attached to this entity.
     *
     * @param type The component class.
     * @param <T> The component type.
     * @return The component, or empty if the entity does not carry one.
     */
    <T> Optional<T> getComponent(Class<T> type);

    default boolean hasComponent(Class<?> type) {
        return getComponent(type).isPresent();
    }
}
