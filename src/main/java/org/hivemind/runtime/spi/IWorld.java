package org.hivemind.runtime.spi;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entity lookup provided by the host simulation.
 */
public interface IWorld {

    /**
     * Resolves an entity id.
     *
     * @param id The entity id.
     * @return The entity, or empty if it no longer exists.
     */
    Optional<IEntity> getEntity(int id);

    /**
     * Returns every entity that carries all of the given component types.
     *
     * @param componentTypes The required component classes.
     * @return The matching entities, possibly empty. Never {@code null}.
     */
    List<IEntity> getEntitiesWithComponents(Set<Class<?>> componentTypes);
}
