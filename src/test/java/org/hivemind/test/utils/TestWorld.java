package org.hivemind.test.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.hivemind.runtime.spi.IEntity;
import org.hivemind.runtime.spi.IWorld;

/**
 * Insertion-ordered entity store for tests.
 */
public class TestWorld implements IWorld {

    private final Map<Integer, TestEntity> entities = new LinkedHashMap<>();

    public TestEntity add(TestEntity entity) {
        entities.put(entity.getId(), entity);
        return entity;
    }

    public void remove(int id) {
        entities.remove(id);
    }

    @Override
    public Optional<IEntity> getEntity(int id) {
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<IEntity> getEntitiesWithComponents(Set<Class<?>> componentTypes) {
        List<IEntity> result = new ArrayList<>();
        for (TestEntity entity : entities.values()) {
            if (componentTypes.stream().allMatch(entity::hasComponent)) {
                result.add(entity);
            }
        }
        return result;
    }
}
