package org.hivemind.test.utils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.hivemind.runtime.spi.IEntity;

/**
 * Mutable in-memory entity for tests.
 */
public class TestEntity implements IEntity {

    private final int id;
    private final Map<Class<?>, Object> components = new HashMap<>();

    public TestEntity(int id) {
        this.id = id;
    }

    public TestEntity with(Object component) {
        components.put(component.getClass(), component);
        return this;
    }

    public TestEntity without(Class<?> type) {
        components.remove(type);
        return this;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public <T> Optional<T> getComponent(Class<T> type) {
        return Optional.ofNullable(components.get(type)).map(type::cast);
    }

    @Override
    public String toString() {
        return "TestEntity[" + id + "]";
    }
}
