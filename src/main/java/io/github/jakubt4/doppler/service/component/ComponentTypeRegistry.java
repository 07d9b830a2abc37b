package io.github.jakubt4.doppler.service.component;

import io.github.jakubt4.doppler.exception.ValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Table of component shapes known to the fitter, keyed by type name.
 */
public class ComponentTypeRegistry {

    private final Map<String, ComponentType> types = new LinkedHashMap<>();

    /**
     * Registry holding {@code Constant}, {@code Lorentz} and {@code Harvey}.
     */
    public static ComponentTypeRegistry standard() {
        final var registry = new ComponentTypeRegistry();
        for (final var type : StandardComponentType.values()) {
            registry.register(type);
        }
        return registry;
    }

    /**
     * @throws ValidationException if a type with the same name is already registered
     */
    public synchronized ComponentTypeRegistry register(final ComponentType type) {
        if (types.putIfAbsent(type.typeName(), type) != null) {
            throw new ValidationException("Component type [" + type.typeName() + "] is already registered");
        }
        return this;
    }

    public synchronized Optional<ComponentType> find(final String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    /**
     * @throws ValidationException if no type of that name is registered
     */
    public synchronized ComponentType resolve(final String typeName) {
        return find(typeName).orElseThrow(() -> new ValidationException(
                "Unknown component type [" + typeName + "], known: " + types.keySet()));
    }

    public synchronized Collection<ComponentType> types() {
        return Collections.unmodifiableCollection(types.values());
    }
}
