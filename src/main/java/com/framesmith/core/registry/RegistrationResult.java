package com.framesmith.core.registry;

import com.framesmith.core.model.ComponentDescriptor;

import java.util.Optional;

/**
 * Outcome of {@link ComponentRegistry#register}.
 *
 * @param descriptor the stored descriptor after the registration
 * @param created    true when the name was new
 * @param collision  set when the incoming content differed from the stored content
 */
public record RegistrationResult(
    ComponentDescriptor descriptor,
    boolean created,
    RegistryCollisionWarning collision
) {

    public Optional<RegistryCollisionWarning> collisionWarning() {
        return Optional.ofNullable(collision);
    }
}
