package com.framesmith.core.registry;

import com.framesmith.core.model.ComponentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job-scoped catalogue of deduplicated components, keyed by normalized name.
 * <p>
 * Screen workers share one instance, so every operation runs under a single lock. The first registration
 * of a name fixes its content; later registrations only merge variants and screen usage.
 */
public class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ComponentDescriptor> entries = new LinkedHashMap<>();
    private final List<RegistryCollisionWarning> collisions = new ArrayList<>();

    /**
     * Registers a descriptor that no screen produced, such as a seeded component.
     */
    public RegistrationResult register(ComponentDescriptor descriptor) {
        return register(descriptor, null);
    }

    /**
     * Adds the descriptor, or merges its variants and screen usage into the stored one.
     * Registering the same descriptor again never duplicates stored content.
     *
     * @param screenId screen that produced the descriptor; recorded as a usage and named in any collision
     *                 warning. May be null.
     */
    public RegistrationResult register(ComponentDescriptor incoming, String screenId) {
        ComponentDescriptor descriptor = incoming;
        if (screenId != null && !incoming.screensUsed().contains(screenId)) {
            var used = new LinkedHashSet<>(incoming.screensUsed());
            used.add(screenId);
            descriptor = incoming.withUsage(incoming.variants(), used);
        }
        String key = ComponentNames.normalize(descriptor.name());
        lock.lock();
        try {
            ComponentDescriptor existing = entries.get(key);
            if (existing == null) {
                var stored = new ComponentDescriptor(key, displayName(descriptor), descriptor.filePath(),
                        descriptor.designTokens(), descriptor.variants(), descriptor.screensUsed(),
                        descriptor.dependencies(), descriptor.apiEndpoints(), descriptor.generatedAt());
                entries.put(key, stored);
                log.debug("Registered component {} -> {}", key, stored.filePath());
                return new RegistrationResult(stored, true, null);
            }

            var variants = new LinkedHashSet<>(existing.variants());
            variants.addAll(descriptor.variants());
            var screens = new LinkedHashSet<>(existing.screensUsed());
            screens.addAll(descriptor.screensUsed());
            ComponentDescriptor merged = existing.withUsage(variants, screens);
            entries.put(key, merged);

            RegistryCollisionWarning collision = null;
            if (!existing.sameContentAs(descriptor)) {
                collision = new RegistryCollisionWarning(existing.displayName(), screenId == null ? "(none)" : screenId,
                        existing.filePath(), descriptor.filePath());
                collisions.add(collision);
                log.warn(collision.message());
            }
            return new RegistrationResult(merged, false, collision);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ComponentDescriptor> resolve(String name) {
        String key = ComponentNames.normalize(name);
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a usage edge from a screen to an existing component.
     *
     * @return the updated descriptor, or empty if no component has that name
     */
    public Optional<ComponentDescriptor> recordUsage(String name, String screenId) {
        String key = ComponentNames.normalize(name);
        lock.lock();
        try {
            ComponentDescriptor existing = entries.get(key);
            if (existing == null) {
                return Optional.empty();
            }
            var screens = new LinkedHashSet<>(existing.screensUsed());
            screens.add(screenId);
            ComponentDescriptor updated = existing.withUsage(existing.variants(), screens);
            entries.put(key, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    /** Display names of every registered component, in registration order. */
    public List<String> knownNames() {
        lock.lock();
        try {
            return entries.values().stream().map(ComponentDescriptor::displayName).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<ComponentDescriptor> descriptors() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.unlock();
        }
    }

    public List<RegistryCollisionWarning> collisions() {
        lock.lock();
        try {
            return List.copyOf(collisions);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private static String displayName(ComponentDescriptor descriptor) {
        String display = descriptor.displayName() != null ? descriptor.displayName() : descriptor.name();
        return display.trim();
    }
}
