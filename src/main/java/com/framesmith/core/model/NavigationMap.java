package com.framesmith.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Route-to-screen mapping, ordered by screen ordinal.
 */
public record NavigationMap(List<RouteEntry> routes) implements Serializable {

    public NavigationMap {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public static NavigationMap empty() {
        return new NavigationMap(List.of());
    }

    public Optional<RouteEntry> route(String screenId) {
        return routes.stream().filter(r -> r.screenId().equals(screenId)).findFirst();
    }

    public List<String> slugs() {
        return routes.stream().map(RouteEntry::slug).toList();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }
}
