/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.routing;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit message type to route table used by the default publish overload.
 * Types are looked up by exact class; nothing is inferred for unregistered types.
 */
public final class MessageRouteRegistry {

    private final Map<Class<?>, MessageRoute> routes = new ConcurrentHashMap<>();

    public MessageRouteRegistry register(Class<?> type, MessageRoute route) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (route == null) throw new IllegalArgumentException("route must not be null");
        routes.put(type, route);
        return this;
    }

    /** Register {@code type} under the conventional route for {@code typeName}. */
    public MessageRouteRegistry registerConventional(Class<?> type, String typeName) {
        return register(type, MessageRoute.conventional(typeName));
    }

    /** Register {@code type} under the conventional route for its simple class name. */
    public MessageRouteRegistry registerConventional(Class<?> type) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        return registerConventional(type, type.getSimpleName());
    }

    public Optional<MessageRoute> find(Class<?> type) {
        return Optional.ofNullable(routes.get(type));
    }

    public MessageRoute routeFor(Class<?> type) {
        return find(type).orElseThrow(() ->
                new IllegalArgumentException("No route registered for message type " + type.getName()));
    }

    public int size() { return routes.size(); }
}
