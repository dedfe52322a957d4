package org.operaton.nostrpub.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for reading loosely typed ActivityStreams JSON parsed into maps.
 * Properties may be a string, an object or an array of either.
 */
public final class ActivityJson {

    public static final String PUBLIC = "https://www.w3.org/ns/activitystreams#Public";

    private static final Set<String> PUBLIC_ADDRESSES = Set.of(PUBLIC, "Public", "as:Public");

    private ActivityJson() {
    }

    /**
     * String property, or null if absent or not a string.
     */
    public static String string(Map<String, Object> object, String key) {
        Object value = object == null ? null : object.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Id of a property that is either an inline object or a link.
     */
    public static String idOf(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Map) {
            Object id = ((Map<?, ?>) value).get("id");
            if (id instanceof String) {
                return (String) id;
            }
            Object href = ((Map<?, ?>) value).get("href");
            return href instanceof String ? (String) href : null;
        }
        return null;
    }

    public static List<Object> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        return List.of(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * Objects of a property, skipping plain links.
     */
    public static List<Map<String, Object>> objects(Map<String, Object> object, String key) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : asList(object == null ? null : object.get(key))) {
            Map<String, Object> map = asMap(item);
            if (map != null) {
                result.add(map);
            }
        }
        return result;
    }

    /**
     * Whether {@code to} or {@code cc} address the public collection.
     */
    public static boolean isPublic(Map<String, Object> object) {
        List<Object> audience = new ArrayList<>(asList(object.get("to")));
        audience.addAll(asList(object.get("cc")));
        return audience.stream()
            .map(ActivityJson::idOf)
            .filter(Objects::nonNull)
            .anyMatch(PUBLIC_ADDRESSES::contains);
    }

    public static String stripFragment(String uri) {
        int hash = uri.indexOf('#');
        return hash < 0 ? uri : uri.substring(0, hash);
    }

    /**
     * Host of a URI, or null if it has none.
     */
    public static String host(String uri) {
        try {
            return URI.create(uri).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
