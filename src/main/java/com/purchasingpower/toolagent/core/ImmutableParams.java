package com.purchasingpower.toolagent.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep, read-only copies of request parameters.
 *
 * <p>Maps, lists and sets are copied at every nesting level so a caller that
 * keeps a reference to its own collections cannot change a request after its
 * cache key was derived. Other values are shared as-is. Null values are kept.
 *
 * @since 1.0.0
 */
public final class ImmutableParams {

    private ImmutableParams() {
    }

    public static Map<String, Object> copyOf(Map<String, Object> params) {
        if (params == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        params.forEach((key, value) -> copy.put(key, copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(copyElements(list, new ArrayList<>()));
        }
        if (value instanceof Set<?> set) {
            return Collections.unmodifiableSet(copyElements(set, new LinkedHashSet<>()));
        }
        return value;
    }

    private static <C extends Collection<Object>> C copyElements(Collection<?> source, C target) {
        for (Object element : source) {
            target.add(copyValue(element));
        }
        return target;
    }
}
