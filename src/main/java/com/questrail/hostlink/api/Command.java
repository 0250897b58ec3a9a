package com.questrail.hostlink.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully decoded control command.
 *
 * <p>Created by a listener once one complete wire message has been decoded and
 * discarded after the serializer has executed it. Parameters are an immutable
 * snapshot of the decoded JSON object; values are whatever Jackson produced for
 * the corresponding JSON value ({@code String}, {@code Number}, {@code Boolean},
 * {@code List}, {@code Map} or {@code null}). Nested lists and maps are copied
 * and frozen too, at any depth.</p>
 *
 * @param name        command name (the wire {@code type} member)
 * @param params      command parameters, never {@code null}
 * @param transport   transport the command arrived on
 * @param correlation optional opaque request id, echoed back on the reliable transport
 */
public record Command(
    String name,
    Map<String, Object> params,
    Transport transport,
    Optional<Object> correlation
) {
    public Command {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(correlation, "correlation");
        params = params == null ? Map.of() : freezeMap(params);
    }

    public static Command of(String name, Map<String, Object> params, Transport transport) {
        return new Command(name, params, transport, Optional.empty());
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
