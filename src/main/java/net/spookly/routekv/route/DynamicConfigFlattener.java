package net.spookly.routekv.route;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens nested configuration into key paths. Map keys and list indexes become path
 * segments; leaves become string values. Null leaves are dropped.
 */
public final class DynamicConfigFlattener {
    private DynamicConfigFlattener() {
    }

    public static Map<String, String> flatten(Map<String, ?> config, String prefix) {
        Map<String, String> result = new LinkedHashMap<>();
        flattenInto(result, prefix, config);
        return result;
    }

    private static void flattenInto(Map<String, String> result, String path, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                flattenInto(result, KeyCodec.join(path, String.valueOf(entry.getKey())), entry.getValue());
            }
            return;
        }
        if (value instanceof List) {
            List<?> items = (List<?>) value;
            for (int i = 0; i < items.size(); i++) {
                flattenInto(result, KeyCodec.join(path, Integer.toString(i)), items.get(i));
            }
            return;
        }
        result.put(path, String.valueOf(value));
    }
}
