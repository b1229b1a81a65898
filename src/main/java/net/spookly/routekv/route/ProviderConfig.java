package net.spookly.routekv.route;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import net.spookly.routekv.config.RouteKvConfig;
import net.spookly.routekv.kv.EtcdClientFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Traefik static configuration that points Traefik's etcd provider at our store.
 */
public final class ProviderConfig {
    private ProviderConfig() {
    }

    public static Map<String, Object> etcd(RouteKvConfig config) {
        Map<String, Object> etcd = new LinkedHashMap<>();
        etcd.put("endpoints", List.of(EtcdClientFactory.hostAndPort(config.kv.url)));
        etcd.put("rootKey", config.traefik.prefix);
        if (hasText(config.kv.username) && hasText(config.kv.password)) {
            etcd.put("username", config.kv.username);
            etcd.put("password", config.kv.password);
        }
        Map<String, Object> providers = new LinkedHashMap<>();
        providers.put("etcd", etcd);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("providers", providers);
        return root;
    }

    public static String toYaml(Map<String, Object> staticConfig) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(staticConfig);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
