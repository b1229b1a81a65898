package net.spookly.routekv.kv;

import net.spookly.routekv.config.ConfigException;
import net.spookly.routekv.config.RouteKvConfig;

/**
 * Selects the {@link KvClient} implementation named by {@code kv.backend}.
 */
public final class KvClients {
    private KvClients() {
    }

    public static KvClient fromConfig(RouteKvConfig config) {
        if (config == null || config.kv == null || config.kv.backend == null) {
            throw new ConfigException("kv.backend is required");
        }
        String backend = config.kv.backend.trim();
        if ("etcd".equalsIgnoreCase(backend)) {
            return EtcdClientFactory.create(config.kv);
        }
        if ("memory".equalsIgnoreCase(backend)) {
            return new InMemoryKvClient();
        }
        throw new ConfigException("Unsupported kv.backend: " + backend);
    }
}
