package net.spookly.routekv.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String DEFAULT_KV_URL = "http://127.0.0.1:2379";
    public static final String DEFAULT_TRAEFIK_PREFIX = "traefik";
    public static final String DEFAULT_JUPYTERHUB_PREFIX = "jupyterhub";

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default routekv config.
            kv:
              backend: %s
              url: %s
              # username: routekv
              # password: env:ROUTEKV_KV_PASSWORD
              # caCert: certs/etcd-ca.crt
              # clientCert: certs/etcd-client.crt
              # clientKey: certs/etcd-client.key

            traefik:
              prefix: %s

            jupyterhub:
              prefix: %s

            store:
              sharedTargetPolicy: unconditional

            logging:
              level: info
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template for the given backend.
     */
    public static String defaultYaml(String backend) {
        if (backend == null || backend.isBlank()) {
            throw new ConfigException("Backend is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(
                backend,
                DEFAULT_KV_URL,
                DEFAULT_TRAEFIK_PREFIX,
                DEFAULT_JUPYTERHUB_PREFIX
        );
    }
}
