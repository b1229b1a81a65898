package net.spookly.routekv.config;

public class RouteKvConfig {
    public KvConfig kv;
    public TraefikConfig traefik;
    public JupyterhubConfig jupyterhub;
    public StoreConfig store;
    public LoggingConfig logging;

    public static class KvConfig {
        /**
         * Backend implementation: etcd or memory.
         */
        public String backend;
        public String url;
        public String username;
        public String password;
        public String caCert;
        public String clientCert;
        public String clientKey;
    }

    public static class TraefikConfig {
        public String prefix;
    }

    public static class JupyterhubConfig {
        public String prefix;
    }

    public static class StoreConfig {
        public String sharedTargetPolicy;
    }

    public static class LoggingConfig {
        public String level;
    }
}
