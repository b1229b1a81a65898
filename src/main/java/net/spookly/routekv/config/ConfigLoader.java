package net.spookly.routekv.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private static final String DEFAULT_BACKEND = "etcd";

    private ConfigLoader() {
    }

    /**
     * Load, default and validate the routekv YAML configuration.
     */
    public static RouteKvConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = yaml.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        Object expanded = EnvExpander.expand(raw, path.getParent());
        RouteKvConfig config;
        try {
            config = MAPPER.convertValue(expanded, RouteKvConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        applyDefaults(config);
        ConfigPathResolver.resolve(config, path.getParent());
        ConfigValidator.validate(config);
        return config;
    }

    /**
     * Fill unset optional values. Exposed for callers that build a config in code.
     */
    public static RouteKvConfig applyDefaults(RouteKvConfig config) {
        if (config.kv == null) {
            config.kv = new RouteKvConfig.KvConfig();
        }
        if (isBlank(config.kv.backend)) {
            config.kv.backend = DEFAULT_BACKEND;
        }
        if (isBlank(config.kv.url)) {
            config.kv.url = ConfigDefaults.DEFAULT_KV_URL;
        }
        if (config.traefik == null) {
            config.traefik = new RouteKvConfig.TraefikConfig();
        }
        if (isBlank(config.traefik.prefix)) {
            config.traefik.prefix = ConfigDefaults.DEFAULT_TRAEFIK_PREFIX;
        }
        if (config.jupyterhub == null) {
            config.jupyterhub = new RouteKvConfig.JupyterhubConfig();
        }
        if (isBlank(config.jupyterhub.prefix)) {
            config.jupyterhub.prefix = ConfigDefaults.DEFAULT_JUPYTERHUB_PREFIX;
        }
        if (config.store == null) {
            config.store = new RouteKvConfig.StoreConfig();
        }
        if (isBlank(config.store.sharedTargetPolicy)) {
            config.store.sharedTargetPolicy = "unconditional";
        }
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(DEFAULT_BACKEND),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
