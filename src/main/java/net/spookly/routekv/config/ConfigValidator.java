package net.spookly.routekv.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(RouteKvConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateKv(config, errors);
        validatePrefixes(config, errors);
        validateStore(config, errors);
        validateLogging(config, errors);

        throwIfErrors(errors);
    }

    private static void validateKv(RouteKvConfig config, List<String> errors) {
        RouteKvConfig.KvConfig kv = config.kv;
        if (kv == null) {
            errors.add("kv section is required");
            return;
        }
        requireNonBlank(errors, kv.backend, "kv.backend");
        if (!isBlank(kv.backend) && !isOneOf(kv.backend, "etcd", "memory")) {
            errors.add("kv.backend must be one of: etcd, memory");
        }
        if (isOneOf(kv.backend, "etcd")) {
            validateUrl(errors, kv.url, "kv.url");
        }
        if (isBlank(kv.clientCert) != isBlank(kv.clientKey)) {
            errors.add("kv.clientCert and kv.clientKey must be set together");
        }
        if (!isBlank(kv.password) && isBlank(kv.username)) {
            errors.add("kv.username is required when kv.password is set");
        }
    }

    private static void validatePrefixes(RouteKvConfig config, List<String> errors) {
        if (config.traefik == null) {
            errors.add("traefik section is required");
        } else {
            requirePrefix(errors, config.traefik.prefix, "traefik.prefix");
        }
        if (config.jupyterhub == null) {
            errors.add("jupyterhub section is required");
        } else {
            requirePrefix(errors, config.jupyterhub.prefix, "jupyterhub.prefix");
        }
        if (config.traefik != null && config.jupyterhub != null
                && !isBlank(config.traefik.prefix)
                && config.traefik.prefix.equals(config.jupyterhub.prefix)) {
            errors.add("traefik.prefix and jupyterhub.prefix must differ");
        }
    }

    private static void validateStore(RouteKvConfig config, List<String> errors) {
        RouteKvConfig.StoreConfig store = config.store;
        if (store == null || isBlank(store.sharedTargetPolicy)) {
            return;
        }
        if (!isOneOf(store.sharedTargetPolicy, "unconditional", "reference-counted")) {
            errors.add("store.sharedTargetPolicy must be one of: unconditional, reference-counted");
        }
    }

    private static void validateLogging(RouteKvConfig config, List<String> errors) {
        RouteKvConfig.LoggingConfig logging = config.logging;
        if (logging == null || isBlank(logging.level)) {
            return;
        }
        if (!isOneOf(logging.level, "trace", "debug", "info", "warn", "error")) {
            errors.add("logging.level must be one of: trace, debug, info, warn, error");
        }
    }

    private static void validateUrl(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            URI uri = new URI(value.trim());
            if (!isOneOf(uri.getScheme(), "http", "https")) {
                errors.add(field + " must use http or https");
            }
            if (isBlank(uri.getHost())) {
                errors.add(field + " must include a host");
            }
            if (uri.getPort() < 1 || uri.getPort() > 65535) {
                errors.add(field + " must include a port between 1 and 65535");
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URL: " + value);
        }
    }

    private static void requirePrefix(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        if (value.endsWith("/")) {
            errors.add(field + " must not end with '/'");
        }
        if (!value.equals(value.trim())) {
            errors.add(field + " must not contain leading or trailing whitespace");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
