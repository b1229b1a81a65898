package net.spookly.routekv.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative TLS file settings against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(RouteKvConfig config, Path baseDir) {
        if (config == null || baseDir == null || config.kv == null) {
            return;
        }
        RouteKvConfig.KvConfig kv = config.kv;
        kv.caCert = resolvePath(baseDir, kv.caCert);
        kv.clientCert = resolvePath(baseDir, kv.clientCert);
        kv.clientKey = resolvePath(baseDir, kv.clientKey);
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
