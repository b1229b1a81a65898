package net.spookly.routekv.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, insecure file permissions).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(RouteKvConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Path baseDir = configPath == null ? null : configPath.getParent();
        RouteKvConfig.KvConfig kv = config.kv;
        if (kv == null) {
            return warnings;
        }
        warnIfWorldReadable(warnings, "kv.clientKey", kv.clientKey, baseDir);
        if (kv.url != null && kv.url.startsWith("http://") && kv.password != null && !kv.password.isBlank()) {
            warnings.add("kv.password is sent over a plaintext connection: " + kv.url);
        }
        if ("memory".equalsIgnoreCase(kv.backend)) {
            warnings.add("kv.backend is memory; routes are not shared with other processes");
        }
        return warnings;
    }

    private static void warnIfWorldReadable(List<String> warnings, String label, String value, Path baseDir) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        Path resolved = resolvePath(baseDir, value.trim());
        if (resolved == null || !Files.isRegularFile(resolved)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add(label + " is world-readable: " + resolved);
            }
        } catch (IOException e) {
            warnings.add(label + " permissions could not be read: " + e.getMessage());
        }
    }

    private static Path resolvePath(Path baseDir, String rawValue) {
        try {
            Path path = Paths.get(rawValue);
            if (baseDir != null && !path.isAbsolute()) {
                return baseDir.resolve(path).normalize();
            }
            return path;
        } catch (RuntimeException e) {
            return null;
        }
    }
}
