package net.spookly.routekv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("routekv-config");
        Path configPath = tempDir.resolve("routekv.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("backend: etcd"));
        assertTrue(content.contains("prefix: traefik"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void generatedDefaultLoadsOnSecondRun() throws IOException {
        Path tempDir = Files.createTempDirectory("routekv-config");
        Path configPath = tempDir.resolve("routekv.yaml");
        assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        RouteKvConfig config = ConfigLoader.load(configPath);

        assertEquals("etcd", config.kv.backend);
        assertEquals(ConfigDefaults.DEFAULT_KV_URL, config.kv.url);
        assertEquals("jupyterhub", config.jupyterhub.prefix);
        assertEquals("unconditional", config.store.sharedTargetPolicy);
    }

    @Test
    void expandsPathSecretsAndResolvesTlsFiles() throws IOException {
        Path tempDir = Files.createTempDirectory("routekv-config");
        Path configPath = tempDir.resolve("routekv.yaml");
        Path secretPath = tempDir.resolve("secret").resolve("etcd_password");
        Files.createDirectories(secretPath.getParent());
        Files.writeString(secretPath, "s3cret\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, String.join("\n",
                "kv:",
                "  backend: etcd",
                "  url: https://etcd.internal:2379",
                "  username: hub",
                "  password: path:secret/etcd_password",
                "  caCert: certs/ca.crt",
                "  clientCert: certs/client.crt",
                "  clientKey: certs/client.key",
                ""
        ), StandardCharsets.UTF_8);

        RouteKvConfig config = ConfigLoader.load(configPath);

        assertEquals("s3cret", config.kv.password);
        assertEquals(tempDir.resolve("certs").resolve("ca.crt").toString(), config.kv.caCert);
        assertEquals(tempDir.resolve("certs").resolve("client.key").toString(), config.kv.clientKey);
        assertEquals("traefik", config.traefik.prefix);
    }

    @Test
    void rejectsUnknownKeys() throws IOException {
        Path tempDir = Files.createTempDirectory("routekv-config");
        Path configPath = tempDir.resolve("routekv.yaml");
        Files.writeString(configPath, "kv:\n  backend: memory\n  colour: blue\n", StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsEmptyFile() throws IOException {
        Path tempDir = Files.createTempDirectory("routekv-config");
        Path configPath = tempDir.resolve("routekv.yaml");
        Files.writeString(configPath, "", StandardCharsets.UTF_8);

        assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));
    }
}
