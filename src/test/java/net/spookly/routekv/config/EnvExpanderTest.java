package net.spookly.routekv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvExpanderTest {
    @Test
    void expandsEnvironmentValuesInNestedStructures() {
        Map<String, Object> raw = Map.of(
                "kv", Map.of("password", "env:ETCD_PASSWORD", "url", "http://etcd:2379"),
                "list", List.of("env:ETCD_PASSWORD", "plain")
        );

        Object expanded = EnvExpander.expand(raw, null, name -> "ETCD_PASSWORD".equals(name) ? "pw" : null);

        assertEquals(Map.of(
                "kv", Map.of("password", "pw", "url", "http://etcd:2379"),
                "list", List.of("pw", "plain")
        ), expanded);
    }

    @Test
    void missingEnvironmentVariableFails() {
        assertThrows(ConfigException.class, () -> EnvExpander.expand("env:NOPE", null, name -> null));
    }

    @Test
    void readsPathValuesRelativeToBaseDir(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("password"), "from-file\n", StandardCharsets.UTF_8);

        assertEquals("from-file", EnvExpander.expand("path:password", tempDir, name -> null));
        assertThrows(ConfigException.class, () -> EnvExpander.expand("path:missing", tempDir, name -> null));
    }
}
