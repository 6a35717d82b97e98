package org.relaysync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("a missing file falls back to the bundled config.xml")
    void bundledDefaults() {
        XmlConfiguration cfg = ConfigLoader.loadConfig(dir.resolve("absent.xml").toString());

        assertThat(cfg.server.port).isEqualTo(5000);
        assertThat(cfg.server.basePath).isEqualTo("/api");
        assertThat(cfg.scheduler.defaultTimezone).isEqualTo("Asia/Shanghai");
        assertThat(cfg.telegram.retryAttempts).isEqualTo(2);
        assertThat(cfg.cloudflare.apiUrl).isEqualTo("https://api.cloudflare.com/client/v4");
    }

    @Test
    @DisplayName("sections present in the file override, absent ones keep their defaults")
    void partialFile() throws Exception {
        // given
        Path file = dir.resolve("config.xml");
        Files.writeString(file, "<configuration>"
                + "<server><port>8080</port><basePath>/admin</basePath></server>"
                + "<scheduler><poolSize>3</poolSize><defaultTimezone>UTC</defaultTimezone></scheduler>"
                + "</configuration>", StandardCharsets.UTF_8);

        // when
        XmlConfiguration cfg = ConfigLoader.loadConfig(file.toString());

        // then
        assertThat(cfg.server.port).isEqualTo(8080);
        assertThat(cfg.server.basePath).isEqualTo("/admin");
        assertThat(cfg.scheduler.poolSize).isEqualTo(3);
        assertThat(cfg.store.path).isEqualTo("config.json");
        assertThat(cfg.http.timeoutSeconds).isEqualTo(30);
        assertThat(cfg.jwtConfig.accessTokenTtlMinutes).isEqualTo(30);
    }

    @Test
    @DisplayName("out of range values are refused at startup")
    void invalidValues() throws Exception {
        Path file = dir.resolve("config.xml");
        Files.writeString(file, "<configuration><http><timeoutSeconds>90</timeoutSeconds></http></configuration>",
                StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ConfigLoader.loadConfig(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("timeoutSeconds");
    }

    @Test
    @DisplayName("documents with a DOCTYPE are rejected")
    void noDoctype() throws Exception {
        Path file = dir.resolve("config.xml");
        Files.writeString(file, "<?xml version=\"1.0\"?><!DOCTYPE configuration [<!ENTITY x \"y\">]>"
                + "<configuration/>", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ConfigLoader.loadConfig(file.toString())).isInstanceOf(IllegalStateException.class);
    }
}
