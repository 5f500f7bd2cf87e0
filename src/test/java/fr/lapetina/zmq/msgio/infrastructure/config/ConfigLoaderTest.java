package fr.lapetina.zmq.msgio.infrastructure.config;

import fr.lapetina.zmq.msgio.pool.PoolOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should provide defaults")
        void shouldProvideDefaults() {
            MsgIoConfig config = ConfigLoader.createDefault();

            assertThat(config.getPool().getReadQueueCapacity()).isEqualTo(10);
            assertThat(config.getPool().getWriteQueueCapacity()).isEqualTo(10);
            assertThat(config.getPool().getPollIntervalMs()).isEqualTo(20);
            assertThat(config.getPool().getWritePolicy()).isEqualTo("load-balance");
            assertThat(config.getBroadcast().isEvictFailedConnections()).isTrue();
            assertThat(config.getRetry().getMaxAttempts()).isZero();
            assertThat(config.getMetrics().getPrefix()).isEqualTo("zmq_msgio");
        }

        @Test
        @DisplayName("should load from the classpath")
        void shouldLoadFromClasspath() {
            MsgIoConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getPool().getReadQueueCapacity()).isEqualTo(4);
            assertThat(config.getPool().getWriteQueueCapacity()).isEqualTo(8);
            assertThat(config.getPool().getWritePolicy()).isEqualTo("broadcast");
            assertThat(config.getBroadcast().isEvictFailedConnections()).isFalse();
            assertThat(config.getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(config.getRetry().getEvictionThreshold()).isEqualTo(2);
            assertThat(config.getRetry().getBackoffMs()).isEqualTo(10);
            assertThat(config.getMetrics().isEnabled()).isFalse();
        }

        @Test
        @DisplayName("should load from the file system first")
        void shouldLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("msgio.yaml");
            Files.writeString(file, "pool:\n  readQueueCapacity: 32\n");

            MsgIoConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getPool().getReadQueueCapacity()).isEqualTo(32);
            assertThat(config.getPool().getWriteQueueCapacity()).isEqualTo(10);
        }

        @Test
        @DisplayName("should keep defaults for sections missing from the stream")
        void shouldKeepDefaultsForMissingSections() {
            MsgIoConfig config = new ConfigLoader("unused.yaml")
                    .loadFromStream(yaml("retry:\n  maxAttempts: 5\n"));

            assertThat(config.getRetry().getMaxAttempts()).isEqualTo(5);
            assertThat(config.getPool().getWritePolicy()).isEqualTo("load-balance");
        }

        @Test
        @DisplayName("should return defaults for an empty document")
        void shouldReturnDefaultsForEmptyDocument() {
            MsgIoConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

            assertThat(config.getPool().getReadQueueCapacity()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("should fail on a missing file")
        void shouldFailOnMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }

        @Test
        @DisplayName("should fail on an unknown property")
        void shouldFailOnUnknownProperty() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("pool:\n  bogus: 1\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Pool options")
    class Options {

        @Test
        @DisplayName("should map configuration to pool options")
        void shouldMapToPoolOptions() {
            MsgIoConfig config = new ConfigLoader("test-config.yaml").load();

            PoolOptions options = PoolOptions.builder().fromConfig(config).build();

            assertThat(options.getReadQueueCapacity()).isEqualTo(4);
            assertThat(options.getWriteQueueCapacity()).isEqualTo(8);
            assertThat(options.getPollInterval()).isEqualTo(Duration.ofMillis(5));
            assertThat(options.getCloseTimeout()).isEqualTo(Duration.ofSeconds(1));
            assertThat(options.isEvictFailedConnections()).isFalse();
            assertThat(options.getRetryPolicy().getMaxAttempts()).isEqualTo(3);
            assertThat(options.getRetryPolicy().getEvictionThreshold()).isEqualTo(2);
            assertThat(options.getRetryPolicy().getBackoff()).isEqualTo(Duration.ofMillis(10));
        }

        @Test
        @DisplayName("should reject a non-positive queue capacity")
        void shouldRejectInvalidCapacity() {
            MsgIoConfig config = ConfigLoader.createDefault();
            config.getPool().setReadQueueCapacity(0);

            assertThatThrownBy(() -> PoolOptions.builder().fromConfig(config))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
