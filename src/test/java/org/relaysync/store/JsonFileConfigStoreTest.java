package org.relaysync.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.relaysync.model.ConfigSnapshot;
import org.relaysync.model.Job;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileConfigStoreTest {

    @TempDir
    Path dir;

    private static Job job(String username) {
        Job job = new Job();
        job.setUsername(username);
        job.setProviderHost("https://panel.example");
        return job;
    }

    @Nested
    @DisplayName("Bootstrap")
    class Bootstrap {

        @Test
        @DisplayName("a missing file is created with generated admin credentials and no jobs")
        void createsFile() {
            JsonFileConfigStore store = new JsonFileConfigStore(dir.resolve("config.json"), "Asia/Shanghai");

            assertThat(store.initializeIfMissing()).isTrue();

            ConfigSnapshot snapshot = store.getSnapshot();
            assertThat(snapshot.auth().username()).hasSize(12);
            assertThat(snapshot.auth().password()).hasSize(22);
            assertThat(snapshot.timezone()).isEqualTo("Asia/Shanghai");
            assertThat(snapshot.jobs()).isEmpty();
            assertThat(store.initializeIfMissing()).isFalse();
        }

        @Test
        @DisplayName("without a file reads return an empty snapshot")
        void emptyWithoutFile() {
            JsonFileConfigStore store = new JsonFileConfigStore(dir.resolve("missing.json"), "UTC");

            assertThat(store.getSnapshot().jobs()).isEmpty();
            assertThat(store.findJob("1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Reads and writes")
    class ReadWrite {

        @Test
        @DisplayName("jobs round-trip through the file in snake_case")
        void persists() throws Exception {
            // given
            Path file = dir.resolve("config.json");
            JsonFileConfigStore store = new JsonFileConfigStore(file, "UTC");
            store.initializeIfMissing();

            // when
            store.update(s -> {
                Job job = job("alice");
                job.setLastRun(OffsetDateTime.parse("2024-05-01T08:00:00+08:00"));
                s.jobs().put("1", job);
                return s;
            });

            // then
            String json = Files.readString(file, StandardCharsets.UTF_8);
            assertThat(json).contains("\"provider_host\"", "\"interval_minutes\"", "\"last_run\"");
            Job read = new JsonFileConfigStore(file, "UTC").findJob("1").orElseThrow();
            assertThat(read.getUsername()).isEqualTo("alice");
            assertThat(read.getLastRun().toInstant()).isEqualTo(OffsetDateTime.parse("2024-05-01T00:00:00Z").toInstant());
        }

        @Test
        @DisplayName("legacy field names are still understood")
        void legacyNames() throws Exception {
            Path file = dir.resolve("config.json");
            Files.writeString(file, "{\"auth\":{\"username\":\"a\",\"password\":\"b\"},\"timezone\":\"UTC\","
                    + "\"jobs\":{\"1\":{\"username\":\"u\",\"nya_host\":\"https://p.example\",\"cf_token\":\"t\","
                    + "\"telegram_bot_token\":\"bot\",\"telegram_chat_id\":\"9\",\"unknown\":1}}}");

            Job job = new JsonFileConfigStore(file, "UTC").findJob("1").orElseThrow();

            assertThat(job.getProviderHost()).isEqualTo("https://p.example");
            assertThat(job.getDnsToken()).isEqualTo("t");
            assertThat(job.getNotifierToken()).isEqualTo("bot");
            assertThat(job.getNotifierTarget()).isEqualTo("9");
        }

        @Test
        @DisplayName("a run log stored as one joined string is read as lines and written back as a list")
        void legacyJoinedLog() throws Exception {
            // given
            Path file = dir.resolve("config.json");
            Files.writeString(file, "{\"auth\":{\"username\":\"a\",\"password\":\"b\"},\"timezone\":\"Asia/Shanghai\","
                    + "\"jobs\":{\"1\":{\"username\":\"u\",\"nya_host\":\"https://p.example\","
                    + "\"last_log\":\"[2024-01-01 00:00:00] login ok\\n[2024-01-01 00:00:01] 3 rules\\n\","
                    + "\"last_run\":\"2024-01-01T00:00:01.123456+08:00\"}}}");
            JsonFileConfigStore store = new JsonFileConfigStore(file, "UTC");

            // when
            Job job = store.findJob("1").orElseThrow();
            boolean updated = store.updateJob("1", j -> {
                j.setIntervalMinutes(20);
                return j;
            });

            // then
            assertThat(job.getLastLog()).containsExactly("[2024-01-01 00:00:00] login ok", "[2024-01-01 00:00:01] 3 rules");
            assertThat(job.getLastRun().getOffset().getTotalSeconds()).isEqualTo(8 * 3600);
            assertThat(updated).isTrue();
            assertThat(store.getSnapshot().timezone()).isEqualTo("Asia/Shanghai");
            assertThat(Files.readString(file)).contains("\"last_log\" : [");
        }

        @Test
        @DisplayName("a run log that is neither text nor a list makes the file unreadable")
        void rejectsOddLog() throws Exception {
            Path file = dir.resolve("config.json");
            Files.writeString(file, "{\"jobs\":{\"1\":{\"username\":\"u\",\"last_log\":{\"a\":1}}}}");

            assertThatThrownBy(() -> new JsonFileConfigStore(file, "UTC").getSnapshot())
                    .isInstanceOf(ConfigStoreException.class);
        }

        @Test
        @DisplayName("updateJob on an unknown id writes nothing")
        void unknownJob() {
            JsonFileConfigStore store = new JsonFileConfigStore(dir.resolve("config.json"), "UTC");
            store.initializeIfMissing();

            assertThat(store.updateJob("nope", j -> j)).isFalse();
        }

        @Test
        @DisplayName("snapshots are copies")
        void copies() {
            JsonFileConfigStore store = new JsonFileConfigStore(dir.resolve("config.json"), "UTC");
            store.update(s -> {
                s.jobs().put("1", job("alice"));
                return s;
            });

            store.getSnapshot().jobs().get("1").setUsername("mallory");

            assertThat(store.findJob("1").orElseThrow().getUsername()).isEqualTo("alice");
        }

        @Test
        @DisplayName("a corrupt file surfaces as ConfigStoreException")
        void corruptFile() throws Exception {
            Path file = dir.resolve("config.json");
            Files.writeString(file, "{not json");

            assertThatThrownBy(() -> new JsonFileConfigStore(file, "UTC").getSnapshot())
                    .isInstanceOf(ConfigStoreException.class);
        }

        @Test
        @DisplayName("a failed mutation leaves the file untouched")
        void failedMutation() throws Exception {
            Path file = dir.resolve("config.json");
            JsonFileConfigStore store = new JsonFileConfigStore(file, "UTC");
            store.initializeIfMissing();
            String before = Files.readString(file);

            assertThatThrownBy(() -> store.update(s -> {
                throw new IllegalStateException("rejected");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(Files.readString(file)).isEqualTo(before);
            try (Stream<Path> files = Files.list(dir)) {
                assertThat(files).containsExactly(file);
            }
        }
    }

    @Test
    @DisplayName("concurrent keyed updates to different jobs are all kept")
    void concurrentUpdates() throws Exception {
        // given
        JsonFileConfigStore store = new JsonFileConfigStore(dir.resolve("config.json"), "UTC");
        store.update(s -> {
            s.jobs().put("a", job("a"));
            s.jobs().put("b", job("b"));
            return s;
        });
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        // when
        for (String id : List.of("a", "b")) {
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                for (int i = 0; i < 20; i++) {
                    store.updateJob(id, j -> {
                        j.setIntervalMinutes(j.getIntervalMinutes() + 1);
                        return j;
                    });
                }
            });
            threads.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : threads) {
            t.join();
        }

        // then
        assertThat(store.findJob("a").orElseThrow().getIntervalMinutes()).isEqualTo(35);
        assertThat(store.findJob("b").orElseThrow().getIntervalMinutes()).isEqualTo(35);
    }
}
