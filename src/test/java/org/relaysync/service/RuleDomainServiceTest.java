package org.relaysync.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.relaysync.model.Job;
import org.relaysync.store.InMemoryConfigStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleDomainServiceTest {

    private InMemoryConfigStore store;
    private RuleDomainService service;

    @BeforeEach
    void setUp() {
        Job job = new Job();
        job.setUsername("u");
        store = new InMemoryConfigStore().put("100", job);
        service = new RuleDomainService(store);
    }

    @Test
    @DisplayName("set stores the list in order and get returns it")
    void setAndGet() {
        List<String> saved = service.set("100", "7", List.of("b.example.com", "a.example.org"));

        assertThat(saved).containsExactly("b.example.com", "a.example.org");
        assertThat(service.get("100", "7")).containsExactly("b.example.com", "a.example.org");
        assertThat(service.get("100", "8")).isEmpty();
    }

    @Test
    @DisplayName("invalid entries are all reported and nothing is written")
    void reportsInvalid() {
        List<Object> input = Arrays.asList("ok.example.com", "-bad.example.com", 42, null, "nodot");

        assertThatThrownBy(() -> service.set("100", "7", input))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getInvalid())
                        .containsExactly("-bad.example.com", 42, null, "nodot"));
        assertThat(service.get("100", "7")).isEmpty();
    }

    @Test
    @DisplayName("more than 500 domains are rejected")
    void tooMany() {
        List<String> domains = new ArrayList<>();
        for (int i = 0; i <= RuleDomainService.MAX_DOMAINS; i++) {
            domains.add("d" + i + ".example.com");
        }

        assertThatThrownBy(() -> service.set("100", "7", domains)).isInstanceOf(ValidationException.class);
        assertThat(service.set("100", "7", domains.subList(0, RuleDomainService.MAX_DOMAINS))).hasSize(500);
    }

    @Test
    @DisplayName("clear removes only the named rule")
    void clear() {
        service.set("100", "7", List.of("a.example.com"));
        service.set("100", "8", List.of("b.example.com"));

        service.clear("100", "7");

        assertThat(store.findJob("100").orElseThrow().getRuleDomains()).containsOnlyKeys("8");
    }

    @Test
    @DisplayName("unknown jobs are not found")
    void unknownJob() {
        assertThatThrownBy(() -> service.get("404", "7")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.set("404", "7", List.of())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.clear("404", "7")).isInstanceOf(JobNotFoundException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "a.b.example.co.uk", "x_y.example.io", "1.example.net"})
    void validDomains(String domain) {
        assertThat(RuleDomainService.isValidDomain(domain)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "localhost", "example.c", "-bad.example.com", "a..b", "http://example.com"})
    void invalidDomains(String domain) {
        assertThat(RuleDomainService.isValidDomain(domain)).isFalse();
    }
}
