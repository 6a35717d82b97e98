package org.relaysync.notifications;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTemplatesTest {

    private final MessageTemplates templates = new MessageTemplates();

    @Test
    @DisplayName("the DNS update message carries time, domain and both addresses")
    void dnsUpdated() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("time", "2024-05-01 08:00:00");
        data.put("domain", "relay.example.com");
        data.put("oldIp", "1.2.3.4");
        data.put("newIp", "5.6.7.8");

        String message = templates.render(MessageTemplates.DNS_UPDATED, data);

        assertThat(message).startsWith("<b>DNS record updated</b>")
                .contains("2024-05-01 08:00:00", "<code>relay.example.com</code>", "1.2.3.4", "5.6.7.8");
    }

    @Test
    void unknownTemplate() {
        assertThatThrownBy(() -> templates.render("missing.mustache", Map.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
