package org.relaysync.notifications;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MessageTemplates
 *
 * Renders notification bodies from classpath templates under {@code templates/}.
 * Templates are compiled once and cached by key.
 */
public class MessageTemplates {

    private static final Logger logger = LoggerFactory.getLogger(MessageTemplates.class);

    public static final String DNS_UPDATED = "dns-updated.mustache";

    private final MustacheFactory factory = new DefaultMustacheFactory();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    public String render(String key, Map<String, Object> data) {
        Mustache mustache = compiled.computeIfAbsent(key, this::compile);
        StringWriter writer = new StringWriter();
        try {
            mustache.execute(writer, data).flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed rendering template " + key, e);
        }
        return writer.toString().trim();
    }

    private Mustache compile(String key) {
        String path = "templates/" + key;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Template not found on classpath: " + path);
            }
            String template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.info("[MessageTemplates] Loaded classpath template key={}", key);
            return factory.compile(new StringReader(template), key);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading template " + path, e);
        }
    }
}
