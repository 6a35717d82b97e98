package org.relaysync.notifications.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import org.relaysync.client.ClientException;
import org.relaysync.client.ClientException.FailureKind;
import org.relaysync.client.HttpJsonClient;
import org.relaysync.config.XmlConfiguration;
import org.relaysync.notifications.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends notifications via Telegram bot.
 * <p>
 * All attempts of one message share a single budget equal to the HTTP timeout, so retries never
 * stretch the notification step past the bound of one network call.
 */
public class TelegramSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(TelegramSender.class);

    // an attempt with less time than this left is not started
    private static final Duration MIN_ATTEMPT = Duration.ofSeconds(1);

    private final XmlConfiguration.Telegram config;
    private final HttpJsonClient http;

    public TelegramSender(XmlConfiguration.Telegram config, HttpJsonClient http) {
        this.config = config;
        this.http = http;
        logger.info("[TelegramSender initialized, api={}, attempts={}]", config.apiUrl, Math.max(1, config.retryAttempts));
    }

    @Override
    public void send(String token, String target, String message) throws ClientException {
        String botToken = token == null ? "" : token.trim();
        String chatId = target == null ? "" : target.trim();
        if (botToken.isEmpty() || chatId.isEmpty()) {
            throw new ClientException(FailureKind.MALFORMED, "Telegram bot token or chat id is empty");
        }

        int maxAttempts = Math.max(1, config.retryAttempts);
        long deadline = System.nanoTime() + http.getDefaultTimeout().toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                sendMessage(botToken, chatId, message, remaining(deadline));
                logger.info("Telegram message sent to {} (attempt {})", chatId, attempts);
                return;
            } catch (ClientException e) {
                boolean transientFailure = e.getKind() == FailureKind.TIMEOUT || e.getKind() == FailureKind.UNREACHABLE;
                Duration left = remaining(deadline).minusMillis(Math.max(0, config.retryDelayMillis));
                if (!transientFailure || attempts >= maxAttempts || left.compareTo(MIN_ATTEMPT) < 0) {
                    logger.error("Telegram message could not be sent to {} after {} attempts: {}", chatId, attempts, e.getMessage());
                    throw e;
                }
                logger.warn("Telegram send attempt {} failed to {}: {}", attempts, chatId, e.getMessage());
                pause();
            }
        }
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
    }

    private void sendMessage(String botToken, String chatId, String text, Duration timeout) throws ClientException {
        URI uri;
        try {
            uri = URI.create(String.format("%s/bot%s/sendMessage", config.apiUrl, botToken));
        } catch (IllegalArgumentException e) {
            throw new ClientException(FailureKind.MALFORMED, "Telegram bot token is not URL safe", e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", config.parseMode);

        JsonNode json = http.post(uri, Map.of(), payload, timeout);
        if (!json.path("ok").asBoolean(false)) {
            throw new ClientException(FailureKind.MALFORMED,
                    "Telegram refused the message: " + json.path("description").asText(json.toString()));
        }
    }

    private void pause() throws ClientException {
        try {
            Thread.sleep(Math.max(0, config.retryDelayMillis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException(FailureKind.UNREACHABLE, "Interrupted while waiting to retry Telegram send", e);
        }
    }
}
