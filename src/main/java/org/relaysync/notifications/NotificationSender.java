package org.relaysync.notifications;

import org.relaysync.client.ClientException;

public interface NotificationSender {
    /**
     * @param token    channel credential (bot token)
     * @param target   destination on that channel (chat id)
     * @param message  message body, already rendered
     * @throws ClientException when the message could not be delivered
     */
    void send(String token, String target, String message) throws ClientException;
}
