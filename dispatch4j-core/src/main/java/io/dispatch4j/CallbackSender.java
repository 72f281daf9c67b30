package io.dispatch4j;

import io.dispatch4j.core.CallbackException;

/**
 * Delivers a payload to the downstream receiver.
 *
 * <p>Implementations must be safe for concurrent use: the one-shot scheduler and every cron
 * trigger call into the same sender.
 */
public interface CallbackSender {

    /**
     * Header carrying the shared secret, both on inbound requests and outbound callbacks.
     */
    String SECRET_HEADER = "Scheduler-Secret";

    /**
     * POST the payload to the configured endpoint.
     *
     * @param body raw request body; {@code null} sends an empty body
     * @throws CallbackException if the receiver did not answer 200 or could not be reached
     */
    void send(byte[] body) throws CallbackException;
}
