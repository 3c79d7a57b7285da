package com.findstaffing.api.notify;

/**
 * Outbound email. Callers treat every failure as non-fatal.
 */
public interface NotificationDispatcher {

    /**
     * Sends the message and returns the provider's message id.
     *
     * @throws NotificationException when the message could not be handed off
     */
    String send(EmailMessage message);

    class NotificationException extends RuntimeException {
        public NotificationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
