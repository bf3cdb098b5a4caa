package org.nexus.nexusmonitor.service;

/**
 * Outbound delivery used by the alert engine. Implementations may throw;
 * callers treat every delivery as best-effort.
 */
public interface NotificationService {

    void sendEmail(String to, String subject, String text);

    void sendWebSocketMessage(String channel, Object payload);
}
