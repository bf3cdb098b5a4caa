package org.nexus.nexusmonitor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.springframework.stereotype.Service;

/**
 * Writes deliveries to the log. Mail and socket transports live outside this
 * service; swap this bean to wire them in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogNotificationService implements NotificationService {
    private final MonitoringProps props;
    private final ObjectMapper objectMapper;

    @Override
    public void sendEmail(String to, String subject, String text) {
        if (props.email() == null || !props.email().enabled()) {
            log.debug("[Notify] email disabled, dropping '{}'", subject);
            return;
        }
        log.info("[Notify] email to={} subject={}\n{}", to, subject, text);
    }

    @Override
    public void sendWebSocketMessage(String channel, Object payload) {
        if (props.websocket() == null || !props.websocket().enabled()) {
            log.debug("[Notify] websocket disabled, dropping message on {}", channel);
            return;
        }
        try {
            log.info("[Notify] ws channel={} payload={}", channel, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize payload for channel " + channel, e);
        }
    }
}
