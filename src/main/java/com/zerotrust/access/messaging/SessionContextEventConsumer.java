package com.zerotrust.access.messaging;

import com.zerotrust.access.domain.ReevaluationResult;
import com.zerotrust.access.session.SessionContextUpdate;
import com.zerotrust.access.session.SessionMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Reevaluates a session for every context update received.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "zerotrust.kafka.consumer.enabled", havingValue = "true", matchIfMissing = true)
public class SessionContextEventConsumer {

    private final SessionMonitor sessionMonitor;

    @KafkaListener(
            topics = "${zerotrust.kafka.topic.session-context-updates:session-context-updates}",
            groupId = "${zerotrust.kafka.consumer-group:zero-trust-access-engine}",
            containerFactory = "sessionContextListenerContainerFactory"
    )
    public void onSessionContextEvent(
            @Payload(required = false) SessionContextEvent event,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (event == null || event.getSessionId() == null) {
            log.warn("Skipping session context event without session id, key={}, offset={}", key, offset);
            return;
        }
        try {
            ReevaluationResult result = sessionMonitor.reevaluate(event.getSessionId(), toUpdate(event));
            log.debug("Context event for sessionId={} gave state={} action={}",
                    event.getSessionId(), result.getState(), result.getAction());
        } catch (Exception e) {
            log.error("Reevaluation failed for sessionId={}, offset={}", event.getSessionId(), offset, e);
        }
    }

    static SessionContextUpdate toUpdate(SessionContextEvent event) {
        return SessionContextUpdate.builder()
                .ipAddress(event.getIpAddress())
                .userAgent(event.getUserAgent())
                .observedAt(event.getObservedAt())
                .accessCount(event.getAccessCount())
                .sensitiveResourceAccessCount(event.getSensitiveResourceAccessCount())
                .build();
    }
}
