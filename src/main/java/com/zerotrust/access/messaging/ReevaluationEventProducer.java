package com.zerotrust.access.messaging;

import com.zerotrust.access.domain.ReevaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes reevaluation outcomes, keyed by session id, for the session-lifecycle
 * service (which revokes or challenges the live session) and for dashboards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReevaluationEventProducer {

    private final KafkaTemplate<String, ReevaluationResult> reevaluationKafkaTemplate;

    @Value("${zerotrust.kafka.topic.session-reevaluations:session-reevaluations}")
    private String topic;

    public void send(ReevaluationResult result) {
        try {
            CompletableFuture<SendResult<String, ReevaluationResult>> future =
                    reevaluationKafkaTemplate.send(topic, result.getSessionId(), result);
            future.whenComplete((sent, ex) -> {
                if (ex != null) log.error("Failed to publish reevaluation for sessionId={}", result.getSessionId(), ex);
                else log.debug("Published reevaluation sessionId={} action={} partition={}", result.getSessionId(),
                        result.getAction(), sent != null ? sent.getRecordMetadata().partition() : null);
            });
        } catch (RuntimeException e) {
            log.error("Could not hand reevaluation for sessionId={} to Kafka: {}", result.getSessionId(), e.getMessage());
        }
    }
}
