package com.zerotrust.access.session;

import com.zerotrust.access.domain.ReevaluationAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reevaluates sessions whose next reevaluation time has passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "zerotrust.session.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReevaluationScheduler {

    private final SessionMonitor sessionMonitor;

    @Scheduled(fixedDelayString = "${zerotrust.session.scheduler.sweep-interval-ms:60000}",
            initialDelayString = "${zerotrust.session.scheduler.initial-delay-ms:30000}")
    public void sweepDueSessions() {
        BatchReevaluationReport report = sessionMonitor.reevaluateDue();
        if (report.getRequested() > 0) {
            log.info("Due-session sweep: requested={}, completed={}, failed={}, revoked={}",
                    report.getRequested(), report.getCompleted(), report.getFailed(),
                    report.count(ReevaluationAction.REVOKE));
        }
    }
}
