package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import com.zerotrust.access.risk.history.AuthHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * First location ever seen for the user 20, previously seen 0, new but not first 35.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocationFactorEvaluator implements RiskFactorEvaluator {

    static final double KNOWN_LOCATION = 0.0;
    static final double FIRST_LOCATION = 20.0;
    static final double NEW_LOCATION = 35.0;

    private final AuthHistory authHistory;

    @Override
    public RiskFactorType type() {
        return RiskFactorType.LOCATION;
    }

    @Override
    public FactorEvaluation evaluate(AuthContext context) {
        Set<String> known;
        try {
            known = authHistory.knownLocations(context.getUserId());
        } catch (RuntimeException e) {
            log.warn("Location history lookup failed for user={}: {}", context.getUserId(), e.getMessage());
            return FactorEvaluation.failed(type(), "location history unavailable: " + e.getMessage());
        }
        String location = context.getLocationDisplay();
        if (known.isEmpty()) {
            return FactorEvaluation.ok(RiskFactor.of(type(), FIRST_LOCATION, "first location " + location));
        }
        if (known.contains(location)) {
            return FactorEvaluation.ok(RiskFactor.of(type(), KNOWN_LOCATION, "known location " + location));
        }
        return FactorEvaluation.ok(RiskFactor.of(type(), NEW_LOCATION, "new location " + location));
    }
}
