package com.zerotrust.access.threat;

import com.zerotrust.access.domain.ThreatAssessment;
import lombok.Value;

@Value
public class SessionEnrichment {
    String sessionId;
    double originalScore;
    double adjustment;
    double enrichedScore;
    ThreatAssessment threat;
    String recommendation;
}
