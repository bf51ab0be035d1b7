package com.zerotrust.access.threat;

import com.zerotrust.access.domain.ThreatAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Threat assessments per IP with a fixed time to live. Expired entries are
 * removed when read; there is no background sweep.
 */
@Slf4j
@Component
public class IpReputationCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public IpReputationCache(Clock clock, @Value("${zerotrust.reputation.cache-ttl:PT1H}") Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<ThreatAssessment> get(String ipAddress) {
        if (ipAddress == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(ipAddress);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            // only drop the entry we saw; a fresh put may have replaced it
            entries.remove(ipAddress, entry);
            log.debug("Reputation cache entry expired for ip={}", ipAddress);
            return Optional.empty();
        }
        return Optional.of(entry.assessment);
    }

    public void put(String ipAddress, ThreatAssessment assessment) {
        if (ipAddress == null) {
            return;
        }
        entries.put(ipAddress, new Entry(assessment, clock.instant().plus(ttl)));
    }

    public void invalidate(String ipAddress) {
        if (ipAddress != null) {
            entries.remove(ipAddress);
        }
    }

    public int size() {
        return entries.size();
    }

    private record Entry(ThreatAssessment assessment, Instant expiresAt) {
    }
}
