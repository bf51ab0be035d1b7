package com.zerotrust.access.threat;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * AbuseIPDB v2 {@code /check} client. Without an API key no request is made and
 * the report is marked not configured.
 */
@Slf4j
@Component
public class AbuseIpDbReputationClient implements ReputationClient {

    static final String CIRCUIT_BREAKER = "reputation";
    static final String SOURCE = "abuseipdb";
    static final int MAX_AGE_DAYS = 90;

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String baseUrl;
    private final String apiKey;

    public AbuseIpDbReputationClient(CircuitBreakerRegistry circuitBreakerRegistry,
                                     @Value("${zerotrust.reputation.url:https://api.abuseipdb.com/api/v2}") String baseUrl,
                                     @Value("${zerotrust.reputation.api-key:}") String apiKey,
                                     @Value("${zerotrust.reputation.timeout-ms:5000}") int timeoutMs) {
        this(buildRestTemplate(timeoutMs), circuitBreakerRegistry, baseUrl, apiKey);
    }

    AbuseIpDbReputationClient(RestTemplate restTemplate, CircuitBreakerRegistry circuitBreakerRegistry,
                              String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public ReputationReport check(String ipAddress) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Reputation API key not configured, ip={} not checked externally", ipAddress);
            return ReputationReport.notConfigured(ipAddress);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("Key", apiKey);
        try {
            ResponseEntity<Map> response = circuitBreaker.executeSupplier(() -> restTemplate.exchange(
                    baseUrl + "/check?ipAddress={ip}&maxAgeInDays={days}",
                    HttpMethod.GET, new HttpEntity<>(headers), Map.class, ipAddress, MAX_AGE_DAYS));
            Object data = response.getBody() != null ? response.getBody().get("data") : null;
            if (!(data instanceof Map)) {
                log.warn("Reputation response for ip={} had no data block", ipAddress);
                return ReputationReport.unavailable(ipAddress);
            }
            return toReport(ipAddress, (Map<?, ?>) data);
        } catch (CallNotPermittedException e) {
            log.warn("Reputation circuit open, ip={} scored 0", ipAddress);
            return ReputationReport.unavailable(ipAddress);
        } catch (RestClientException e) {
            log.warn("Reputation lookup failed for ip={}: {}", ipAddress, e.getMessage());
            return ReputationReport.unavailable(ipAddress);
        } catch (Exception e) {
            log.error("Unexpected error checking reputation for ip={}", ipAddress, e);
            return ReputationReport.unavailable(ipAddress);
        }
    }

    private static ReputationReport toReport(String ipAddress, Map<?, ?> data) {
        return ReputationReport.builder()
                .ipAddress(ipAddress)
                .abuseConfidenceScore(clampScore(asInt(data.get("abuseConfidenceScore"))))
                .totalReports(Math.max(0, asInt(data.get("totalReports"))))
                .countryCode(data.get("countryCode") != null ? data.get("countryCode").toString() : null)
                .isp(data.get("isp") != null ? data.get("isp").toString() : null)
                .whitelisted(Boolean.TRUE.equals(data.get("isWhitelisted")))
                .source(SOURCE)
                .build();
    }

    private static int asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    private static int clampScore(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
