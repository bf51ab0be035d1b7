package com.zerotrust.access.risk.geo;

import com.zerotrust.access.domain.GeoLocation;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves public IPs through an ip-api.com compatible JSON endpoint. Private and
 * loopback addresses never leave the process. Any failure, timeout or open circuit
 * resolves to {@link GeoLocation#UNKNOWN}.
 */
@Slf4j
@Service
public class IpApiGeoLocationService implements GeoLocationService {

    static final String CIRCUIT_BREAKER = "geolocation";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String baseUrl;

    public IpApiGeoLocationService(CircuitBreakerRegistry circuitBreakerRegistry,
                                   @Value("${zerotrust.geolocation.url:http://ip-api.com/json}") String baseUrl,
                                   @Value("${zerotrust.geolocation.timeout-ms:2000}") int timeoutMs) {
        this(buildRestTemplate(timeoutMs), circuitBreakerRegistry, baseUrl);
    }

    IpApiGeoLocationService(RestTemplate restTemplate, CircuitBreakerRegistry circuitBreakerRegistry, String baseUrl) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        this.baseUrl = baseUrl;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public GeoLocation locate(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return GeoLocation.UNKNOWN;
        }
        Optional<GeoLocation> local = PrivateNetworks.localLocation(ipAddress);
        if (local.isPresent()) {
            return local.get();
        }
        try {
            Map<?, ?> body = circuitBreaker.executeSupplier(() -> restTemplate.getForObject(
                    baseUrl + "/{ip}?fields=status,message,countryCode,city,lat,lon", Map.class, ipAddress));
            return toLocation(ipAddress, body);
        } catch (CallNotPermittedException e) {
            log.warn("Geolocation circuit open, ip={} resolved as Unknown", ipAddress);
            return GeoLocation.UNKNOWN;
        } catch (RestClientException e) {
            log.warn("Geolocation lookup failed for ip={}: {}", ipAddress, e.getMessage());
            return GeoLocation.UNKNOWN;
        } catch (Exception e) {
            log.error("Unexpected error resolving location for ip={}", ipAddress, e);
            return GeoLocation.UNKNOWN;
        }
    }

    private GeoLocation toLocation(String ipAddress, Map<?, ?> body) {
        if (body == null || !"success".equals(body.get("status"))) {
            log.debug("Geolocation returned no result for ip={}: {}", ipAddress, body != null ? body.get("message") : null);
            return GeoLocation.UNKNOWN;
        }
        String countryCode = asString(body.get("countryCode"));
        String city = asString(body.get("city"));
        String display;
        if (city != null && countryCode != null) {
            display = city + ", " + countryCode;
        } else if (countryCode != null) {
            display = countryCode;
        } else {
            display = GeoLocation.UNKNOWN_DISPLAY;
        }
        return GeoLocation.builder()
                .countryCode(countryCode)
                .city(city)
                .display(display)
                .latitude(asDouble(body.get("lat")))
                .longitude(asDouble(body.get("lon")))
                .build();
    }

    private static String asString(Object value) {
        if (value == null) return null;
        String s = value.toString();
        return s.isBlank() ? null : s;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value == null) return null;
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
