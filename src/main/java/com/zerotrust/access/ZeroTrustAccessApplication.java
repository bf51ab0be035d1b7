package com.zerotrust.access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Zero Trust Access Engine. Provides:
 * <ul>
 *   <li>Weighted risk scoring of authentication attempts</li>
 *   <li>Priority-ordered access policies (allow, step-up, deny)</li>
 *   <li>Continuous session reevaluation with anomaly detection and revocation</li>
 *   <li>IP reputation from AbuseIPDB blended with the local audit log</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class ZeroTrustAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZeroTrustAccessApplication.class, args);
    }
}
