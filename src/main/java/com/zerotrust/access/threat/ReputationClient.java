package com.zerotrust.access.threat;

/**
 * External IP reputation source. Never throws; failures yield
 * {@link ReputationReport#unavailable(String)}.
 */
public interface ReputationClient {

    ReputationReport check(String ipAddress);
}
