package com.zerotrust.access.policy;

public class PolicyNotFoundException extends RuntimeException {

    public PolicyNotFoundException(String policyId) {
        super("Policy " + policyId + " not found");
    }
}
