package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import com.zerotrust.access.risk.device.DeviceRegistry;
import com.zerotrust.access.risk.device.KnownDevice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Known fingerprint 0, unknown 40.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceFactorEvaluator implements RiskFactorEvaluator {

    static final double KNOWN_DEVICE = 0.0;
    static final double UNKNOWN_DEVICE = 40.0;

    private final DeviceRegistry deviceRegistry;

    @Override
    public RiskFactorType type() {
        return RiskFactorType.DEVICE;
    }

    @Override
    public FactorEvaluation evaluate(AuthContext context) {
        DeviceSignature device = context.getDevice();
        if (device == null) {
            return FactorEvaluation.ok(RiskFactor.of(type(), UNKNOWN_DEVICE, "no device signature"));
        }
        Optional<KnownDevice> known;
        try {
            known = deviceRegistry.findDevice(context.getUserId(), device.getFingerprint());
        } catch (RuntimeException e) {
            log.warn("Device lookup failed for user={}: {}", context.getUserId(), e.getMessage());
            return FactorEvaluation.failed(type(), "device registry unavailable: " + e.getMessage());
        }
        if (known.isPresent()) {
            return FactorEvaluation.ok(RiskFactor.of(type(), KNOWN_DEVICE, "known device " + device.getDisplayName()));
        }
        return FactorEvaluation.ok(RiskFactor.of(type(), UNKNOWN_DEVICE, "unknown device " + device.getDisplayName()));
    }
}
