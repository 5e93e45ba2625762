package com.mobifone.broker.service.provisioning;

import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProvisioningBackendFactory {
    private final List<ProvisioningBackend> backends;

    public ProvisioningBackend getBackend(String backendType) {
        return backends.stream()
                .filter(backend -> backend.isApplicable(backendType))
                .findFirst()
                .orElseThrow(() -> {
                    log.error("No provisioning backend found for type: {}", backendType);
                    return new AppException(ErrorCode.PROVISIONING_FAILED);
                });
    }
}
