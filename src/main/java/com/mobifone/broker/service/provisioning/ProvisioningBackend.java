package com.mobifone.broker.service.provisioning;

import com.mobifone.broker.entity.LogicalService;

/**
 * External pool/provisioning system that creates and destroys the machines behind a
 * logical service.
 * <p>
 * Callers must invoke {@link #connect(String)} before any request method; it opens a
 * session for the region or reuses the current one while it is still valid. Request
 * methods fail with {@code AppException(PROVISIONING_FAILED)} when the backend refuses.
 */
public interface ProvisioningBackend {
    boolean isApplicable(String backendType);

    void connect(String region);

    /**
     * Asks for a new machine. Returns immediately: the result is usually pending and the
     * address arrives later through {@link #checkInstance} or a provisioning event.
     *
     * @param identifier caller chosen id the backend echoes back in its events
     */
    AcquireResult acquireInstance(LogicalService service, String identifier, String userId);

    InstanceStatus checkInstance(LogicalService service, String reference);

    void releaseInstance(LogicalService service, String reference);
}
