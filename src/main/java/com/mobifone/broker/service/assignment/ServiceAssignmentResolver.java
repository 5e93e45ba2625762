package com.mobifone.broker.service.assignment;

import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.entity.enumeration.InstanceState;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.repository.LogicalServiceRepository;
import com.mobifone.broker.service.provisioning.AcquireResult;
import com.mobifone.broker.service.provisioning.InstanceStatus;
import com.mobifone.broker.service.provisioning.ProvisioningBackend;
import com.mobifone.broker.service.provisioning.ProvisioningBackendFactory;
import com.mobifone.broker.service.transport.TransportNegotiator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Maps (user, logical service, transport) to the concrete machine the user connects to.
 * <p>
 * Each call re-reads state and is safe to repeat: a user that keeps polling while its
 * machine is provisioned gets NOT_READY until a readiness probe succeeds, and never a second
 * machine. Find-or-assign runs under the (user, service) lock; backend status checks and
 * readiness probes run after it is released. For a service with {@code maxInstances}, the
 * capacity count and the provisioning it admits also run under a per-service lock, so
 * different users cannot both take the last slot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ServiceAssignmentResolver {
    LogicalServiceRepository logicalServiceRepository;
    AssignmentService assignmentService;
    AssignmentLocks assignmentLocks;
    ServiceAccessPolicy serviceAccessPolicy;
    ProvisioningBackendFactory provisioningBackendFactory;
    TransportNegotiator transportNegotiator;

    /**
     * @param validateAccess check the user's grant on the service and the transport's
     *                       reachability; false on the skip-checking route
     */
    public ResolveResult<ResolvedService> resolve(User user, String serviceId, String transportId,
                                                  ClientOs clientOs, String clientIp, boolean validateAccess) {
        LogicalService service = logicalServiceRepository.findWithTransportsById(serviceId)
                .filter(s -> Boolean.TRUE.equals(s.getEnabled()))
                .orElse(null);
        if (service == null) {
            return ResolveResult.error(ErrorCode.SERVICE_NOT_FOUND);
        }
        Transport transport = service.getTransports().stream()
                .filter(t -> t.getId().equals(transportId) && Boolean.TRUE.equals(t.getEnabled()))
                .findFirst()
                .orElse(null);
        if (transport == null) {
            return ResolveResult.error(ErrorCode.TRANSPORT_NOT_FOUND);
        }
        if (!transport.isValidForOs(clientOs)) {
            return ResolveResult.error(ErrorCode.UNSUPPORTED_OS);
        }
        if (validateAccess && !serviceAccessPolicy.hasAccess(user, service)) {
            log.warn("User {} from {} denied access to service {}", user.getId(), clientIp, service.getName());
            return ResolveResult.error(ErrorCode.ACCESS_DENIED);
        }

        String key = ServiceInstance.assignmentKey(user.getId(), service.getId());
        ResolveResult<ServiceInstance> assigned;
        try {
            assigned = assignmentLocks.withLock(key, () -> findOrAssign(user, service));
        } catch (DataIntegrityViolationException e) {
            // another node assigned the pair first
            log.info("Concurrent assignment detected for {}, reusing the existing one", key);
            assigned = assignmentService.findActive(user.getId(), service.getId())
                    .map(ResolveResult::ready)
                    .orElseGet(() -> ResolveResult.notReady(NotReadyReason.PROVISIONING));
        }
        if (!assigned.isReady()) {
            return assigned.failure();
        }
        return checkReadiness(assigned.getValue(), service, transport, validateAccess);
    }

    private ResolveResult<ServiceInstance> findOrAssign(User user, LogicalService service) {
        Optional<ServiceInstance> existing = assignmentService.findActive(user.getId(), service.getId())
                .or(() -> assignmentService.claimPooled(user, service));
        if (existing.isPresent()) {
            return ResolveResult.ready(existing.get());
        }
        if (Optional.ofNullable(service.getMaxInstances()).orElse(0) <= 0) {
            return provision(user, service);
        }
        return assignmentLocks.withCapacityLock(service.getId(), () -> {
            if (!assignmentService.hasCapacity(service)) {
                log.info("Service {} has no free capacity for user {}", service.getName(), user.getId());
                return ResolveResult.error(ErrorCode.SERVICE_POOL_FULL);
            }
            return provision(user, service);
        });
    }

    private ResolveResult<ServiceInstance> provision(User user, LogicalService service) {
        ProvisioningBackend backend;
        AcquireResult acquired;
        try {
            backend = provisioningBackendFactory.getBackend(service.getBackendType());
            backend.connect(service.getRegion());
            acquired = backend.acquireInstance(service, UUID.randomUUID().toString(), user.getId());
        } catch (AppException e) {
            log.error("Provisioning request for service {} failed: {}", service.getName(), e.getMessage());
            return ResolveResult.error(e.getErrorCode());
        }
        ServiceInstance created;
        try {
            created = assignmentService.registerProvisioning(user, service, acquired);
        } catch (DataIntegrityViolationException e) {
            discard(backend, service, acquired.getReference());
            throw e;
        }
        log.info("Provisioning instance {} ({}) for user {} on service {}",
                created.getId(), acquired.getReference(), user.getId(), service.getName());
        return ResolveResult.ready(created);
    }

    private ResolveResult<ResolvedService> checkReadiness(ServiceInstance instance, LogicalService service,
                                                          Transport transport, boolean validateAccess) {
        if (instance.getState() == InstanceState.ERROR) {
            releaseFailed(instance);
            return ResolveResult.error(ErrorCode.SERVICE_IN_ERROR);
        }

        if (instance.getState() == InstanceState.PROVISIONING) {
            // a lost transition means someone else moved the instance on; the next poll sees where
            if (instance.getAddress() == null) {
                InstanceStatus status = pollBackend(instance, service);
                if (status.getState() == InstanceStatus.State.FAILED) {
                    if (!assignmentService.markError(instance, status.getError())) {
                        return ResolveResult.notReady(NotReadyReason.PROVISIONING);
                    }
                    releaseFailed(instance);
                    return ResolveResult.error(ErrorCode.SERVICE_IN_ERROR);
                }
                if (status.getState() == InstanceStatus.State.PENDING
                        || !assignmentService.updateAddress(instance, status.getAddress())) {
                    return ResolveResult.notReady(NotReadyReason.PROVISIONING);
                }
            }
            if (!transportNegotiator.isAvailable(transport, instance.getAddress())
                    || !assignmentService.markReady(instance)) {
                return ResolveResult.notReady(NotReadyReason.PROVISIONING);
            }
        } else if (validateAccess && !transportNegotiator.isAvailable(transport, instance.getAddress())) {
            return ResolveResult.notReady(NotReadyReason.TRANSPORT_UNREACHABLE);
        }

        return ResolveResult.ready(ResolvedService.builder()
                .address(instance.getAddress())
                .instance(instance)
                .service(service)
                .transport(transport)
                .transportType(transportNegotiator.typeOf(transport))
                .build());
    }

    // a backend that cannot answer right now is treated like one still working on it
    private InstanceStatus pollBackend(ServiceInstance instance, LogicalService service) {
        try {
            ProvisioningBackend backend = provisioningBackendFactory.getBackend(service.getBackendType());
            backend.connect(service.getRegion());
            return backend.checkInstance(service, instance.getBackendRef());
        } catch (AppException e) {
            log.warn("Status check for instance {} failed: {}", instance.getId(), e.getMessage());
            return InstanceStatus.pending();
        }
    }

    private void discard(ProvisioningBackend backend, LogicalService service, String reference) {
        try {
            backend.releaseInstance(service, reference);
        } catch (AppException e) {
            log.error("Could not give back duplicate machine {} of service {}", reference, service.getName(), e);
        }
    }

    private void releaseFailed(ServiceInstance instance) {
        try {
            assignmentService.release(instance);
        } catch (AppException e) {
            log.error("Release of failed instance {} was refused by the backend", instance.getId(), e);
        }
    }
}
