package com.mobifone.broker.service.assignment;

import com.mobifone.broker.dto.request.ProvisioningEvent;
import com.mobifone.broker.dto.response.InstanceResponse;
import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.InstanceState;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.mapper.InstanceMapper;
import com.mobifone.broker.repository.ServiceInstanceRepository;
import com.mobifone.broker.service.provisioning.AcquireResult;
import com.mobifone.broker.service.provisioning.ProvisioningBackend;
import com.mobifone.broker.service.provisioning.ProvisioningBackendFactory;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persistence side of instance assignment. Every write here is a single repository call, so
 * the assignment lock in {@link ServiceAssignmentResolver} is never held across a long
 * transaction. State changes after creation are conditional updates on the current state,
 * so a caller holding a stale copy of an instance cannot overwrite a newer transition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AssignmentService {
    ServiceInstanceRepository serviceInstanceRepository;
    ProvisioningBackendFactory provisioningBackendFactory;
    InstanceMapper instanceMapper;
    Clock clock;

    public Optional<ServiceInstance> findActive(String userId, String serviceId) {
        return serviceInstanceRepository.findFirstByUser_IdAndLogicalService_IdAndStateIn(
                userId, serviceId, InstanceState.ACTIVE);
    }

    /** Takes the first pooled READY instance nobody else claims concurrently. */
    public Optional<ServiceInstance> claimPooled(User user, LogicalService service) {
        String key = ServiceInstance.assignmentKey(user.getId(), service.getId());
        for (ServiceInstance pooled : serviceInstanceRepository
                .findByLogicalService_IdAndUserIsNullAndState(service.getId(), InstanceState.READY)) {
            if (serviceInstanceRepository.claim(pooled.getId(), user, key, clock.instant()) == 1) {
                pooled.setUser(user);
                pooled.setAssignmentKey(key);
                pooled.setAssignedAt(clock.instant());
                log.info("User {} took pooled instance {} of service {}", user.getId(), pooled.getId(), service.getName());
                return Optional.of(pooled);
            }
        }
        return Optional.empty();
    }

    public boolean hasCapacity(LogicalService service) {
        int max = Optional.ofNullable(service.getMaxInstances()).orElse(0);
        return max <= 0
                || serviceInstanceRepository.countByLogicalService_IdAndStateIn(service.getId(), InstanceState.ACTIVE) < max;
    }

    /** Persists a freshly acquired machine; fails at the unique assignment key if one already exists. */
    public ServiceInstance registerProvisioning(User user, LogicalService service, AcquireResult acquired) {
        ServiceInstance instance = ServiceInstance.builder()
                .logicalService(service)
                .user(user)
                .assignmentKey(ServiceInstance.assignmentKey(user.getId(), service.getId()))
                .backendRef(acquired.getReference())
                .address(acquired.isPending() ? null : acquired.getAddress())
                .state(InstanceState.PROVISIONING)
                .assignedAt(clock.instant())
                .build();
        return serviceInstanceRepository.saveAndFlush(instance);
    }

    /**
     * Records the address of a machine that is still PROVISIONING. Returns false when the
     * instance moved on meanwhile (released or already failed); nothing is written then.
     */
    public boolean updateAddress(ServiceInstance instance, String address) {
        if (serviceInstanceRepository.recordAddress(instance.getId(), address, InstanceState.PROVISIONING) != 1) {
            log.info("Instance {} left PROVISIONING, address {} not recorded", instance.getId(), address);
            return false;
        }
        instance.setAddress(address);
        return true;
    }

    public boolean markReady(ServiceInstance instance) {
        if (!transition(instance, InstanceState.PROVISIONING, InstanceState.READY)) {
            return false;
        }
        log.info("Instance {} is ready at {}", instance.getId(), instance.getAddress());
        return true;
    }

    public boolean markError(ServiceInstance instance, String reason) {
        if (!transition(instance, InstanceState.PROVISIONING, InstanceState.ERROR)) {
            return false;
        }
        log.warn("Instance {} failed to provision: {}", instance.getId(), reason);
        return true;
    }

    /**
     * Frees the assignment slot and asks the backend to reclaim the machine. The row stays in
     * REMOVING for the pool manager. Returns false, without touching the backend, when another
     * caller already released the instance.
     */
    public boolean release(ServiceInstance instance) {
        if (serviceInstanceRepository.retire(instance.getId(), InstanceState.REMOVING, InstanceState.ACTIVE) != 1) {
            log.info("Instance {} was already released", instance.getId());
            return false;
        }
        instance.setState(InstanceState.REMOVING);
        instance.setAssignmentKey(null);

        LogicalService service = instance.getLogicalService();
        if (instance.getBackendRef() != null && service != null) {
            ProvisioningBackend backend = provisioningBackendFactory.getBackend(service.getBackendType());
            backend.connect(service.getRegion());
            backend.releaseInstance(service, instance.getBackendRef());
        }
        log.info("Instance {} released", instance.getId());
        return true;
    }

    private boolean transition(ServiceInstance instance, InstanceState from, InstanceState to) {
        if (serviceInstanceRepository.transition(instance.getId(), from, to) != 1) {
            log.info("Instance {} is no longer {}, not moved to {}", instance.getId(), from, to);
            return false;
        }
        instance.setState(to);
        return true;
    }

    @PreAuthorize("hasRole('admin')")
    public InstanceResponse release(String instanceId) {
        ServiceInstance instance = serviceInstanceRepository.findById(instanceId)
                .orElseThrow(() -> new AppException(ErrorCode.INSTANCE_NOT_FOUND));
        release(instance);
        return instanceMapper.toInstanceResponse(instance);
    }

    /** Revokes every active assignment of a user, e.g. when the user is removed from its authenticator. */
    @PreAuthorize("hasRole('admin')")
    public List<InstanceResponse> releaseAllForUser(String userId) {
        return serviceInstanceRepository.findByUser_IdAndStateIn(userId, InstanceState.ACTIVE).stream()
                .filter(this::release)
                .map(instanceMapper::toInstanceResponse)
                .collect(Collectors.toList());
    }

    @PreAuthorize("hasRole('admin')")
    public List<InstanceResponse> listForService(String serviceId) {
        return serviceInstanceRepository.findByLogicalService_IdOrderByAssignedAtDesc(serviceId).stream()
                .map(instanceMapper::toInstanceResponse)
                .collect(Collectors.toList());
    }

    /** Audit annotation only: a failure here never fails the connection it describes. */
    public void recordConnectionSource(String instanceId, String ip, String hostname) {
        try {
            serviceInstanceRepository.updateConnectionSource(instanceId, ip, hostname);
        } catch (DataAccessException e) {
            log.warn("Could not record connection source for instance {}", instanceId, e);
        }
    }

    /**
     * Applies a completion event from the provisioning side. The address is only recorded;
     * the instance becomes READY once a readiness probe against it succeeds.
     */
    public void applyProvisioningEvent(ProvisioningEvent event) {
        Optional<ServiceInstance> found = serviceInstanceRepository.findFirstByBackendRef(event.getIdentifier());
        if (found.isEmpty()) {
            log.warn("Provisioning event for unknown reference {}", event.getIdentifier());
            return;
        }
        ServiceInstance instance = found.get();
        if (instance.getState() != InstanceState.PROVISIONING) {
            log.info("Ignoring provisioning event for instance {} in state {}", instance.getId(), instance.getState());
            return;
        }
        if (event.isResult() && event.getAddress() != null && !event.getAddress().isBlank()) {
            if (updateAddress(instance, event.getAddress())) {
                log.info("Instance {} provisioned at {}", instance.getId(), event.getAddress());
            }
        } else if (!event.isResult()) {
            markError(instance, event.getError());
        } else {
            log.warn("Successful provisioning event for {} carried no address", event.getIdentifier());
        }
    }
}
