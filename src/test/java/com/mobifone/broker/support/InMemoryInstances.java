package com.mobifone.broker.support;

import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.User;
import com.mobifone.broker.entity.enumeration.InstanceState;
import com.mobifone.broker.repository.ServiceInstanceRepository;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * A {@link ServiceInstanceRepository} mock backed by a map, enforcing the unique assignment
 * key, the conditional claim and the conditional state updates like the database does.
 * Conditional updates act on the stored row, whatever copy of the instance the caller holds.
 */
public class InMemoryInstances {
    private final Map<String, ServiceInstance> rows = new ConcurrentHashMap<>();
    private final ServiceInstanceRepository repository = mock(ServiceInstanceRepository.class);

    @SuppressWarnings("unchecked")
    public InMemoryInstances() {
        lenient().when(repository.findFirstByUser_IdAndLogicalService_IdAndStateIn(anyString(), anyString(), anyCollection()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> i.getUser() != null && i.getUser().getId().equals(inv.getArgument(0)))
                        .filter(i -> i.getLogicalService().getId().equals(inv.getArgument(1)))
                        .filter(i -> ((Collection<InstanceState>) inv.getArgument(2)).contains(i.getState()))
                        .findFirst());
        lenient().when(repository.findByLogicalService_IdAndUserIsNullAndState(anyString(), any()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> i.getUser() == null)
                        .filter(i -> i.getLogicalService().getId().equals(inv.getArgument(0)))
                        .filter(i -> i.getState() == inv.getArgument(1))
                        .collect(Collectors.toList()));
        lenient().when(repository.countByLogicalService_IdAndStateIn(anyString(), anyCollection()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> i.getLogicalService().getId().equals(inv.getArgument(0)))
                        .filter(i -> ((Collection<InstanceState>) inv.getArgument(1)).contains(i.getState()))
                        .count());
        lenient().when(repository.findByUser_IdAndStateIn(anyString(), anyCollection()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> i.getUser() != null && i.getUser().getId().equals(inv.getArgument(0)))
                        .filter(i -> ((Collection<InstanceState>) inv.getArgument(1)).contains(i.getState()))
                        .collect(Collectors.toList()));
        lenient().when(repository.findByLogicalService_IdOrderByAssignedAtDesc(anyString()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> i.getLogicalService().getId().equals(inv.getArgument(0)))
                        .sorted(Comparator.comparing(ServiceInstance::getAssignedAt,
                                Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                        .collect(Collectors.toList()));
        lenient().when(repository.findFirstByBackendRef(anyString()))
                .thenAnswer(inv -> snapshot().stream()
                        .filter(i -> Objects.equals(i.getBackendRef(), inv.getArgument(0)))
                        .findFirst());
        lenient().when(repository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get((String) inv.getArgument(0))));
        lenient().when(repository.claim(anyString(), any(User.class), anyString(), any(Instant.class)))
                .thenAnswer(inv -> claim(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2), inv.getArgument(3)));
        lenient().when(repository.transition(anyString(), any(InstanceState.class), any(InstanceState.class)))
                .thenAnswer(inv -> transition(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        lenient().when(repository.recordAddress(anyString(), anyString(), any(InstanceState.class)))
                .thenAnswer(inv -> recordAddress(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        lenient().when(repository.retire(anyString(), any(InstanceState.class), anyCollection()))
                .thenAnswer(inv -> retire(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        lenient().when(repository.saveAndFlush(any(ServiceInstance.class)))
                .thenAnswer(inv -> store(inv.getArgument(0)));
        lenient().when(repository.updateConnectionSource(anyString(), nullable(String.class), nullable(String.class)))
                .thenAnswer(inv -> {
                    ServiceInstance row = rows.get((String) inv.getArgument(0));
                    if (row == null) return 0;
                    row.setSrcIp(inv.getArgument(1));
                    row.setSrcHostname(inv.getArgument(2));
                    return 1;
                });
    }

    public ServiceInstanceRepository repository() {
        return repository;
    }

    public List<ServiceInstance> snapshot() {
        return new ArrayList<>(rows.values());
    }

    public ServiceInstance add(ServiceInstance instance) {
        return store(instance);
    }

    private synchronized ServiceInstance store(ServiceInstance instance) {
        if (instance.getAssignmentKey() != null) {
            boolean taken = rows.values().stream()
                    .anyMatch(other -> other != instance
                            && !Objects.equals(other.getId(), instance.getId())
                            && instance.getAssignmentKey().equals(other.getAssignmentKey()));
            if (taken) {
                throw new DataIntegrityViolationException("Duplicate entry for key 'assignment_key'");
            }
        }
        if (instance.getId() == null) {
            instance.setId(UUID.randomUUID().toString());
        }
        rows.put(instance.getId(), instance);
        return instance;
    }

    private synchronized int claim(String id, User user, String key, Instant now) {
        ServiceInstance row = rows.get(id);
        if (row == null || row.getUser() != null) {
            return 0;
        }
        boolean taken = rows.values().stream().anyMatch(other -> key.equals(other.getAssignmentKey()));
        if (taken) {
            throw new DataIntegrityViolationException("Duplicate entry for key 'assignment_key'");
        }
        row.setUser(user);
        row.setAssignmentKey(key);
        row.setAssignedAt(now);
        return 1;
    }

    private synchronized int transition(String id, InstanceState from, InstanceState to) {
        ServiceInstance row = rows.get(id);
        if (row == null || row.getState() != from) {
            return 0;
        }
        row.setState(to);
        return 1;
    }

    private synchronized int recordAddress(String id, String address, InstanceState state) {
        ServiceInstance row = rows.get(id);
        if (row == null || row.getState() != state) {
            return 0;
        }
        row.setAddress(address);
        return 1;
    }

    private synchronized int retire(String id, InstanceState removing, Collection<InstanceState> active) {
        ServiceInstance row = rows.get(id);
        if (row == null || !active.contains(row.getState())) {
            return 0;
        }
        row.setState(removing);
        row.setAssignmentKey(null);
        return 1;
    }
}
