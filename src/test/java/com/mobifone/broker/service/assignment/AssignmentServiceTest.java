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
import com.mobifone.broker.service.provisioning.FakeProvisioningBackend;
import com.mobifone.broker.service.provisioning.ProvisioningBackendFactory;
import com.mobifone.broker.support.InMemoryInstances;
import com.mobifone.broker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AssignmentServiceTest {
    private final InMemoryInstances instances = new InMemoryInstances();
    private final FakeProvisioningBackend backend = new FakeProvisioningBackend();
    private final InstanceMapper instanceMapper = mock(InstanceMapper.class);
    private AssignmentService service;

    private final User alice = User.builder().id("u-alice").username("alice").build();
    private final LogicalService desktop = LogicalService.builder()
            .id("s-desktop1").name("desktop1").backendType(FakeProvisioningBackend.TYPE).region("r1").build();

    @BeforeEach
    void setUp() {
        service = new AssignmentService(instances.repository(), new ProvisioningBackendFactory(List.of(backend)),
                instanceMapper, MutableClock.startingNow());
        when(instanceMapper.toInstanceResponse(any(ServiceInstance.class)))
                .thenAnswer(inv -> InstanceResponse.builder().id(inv.<ServiceInstance>getArgument(0).getId()).build());
    }

    @Test
    void successfulEventRecordsAddressOnly() {
        ServiceInstance instance = instances.add(provisioning("ref-1"));

        service.applyProvisioningEvent(event("ref-1", true, "10.0.0.5"));

        assertEquals("10.0.0.5", instance.getAddress());
        assertEquals(InstanceState.PROVISIONING, instance.getState());
    }

    @Test
    void failedEventMarksError() {
        ServiceInstance instance = instances.add(provisioning("ref-1"));

        service.applyProvisioningEvent(ProvisioningEvent.builder().identifier("ref-1").result(false).error("no host").build());

        assertEquals(InstanceState.ERROR, instance.getState());
    }

    @Test
    void lateEventForReadyInstanceIsIgnored() {
        ServiceInstance instance = provisioning("ref-1");
        instance.setState(InstanceState.READY);
        instance.setAddress("10.0.0.5");
        instances.add(instance);

        service.applyProvisioningEvent(event("ref-1", true, "10.9.9.9"));

        assertEquals("10.0.0.5", instance.getAddress());
        assertEquals(InstanceState.READY, instance.getState());
    }

    @Test
    void eventForUnknownReferenceIsDropped() {
        assertDoesNotThrow(() -> service.applyProvisioningEvent(event("ref-404", true, "10.0.0.5")));
        assertTrue(instances.snapshot().isEmpty());
    }

    @Test
    void releaseFreesSlotAndReturnsMachine() {
        ServiceInstance instance = instances.add(provisioning("ref-1"));

        service.release(instance);

        assertEquals(InstanceState.REMOVING, instance.getState());
        assertNull(instance.getAssignmentKey());
        assertEquals(List.of("ref-1"), backend.released());
        assertEquals(1, backend.connectCount());
        assertFalse(service.findActive("u-alice", "s-desktop1").isPresent());
    }

    @Test
    void staleCopyCannotReviveReleasedInstance() {
        ServiceInstance row = instances.add(provisioning("ref-1"));
        ServiceInstance stale = copyOf(row);

        assertTrue(service.release(row));

        assertFalse(service.updateAddress(stale, "10.0.0.5"));
        assertFalse(service.markReady(stale));
        assertFalse(service.markError(stale, "late failure"));
        assertEquals(InstanceState.REMOVING, row.getState());
        assertNull(row.getAssignmentKey());
        assertNull(row.getAddress());
    }

    @Test
    void secondReleaseLeavesBackendAlone() {
        ServiceInstance row = instances.add(provisioning("ref-1"));
        ServiceInstance stale = copyOf(row);

        assertTrue(service.release(row));
        assertFalse(service.release(stale));

        assertEquals(List.of("ref-1"), backend.released());
    }

    @Test
    void markReadyMovesOnlyProvisioningInstances() {
        ServiceInstance row = instances.add(provisioning("ref-1"));

        assertTrue(service.markReady(row));
        assertFalse(service.markReady(copyOf(row)));
        assertEquals(InstanceState.READY, row.getState());
    }

    @Test
    void releaseAllForUserTouchesOnlyActiveInstances() {
        ServiceInstance active = instances.add(provisioning("ref-1"));
        ServiceInstance gone = provisioning("ref-2");
        gone.setState(InstanceState.REMOVING);
        gone.setAssignmentKey(null);
        instances.add(gone);

        List<InstanceResponse> released = service.releaseAllForUser("u-alice");

        assertEquals(1, released.size());
        assertEquals(active.getId(), released.get(0).getId());
        assertEquals(List.of("ref-1"), backend.released());
    }

    @Test
    void releasingUnknownInstanceFails() {
        AppException e = assertThrows(AppException.class, () -> service.release("nope"));
        assertEquals(ErrorCode.INSTANCE_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void connectionSourceFailureDoesNotPropagate() {
        doThrow(new QueryTimeoutException("lock wait timeout"))
                .when(instances.repository()).updateConnectionSource("i-1", "192.0.2.10", "kiosk");

        assertDoesNotThrow(() -> service.recordConnectionSource("i-1", "192.0.2.10", "kiosk"));
    }

    @Test
    void capacityCountsActiveInstances() {
        desktop.setMaxInstances(1);
        assertTrue(service.hasCapacity(desktop));

        instances.add(provisioning("ref-1"));
        assertFalse(service.hasCapacity(desktop));
    }

    private ServiceInstance provisioning(String ref) {
        return ServiceInstance.builder()
                .logicalService(desktop)
                .user(alice)
                .assignmentKey(ServiceInstance.assignmentKey(alice.getId(), desktop.getId()))
                .backendRef(ref)
                .state(InstanceState.PROVISIONING)
                .build();
    }

    private static ServiceInstance copyOf(ServiceInstance row) {
        return ServiceInstance.builder()
                .id(row.getId())
                .logicalService(row.getLogicalService())
                .user(row.getUser())
                .assignmentKey(row.getAssignmentKey())
                .backendRef(row.getBackendRef())
                .address(row.getAddress())
                .state(row.getState())
                .build();
    }

    private static ProvisioningEvent event(String ref, boolean result, String address) {
        return ProvisioningEvent.builder().identifier(ref).result(result).address(address).build();
    }
}
