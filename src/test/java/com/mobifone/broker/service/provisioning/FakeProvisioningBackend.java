package com.mobifone.broker.service.provisioning;

import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Canned provisioning backend: machines stay pending until the test completes or fails them. */
public class FakeProvisioningBackend implements ProvisioningBackend {
    public static final String TYPE = "FAKE";

    private final Map<String, InstanceStatus> statuses = new ConcurrentHashMap<>();
    private final List<String> released = new CopyOnWriteArrayList<>();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger acquires = new AtomicInteger();
    private volatile boolean refuseAcquire;
    private volatile Runnable onCheck = () -> { };

    @Override
    public boolean isApplicable(String backendType) {
        return TYPE.equalsIgnoreCase(backendType);
    }

    @Override
    public void connect(String region) {
        connects.incrementAndGet();
    }

    @Override
    public AcquireResult acquireInstance(LogicalService service, String identifier, String userId) {
        if (refuseAcquire) {
            throw new AppException(ErrorCode.PROVISIONING_FAILED);
        }
        acquires.incrementAndGet();
        statuses.put(identifier, InstanceStatus.pending());
        return AcquireResult.pending(identifier);
    }

    @Override
    public InstanceStatus checkInstance(LogicalService service, String reference) {
        onCheck.run();
        return statuses.getOrDefault(reference, InstanceStatus.failed("unknown reference"));
    }

    @Override
    public void releaseInstance(LogicalService service, String reference) {
        released.add(reference);
    }

    public void complete(String reference, String address) {
        statuses.put(reference, InstanceStatus.ready(address));
    }

    public void fail(String reference, String error) {
        statuses.put(reference, InstanceStatus.failed(error));
    }

    /** Runs inside every status check, before the status is returned. */
    public void onCheck(Runnable hook) {
        this.onCheck = hook;
    }

    public void refuseAcquire(boolean refuse) {
        this.refuseAcquire = refuse;
    }

    public int acquireCount() {
        return acquires.get();
    }

    public int connectCount() {
        return connects.get();
    }

    public List<String> released() {
        return released;
    }
}
