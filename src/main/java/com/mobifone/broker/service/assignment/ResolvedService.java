package com.mobifone.broker.service.assignment;

import com.mobifone.broker.entity.LogicalService;
import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.service.transport.TransportType;
import lombok.Builder;
import lombok.Value;

/** Everything a connection needs once the user's machine is known and reachable. */
@Value
@Builder
public class ResolvedService {
    String address;
    ServiceInstance instance;
    LogicalService service;
    Transport transport;
    TransportType transportType;
}
