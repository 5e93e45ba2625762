package com.mobifone.broker.service.provisioning;

import com.mobifone.broker.common.Constants;
import com.mobifone.broker.dto.request.ProvisioningEvent;
import com.mobifone.broker.service.assignment.AssignmentService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Completion events from the provisioning side. They only shorten the wait: resolves keep
 * polling the backend for instances whose event never arrives.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ProvisioningEventListener {
    AssignmentService assignmentService;

    @RabbitListener(queues = Constants.PROVISIONING.QUEUE)
    public void onProvisioningEvent(ProvisioningEvent event) {
        log.info("[ProvisioningEvent] identifier={} result={} address={}",
                event.getIdentifier(), event.isResult(), event.getAddress());
        if (event.getIdentifier() == null || event.getIdentifier().isBlank()) {
            throw new AmqpRejectAndDontRequeueException("Provisioning event without identifier");
        }
        assignmentService.applyProvisioningEvent(event);
    }
}
