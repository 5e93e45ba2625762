package com.mobifone.broker.service.ticket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.entity.ConnectionTicket;
import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.exception.AppException;
import com.mobifone.broker.exception.ErrorCode;
import com.mobifone.broker.repository.ConnectionTicketRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One-time tickets carrying connection parameters.
 * <p>
 * Redemption is a conditional delete: whoever removes the row wins, everyone else sees
 * nothing. Used and expired tickets are indistinguishable to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class TicketBroker {
    static final int TICKET_LENGTH = 40;
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    ConnectionTicketRepository connectionTicketRepository;
    ObjectMapper objectMapper;
    Clock clock;

    public String issue(ServiceInstance instance, Transport transport, Map<String, Object> payload, Duration ttl) {
        String id = newTicketId();
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AppException(ErrorCode.UNCATEGORIZED_EXCEPTION, e);
        }
        connectionTicketRepository.save(ConnectionTicket.builder()
                .id(id)
                .instanceId(instance == null ? null : instance.getId())
                .transportId(transport == null ? null : transport.getId())
                .payload(json)
                .expiresAt(clock.instant().plus(ttl))
                .build());
        log.debug("Issued ticket for instance {} valid {}s", instance == null ? null : instance.getId(), ttl.toSeconds());
        return id;
    }

    /** Payload of a live ticket, leaving it redeemable. Expired tickets read as absent. */
    public Optional<Map<String, Object>> peek(String ticketId) {
        if (ticketId == null || ticketId.isBlank()) {
            return Optional.empty();
        }
        return connectionTicketRepository.findById(ticketId)
                .filter(ticket -> ticket.getExpiresAt().isAfter(clock.instant()))
                .map(ticket -> readPayload(ticket.getPayload()));
    }

    public Optional<Map<String, Object>> redeem(String ticketId) {
        if (ticketId == null || ticketId.isBlank()) {
            return Optional.empty();
        }
        Optional<ConnectionTicket> ticket = connectionTicketRepository.findById(ticketId);
        if (ticket.isEmpty()) {
            return Optional.empty();
        }
        if (connectionTicketRepository.consume(ticketId, clock.instant()) != 1) {
            return Optional.empty();
        }
        return Optional.of(readPayload(ticket.get().getPayload()));
    }

    @Scheduled(fixedDelayString = "${broker.ticket.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int removed = connectionTicketRepository.deleteExpired(now);
        if (removed > 0) {
            log.info("Purged {} expired connection tickets", removed);
        }
    }

    private Map<String, Object> readPayload(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new AppException(ErrorCode.UNCATEGORIZED_EXCEPTION, e);
        }
    }

    private static String newTicketId() {
        StringBuilder sb = new StringBuilder(TICKET_LENGTH);
        for (int i = 0; i < TICKET_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
