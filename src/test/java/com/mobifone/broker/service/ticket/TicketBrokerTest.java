package com.mobifone.broker.service.ticket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.broker.entity.ConnectionTicket;
import com.mobifone.broker.entity.ServiceInstance;
import com.mobifone.broker.entity.Transport;
import com.mobifone.broker.support.InMemoryTickets;
import com.mobifone.broker.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TicketBrokerTest {
    private static final Duration TTL = Duration.ofSeconds(60);

    private Map<String, ConnectionTicket> rows;
    private final MutableClock clock = MutableClock.startingNow();
    private TicketBroker broker;
    private ExecutorService executor;

    private final ServiceInstance instance = ServiceInstance.builder().id("i-1").build();
    private final Transport transport = Transport.builder().id("t-rdp").build();

    @BeforeEach
    void setUp() {
        InMemoryTickets tickets = new InMemoryTickets();
        rows = tickets.rows();
        broker = new TicketBroker(tickets.repository(), new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void ticketIdsAreLongAndDistinct() {
        String first = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);
        String second = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);

        assertEquals(TicketBroker.TICKET_LENGTH, first.length());
        assertTrue(first.chars().allMatch(Character::isLetterOrDigit));
        assertNotEquals(first, second);
        assertEquals("i-1", rows.get(first).getInstanceId());
    }

    @Test
    void ticketRedeemsExactlyOnce() {
        String id = broker.issue(instance, transport, Map.of("userId", "u-alice", "serviceId", "s-desktop1"), TTL);

        Optional<Map<String, Object>> payload = broker.redeem(id);
        assertTrue(payload.isPresent());
        assertEquals("s-desktop1", payload.get().get("serviceId"));

        assertTrue(broker.redeem(id).isEmpty());
    }

    @Test
    void concurrentRedeemersGetOneWinner() throws Exception {
        String id = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);
        executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Map<String, Object>>>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return broker.redeem(id);
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Optional<Map<String, Object>>> future : futures) {
            if (future.get(10, TimeUnit.SECONDS).isPresent()) {
                winners++;
            }
        }
        assertEquals(1, winners);
    }

    @Test
    void expiredTicketCannotBeRedeemed() {
        String id = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);
        clock.advance(TTL);

        assertTrue(broker.redeem(id).isEmpty());
    }

    @Test
    void peekLeavesTicketRedeemable() {
        String id = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);

        assertEquals("u-alice", broker.peek(id).orElseThrow().get("userId"));
        assertEquals("u-alice", broker.peek(id).orElseThrow().get("userId"));
        assertTrue(broker.redeem(id).isPresent());
        assertTrue(broker.peek(id).isEmpty());
    }

    @Test
    void expiredTicketCannotBePeeked() {
        String id = broker.issue(instance, transport, Map.of("userId", "u-alice"), TTL);
        clock.advance(TTL);

        assertTrue(broker.peek(id).isEmpty());
    }

    @Test
    void unknownOrBlankTicketIsEmpty() {
        assertTrue(broker.redeem("does-not-exist").isEmpty());
        assertTrue(broker.redeem("").isEmpty());
        assertTrue(broker.redeem(null).isEmpty());
        assertTrue(broker.peek(null).isEmpty());
    }

    @Test
    void purgeRemovesOnlyExpiredTickets() {
        broker.issue(instance, transport, Map.of("userId", "u-alice"), Duration.ofSeconds(10));
        String live = broker.issue(instance, transport, Map.of("userId", "u-bob"), TTL);
        clock.advance(Duration.ofSeconds(30));

        broker.purgeExpired();

        assertEquals(1, rows.size());
        assertTrue(rows.containsKey(live));
    }
}
