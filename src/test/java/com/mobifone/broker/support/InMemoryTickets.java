package com.mobifone.broker.support;

import com.mobifone.broker.entity.ConnectionTicket;
import com.mobifone.broker.repository.ConnectionTicketRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/** A {@link ConnectionTicketRepository} mock backed by a map, with the conditional delete of the real query. */
public class InMemoryTickets {
    private final Map<String, ConnectionTicket> rows = new ConcurrentHashMap<>();
    private final ConnectionTicketRepository repository = mock(ConnectionTicketRepository.class);

    public InMemoryTickets() {
        lenient().when(repository.save(any(ConnectionTicket.class))).thenAnswer(inv -> {
            ConnectionTicket ticket = inv.getArgument(0);
            rows.put(ticket.getId(), ticket);
            return ticket;
        });
        lenient().when(repository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        lenient().when(repository.consume(anyString(), any(Instant.class))).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            Instant now = inv.getArgument(1);
            ConnectionTicket ticket = rows.get(id);
            return ticket != null && ticket.getExpiresAt().isAfter(now) && rows.remove(id, ticket) ? 1 : 0;
        });
        lenient().when(repository.deleteExpired(any(Instant.class))).thenAnswer(inv -> {
            Instant now = inv.getArgument(0);
            int before = rows.size();
            rows.values().removeIf(t -> !t.getExpiresAt().isAfter(now));
            return before - rows.size();
        });
    }

    public ConnectionTicketRepository repository() {
        return repository;
    }

    public Map<String, ConnectionTicket> rows() {
        return rows;
    }
}
