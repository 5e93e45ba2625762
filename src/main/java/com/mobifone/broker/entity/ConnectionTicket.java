package com.mobifone.broker.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.io.Serializable;
import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "connection_ticket")
public class ConnectionTicket implements Serializable {
    @Id
    @Column(length = 64)
    String id;

    String instanceId;
    String transportId;

    /** JSON payload; credentials inside stay encrypted with the client's scrambler. */
    @Lob
    @Column(columnDefinition = "LONGTEXT")
    String payload;

    @Column(nullable = false)
    Instant expiresAt;
}
