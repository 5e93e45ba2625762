package com.mobifone.broker.entity;

import com.mobifone.broker.entity.enumeration.InstanceState;
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
@Table(name = "service_instance")
public class ServiceInstance extends AbstractAuditingEntity<String> implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    String id;

    @ManyToOne
    @JoinColumn(name = "service_id")
    LogicalService logicalService;

    // null -> unassigned, part of the pool
    @ManyToOne
    @JoinColumn(name = "user_id")
    User user;

    /**
     * "userId:serviceId" while the instance is assigned and active, null otherwise.
     * Unique, so a second concurrent assignment fails at the database.
     */
    @Column(name = "assignment_key", unique = true)
    String assignmentKey;

    String address;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    InstanceState state;

    /** Identifier the provisioning backend knows this instance by. */
    String backendRef;

    Instant assignedAt;

    // connection source, reported by the client on the script path
    String srcIp;
    String srcHostname;

    public static String assignmentKey(String userId, String serviceId) {
        return userId + ":" + serviceId;
    }
}
