package com.mobifone.broker.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Where;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Set;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "logical_service")
@Where(clause = "is_deleted = 0")
public class LogicalService extends AbstractAuditingEntity<String> implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    String id;

    @Column(unique = true)
    String name;

    String comments;

    @Builder.Default
    Boolean enabled = true;

    /** Pool capacity; 0 means unbounded. */
    @Builder.Default
    Integer maxInstances = 0;

    // provisioning backend selection and its parameters
    String backendType;
    String region;
    String imageId;
    String flavorId;

    @ManyToMany
    @JoinTable(name = "service_group",
            joinColumns = @JoinColumn(name = "service_id"),
            inverseJoinColumns = @JoinColumn(name = "group_id"))
    @Builder.Default
    Set<UserGroup> groups = new HashSet<>();

    @ManyToMany
    @JoinTable(name = "service_transport",
            joinColumns = @JoinColumn(name = "service_id"),
            inverseJoinColumns = @JoinColumn(name = "transport_id"))
    @Builder.Default
    Set<Transport> transports = new HashSet<>();
}
