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
@Table(name = "broker_user")
@Where(clause = "is_deleted = 0")
public class User extends AbstractAuditingEntity<String> implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    String id;

    @Column(name = "username", unique = true)
    String username;

    // BCrypt hash, only for the internal authenticator
    String password;

    String realName;

    /** Name of the authenticator this user logs in through. */
    String authenticator;

    @Builder.Default
    Boolean staff = false;

    @ManyToMany
    @JoinTable(name = "user_group_member",
            joinColumns = @JoinColumn(name = "user_id"),
            inverseJoinColumns = @JoinColumn(name = "group_id"))
    @Builder.Default
    Set<UserGroup> groups = new HashSet<>();
}
