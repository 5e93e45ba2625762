package com.mobifone.broker.entity;

import com.mobifone.broker.entity.enumeration.ClientOs;
import com.mobifone.broker.entity.enumeration.TransportProtocol;
import com.mobifone.broker.utils.ClientOsSetConverter;
import com.mobifone.broker.utils.ParamsJsonConverter;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Where;

import java.io.Serializable;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Where(clause = "is_deleted = 0")
public class Transport extends AbstractAuditingEntity<String> implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    String id;

    String name;

    @Enumerated(EnumType.STRING)
    TransportProtocol protocol;

    // null -> protocol default
    Integer listenPort;

    /** Template base name, e.g. "rdp/connect"; resolved to rdp/connect.windows.txt. */
    String scriptTemplate;

    @Builder.Default
    Integer priority = 1;

    @Builder.Default
    Boolean enabled = true;

    @Convert(converter = ClientOsSetConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    Set<ClientOs> allowedOs = EnumSet.noneOf(ClientOs.class);

    @Convert(converter = ParamsJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    Map<String, String> params = new LinkedHashMap<>();

    public boolean isValidForOs(ClientOs os) {
        return allowedOs == null || allowedOs.isEmpty() || allowedOs.contains(os);
    }
}
