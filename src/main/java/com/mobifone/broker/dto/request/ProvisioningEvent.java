package com.mobifone.broker.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

/** Completion message published by the provisioning side for one instance. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProvisioningEvent {
    @JsonProperty("identifier")
    String identifier;

    @JsonProperty("result")
    boolean result;

    @JsonProperty("address")
    String address;

    @JsonProperty("error")
    String error;
}
