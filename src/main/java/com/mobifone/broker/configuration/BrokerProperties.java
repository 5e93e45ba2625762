package com.mobifone.broker.configuration;

import lombok.AccessLevel;
import lombok.Data;
import lombok.experimental.FieldDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
@ConfigurationProperties(prefix = "broker")
public class BrokerProperties {
    Readiness readiness = new Readiness();
    Ticket ticket = new Ticket();
    Link link = new Link();
    Scripts scripts = new Scripts();
    Provisioning provisioning = new Provisioning();

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Readiness {
        Duration ttl = Duration.ofSeconds(30);
        Duration probeTimeout = Duration.ofSeconds(2);
        long evictionIntervalMs = 60_000;
    }

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Ticket {
        Duration ttl = Duration.ofSeconds(60);
        long purgeIntervalMs = 60_000;
    }

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Link {
        String scheme = "udss";
        String host = "localhost";
    }

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Scripts {
        String location = "transport-scripts";
        String signingKey;
    }

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class Provisioning {
        OpenStack openstack = new OpenStack();
    }

    @Data
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class OpenStack {
        String url;
        String username;
        String password;
        String project;
        String domain = "Default";
        Duration tokenLifetime = Duration.ofHours(2);
        Duration requestTimeout = Duration.ofSeconds(30);
    }
}
