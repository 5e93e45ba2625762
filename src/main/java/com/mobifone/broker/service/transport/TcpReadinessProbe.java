package com.mobifone.broker.service.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/** A machine is ready when its listen port accepts a TCP connection within the timeout. */
@Slf4j
@Component
public class TcpReadinessProbe implements ReadinessProbe {

    @Override
    public boolean probe(String address, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("Probe {}:{} failed: {}", address, port, e.getMessage());
            return false;
        }
    }
}
