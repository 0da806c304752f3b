package io.github.jakubt4.skypointer.service;

import io.github.jakubt4.skypointer.dto.PointingRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;

/**
 * Sends encoded {@link PointingRecord}s as single UDP datagrams to the pointing hardware.
 */
@Slf4j
@Service
public class PointingTelemetrySender {

    private final String host;
    private final int port;

    private DatagramSocket socket;
    private InetAddress address;

    public PointingTelemetrySender(@Value("${skypointer.telemetry.udp.host:localhost}") final String host,
                                   @Value("${skypointer.telemetry.udp.port:10002}") final int port) {
        this.host = host;
        this.port = port;
    }

    @PostConstruct
    void init() throws SocketException, UnknownHostException {
        socket = new DatagramSocket();
        address = InetAddress.getByName(host);
        log.info("Pointing telemetry link initialized, target={}:{}", host, port);
    }

    @PreDestroy
    void destroy() {
        if (socket != null && !socket.isClosed()) {
            socket.close();
            log.info("Pointing telemetry link closed");
        }
    }

    /**
     * Transmits one record as US-ASCII.
     *
     * @throws IOException if the datagram cannot be sent; retried before giving up
     */
    @Retryable(retryFor = IOException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, maxDelay = 1000))
    public void send(final PointingRecord record) throws IOException {
        final var data = record.encode().getBytes(StandardCharsets.US_ASCII);
        socket.send(new DatagramPacket(data, data.length, address, port));
        log.debug("Sent {}", record.encode());
    }

    @Recover
    public void recoverSend(final IOException e, final PointingRecord record) {
        log.warn("Failed to send pointing record {} after retries: {}", record.encode(), e.getMessage());
    }
}
