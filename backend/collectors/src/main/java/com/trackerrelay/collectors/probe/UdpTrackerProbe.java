package com.trackerrelay.collectors.probe;

import com.trackerrelay.collectors.config.ProbeConfig;
import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.core.model.TrackerScheme;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class UdpTrackerProbe implements TrackerProbe {
    private static final Logger LOGGER = Logger.getLogger(UdpTrackerProbe.class.getName());

    private final ProbeConfig config;
    private final SocketOpener socketOpener;
    private final IntSupplier transactionIds;

    public UdpTrackerProbe(ProbeConfig config) {
        this(config, DatagramSocket::new, () -> ThreadLocalRandom.current().nextInt());
    }

    public UdpTrackerProbe(ProbeConfig config, SocketOpener socketOpener, IntSupplier transactionIds) {
        this.config = config;
        this.socketOpener = socketOpener;
        this.transactionIds = transactionIds;
    }

    @Override
    public boolean supports(TrackerScheme scheme) {
        return scheme == TrackerScheme.UDP;
    }

    @Override
    public ProbeResult probe(String endpoint) {
        Optional<UdpTarget> parsed = UdpTarget.parse(endpoint);
        if (parsed.isEmpty()) {
            LOGGER.fine("Skipping malformed UDP tracker " + endpoint);
            return ProbeResult.dead(endpoint, Duration.ZERO);
        }
        UdpTarget target = parsed.get();
        byte[] request = UdpConnectRequest.encode(transactionIds.getAsInt());
        long startedAt = System.nanoTime();
        try (DatagramSocket socket = socketOpener.open()) {
            socket.setSoTimeout(Math.toIntExact(Math.max(1, config.timeout().toMillis())));
            socket.connect(InetAddress.getByName(target.host()), target.port());
            socket.send(new DatagramPacket(request, request.length));

            byte[] buffer = new byte[UdpConnectRequest.LENGTH];
            DatagramPacket response = new DatagramPacket(buffer, buffer.length);
            socket.receive(response);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            boolean alive = UdpConnectRequest.isAcceptableResponse(response.getLength());
            return ProbeResult.measured(endpoint, alive, elapsed, config.scoreWindow());
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "UDP probe failed for " + endpoint, e);
            return ProbeResult.dead(endpoint, config.timeout());
        }
    }

    @FunctionalInterface
    public interface SocketOpener {
        DatagramSocket open() throws SocketException;
    }
}
