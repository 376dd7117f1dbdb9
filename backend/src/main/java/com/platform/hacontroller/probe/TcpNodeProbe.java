package com.platform.hacontroller.probe;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.TransientProbeException;
import com.platform.hacontroller.model.HealthResult;
import com.platform.hacontroller.model.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Liveness only: a node is healthy if its port accepts a TCP connection. Lag is not known.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hacontroller.probe.type", havingValue = "tcp", matchIfMissing = true)
public class TcpNodeProbe implements NodeProbe {

    private final int connectTimeoutMs;

    public TcpNodeProbe(HaControllerProperties properties) {
        this.connectTimeoutMs = (int) properties.getProbe().getTimeout().toMillis();
    }

    @Override
    public HealthResult probe(Node node) {
        HostAndPort target = NodeProbe.parseAddress(node.address(), 3306);
        long start = System.currentTimeMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(target.host(), target.port()), connectTimeoutMs);
            return HealthResult.healthy(null, System.currentTimeMillis() - start);
        } catch (IOException e) {
            throw new TransientProbeException(node.id(), "TCP connect to " + node.address() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getType() {
        return "tcp";
    }
}
