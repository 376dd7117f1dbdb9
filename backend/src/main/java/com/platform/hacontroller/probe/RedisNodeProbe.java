package com.platform.hacontroller.probe;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.TransientProbeException;
import com.platform.hacontroller.model.HealthResult;
import com.platform.hacontroller.model.Node;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis probe: {@code PING} for liveness and {@code INFO replication} for lag.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hacontroller.probe.type", havingValue = "redis")
public class RedisNodeProbe implements NodeProbe {

    private final Map<String, RedisClient> clients = new ConcurrentHashMap<>();
    private final Map<String, StatefulRedisConnection<String, String>> connections = new ConcurrentHashMap<>();
    private final HaControllerProperties.Probe config;

    public RedisNodeProbe(HaControllerProperties properties) {
        this.config = properties.getProbe();
    }

    @Override
    public HealthResult probe(Node node) {
        long start = System.currentTimeMillis();
        try {
            StatefulRedisConnection<String, String> conn = connection(node);
            String pong = conn.sync().ping();
            if (!"PONG".equals(pong)) {
                throw new TransientProbeException(node.id(), "Unexpected PING response: " + pong);
            }
            Duration lag = parseLag(conn.sync().info("replication"));
            return HealthResult.healthy(lag, System.currentTimeMillis() - start);
        } catch (RedisException e) {
            dropConnection(node.id());
            throw new TransientProbeException(node.id(), "Redis probe failed: " + e.getMessage(), e);
        }
    }

    /**
     * Zero for a master, {@code master_last_io_seconds_ago} for a replica,
     * null when the replica has no link to its master.
     */
    static Duration parseLag(String info) {
        String role = null;
        Long lastIo = null;
        for (String line : info.split("\r?\n")) {
            String[] parts = line.trim().split(":", 2);
            if (parts.length != 2) {
                continue;
            }
            if ("role".equals(parts[0])) {
                role = parts[1].trim();
            } else if ("master_last_io_seconds_ago".equals(parts[0])) {
                long value = Long.parseLong(parts[1].trim());
                lastIo = value >= 0 ? value : null;
            }
        }
        if ("master".equals(role)) {
            return Duration.ZERO;
        }
        return lastIo != null ? Duration.ofSeconds(lastIo) : null;
    }

    private StatefulRedisConnection<String, String> connection(Node node) {
        return connections.computeIfAbsent(node.id(), id -> {
            NodeProbe.HostAndPort target = NodeProbe.parseAddress(node.address(), 6379);
            RedisURI.Builder uri = RedisURI.builder()
                .withHost(target.host())
                .withPort(target.port())
                .withTimeout(config.getTimeout());
            if (config.getPassword() != null && !config.getPassword().isEmpty()) {
                uri.withPassword(config.getPassword().toCharArray());
            }
            RedisClient client = clients.computeIfAbsent(id, k -> RedisClient.create(uri.build()));
            return client.connect();
        });
    }

    private void dropConnection(String nodeId) {
        StatefulRedisConnection<String, String> conn = connections.remove(nodeId);
        if (conn != null) {
            conn.closeAsync();
        }
    }

    @Override
    public void release(String nodeId) {
        dropConnection(nodeId);
        RedisClient client = clients.remove(nodeId);
        if (client != null) {
            client.shutdownAsync();
        }
    }

    @PreDestroy
    public void closeAll() {
        clients.keySet().forEach(this::release);
    }

    @Override
    public String getType() {
        return "redis";
    }
}
