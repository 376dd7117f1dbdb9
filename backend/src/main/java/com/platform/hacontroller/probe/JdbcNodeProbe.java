package com.platform.hacontroller.probe;

import com.platform.hacontroller.config.HaControllerProperties;
import com.platform.hacontroller.error.TransientProbeException;
import com.platform.hacontroller.model.HealthResult;
import com.platform.hacontroller.model.Node;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MySQL probe: {@code SELECT 1} for liveness, replica status for lag.
 * Keeps a small Hikari pool per node. A replica that is not replicating fails the
 * probe, so it is never ranked by a lag it no longer has.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "hacontroller.probe.type", havingValue = "jdbc")
public class JdbcNodeProbe implements NodeProbe {

    private final Map<String, HikariDataSource> dataSources = new ConcurrentHashMap<>();
    private final HaControllerProperties.Probe config;

    public JdbcNodeProbe(HaControllerProperties properties) {
        this.config = properties.getProbe();
    }

    @Override
    public HealthResult probe(Node node) {
        long start = System.currentTimeMillis();
        HikariDataSource dataSource = dataSources.computeIfAbsent(node.id(), id -> createDataSource(node));

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout((int) Math.max(1, config.getTimeout().toSeconds()));
            try (ResultSet rs = stmt.executeQuery("SELECT 1")) {
                if (!rs.next()) {
                    throw new TransientProbeException(node.id(), "SELECT 1 returned no row");
                }
            }
            Duration lag = node.isPrimary() ? Duration.ZERO : replicationLag(node.id(), stmt);
            return HealthResult.healthy(lag, System.currentTimeMillis() - start);
        } catch (SQLException e) {
            throw new TransientProbeException(node.id(), "MySQL probe failed: " + e.getMessage(), e);
        }
    }

    /**
     * Seconds behind the source.
     *
     * @throws TransientProbeException if the node has no replica status or its replication is stopped
     */
    static Duration replicationLag(String nodeId, Statement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery("SHOW REPLICA STATUS")) {
            return readLag(nodeId, rs, "Seconds_Behind_Source");
        } catch (SQLException e) {
            // servers before 8.0.22 only know the old syntax
            log.debug("SHOW REPLICA STATUS unsupported, falling back: {}", e.getMessage());
            try (ResultSet rs = stmt.executeQuery("SHOW SLAVE STATUS")) {
                return readLag(nodeId, rs, "Seconds_Behind_Master");
            }
        }
    }

    private static Duration readLag(String nodeId, ResultSet rs, String column) throws SQLException {
        if (!rs.next()) {
            throw new TransientProbeException(nodeId, "No replica status, node is not replicating");
        }
        long seconds = rs.getLong(column);
        if (rs.wasNull()) {
            throw new TransientProbeException(nodeId, column + " is NULL, replication is not running");
        }
        return Duration.ofSeconds(seconds);
    }

    private HikariDataSource createDataSource(Node node) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("probe-" + node.id());
        hikari.setJdbcUrl("jdbc:mysql://" + node.address() + "/");
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMinimumIdle(0);
        hikari.setMaximumPoolSize(2);
        hikari.setConnectionTimeout(Math.max(250, config.getTimeout().toMillis()));
        hikari.setValidationTimeout(Math.max(250, config.getTimeout().toMillis()));
        hikari.setInitializationFailTimeout(-1);
        hikari.setConnectionTestQuery("SELECT 1");
        return new HikariDataSource(hikari);
    }

    @Override
    public void release(String nodeId) {
        HikariDataSource dataSource = dataSources.remove(nodeId);
        if (dataSource != null) {
            dataSource.close();
            log.info("Closed probe pool for {}", nodeId);
        }
    }

    @PreDestroy
    public void closeAll() {
        dataSources.keySet().forEach(this::release);
    }

    @Override
    public String getType() {
        return "jdbc";
    }
}
