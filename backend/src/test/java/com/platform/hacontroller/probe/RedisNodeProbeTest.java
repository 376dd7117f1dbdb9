package com.platform.hacontroller.probe;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RedisNodeProbeTest {

    @Test
    void masterHasNoLag() {
        String info = "# Replication\r\nrole:master\r\nconnected_slaves:2\r\n";

        assertThat(RedisNodeProbe.parseLag(info)).isEqualTo(Duration.ZERO);
    }

    @Test
    void replicaLagComesFromLastIo() {
        String info = "# Replication\r\nrole:slave\r\nmaster_host:10.0.0.4\r\nmaster_link_status:up\r\n"
            + "master_last_io_seconds_ago:7\r\n";

        assertThat(RedisNodeProbe.parseLag(info)).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void replicaWithoutMasterLinkHasUnknownLag() {
        String info = "role:slave\nmaster_link_status:down\nmaster_last_io_seconds_ago:-1\n";

        assertThat(RedisNodeProbe.parseLag(info)).isNull();
    }

    @Test
    void hostAndPortParsing() {
        assertThat(NodeProbe.parseAddress("cache-2:6380", 6379))
            .isEqualTo(new NodeProbe.HostAndPort("cache-2", 6380));
        assertThat(NodeProbe.parseAddress("cache-2", 6379))
            .isEqualTo(new NodeProbe.HostAndPort("cache-2", 6379));
    }
}
