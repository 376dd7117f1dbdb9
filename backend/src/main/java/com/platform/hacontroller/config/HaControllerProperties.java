package com.platform.hacontroller.config;

import com.platform.hacontroller.model.NodeSpec;
import com.platform.hacontroller.telemetry.AggregationStatistic;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Controller configuration, bound from the {@code hacontroller.*} namespace.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "hacontroller")
public class HaControllerProperties {

    /**
     * Identity under which this controller instance submits its own observations.
     */
    private String observerId = "observer-local";

    @Valid
    private Probe probe = new Probe();

    @Valid
    private Detector detector = new Detector();

    @Valid
    private Promotion promotion = new Promotion();

    @Valid
    private Aggregator aggregator = new Aggregator();

    @Valid
    private Autoscale autoscale = new Autoscale();

    @Valid
    private Collaborator collaborator = new Collaborator();

    @Data
    public static class Probe {
        /** tcp, jdbc or redis. */
        private String type = "tcp";
        private Duration interval = Duration.ofSeconds(5);
        /** Must stay below the interval. */
        private Duration timeout = Duration.ofSeconds(2);
        private int suspectThreshold = 3;
        private int poolSize = 8;
        private String username;
        private String password;
    }

    @Data
    public static class Detector {
        /**
         * Every observer identity taking part in the quorum, including this one.
         */
        @NotEmpty
        private List<String> observers = new ArrayList<>(List.of("observer-local"));
        private Duration agreementWindow = Duration.ofSeconds(10);
    }

    @Data
    public static class Promotion {
        private Duration timeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration primaryAbsenceAlert = Duration.ofSeconds(60);
    }

    @Data
    public static class Aggregator {
        private Duration window = Duration.ofMinutes(5);
        /** No default; the statistic has to be chosen explicitly. */
        @NotNull
        private AggregationStatistic statistic;
    }

    @Data
    public static class Autoscale {
        private boolean enabled = true;
        private int minReplicas = 1;
        private int maxReplicas = 5;
        private double targetCpuPercent = 70.0;
        private double targetMemPercent = 80.0;
        private Duration stabilizationWindow = Duration.ofMinutes(5);
        private int scaleDownMaxCount = 1;
        private double scaleDownMaxFraction = 0.0;
    }

    @Data
    public static class Collaborator {
        /** in-memory or http. */
        private String type = "in-memory";
        private String baseUrl = "http://localhost:8090";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
        /** Nodes the in-memory collaborator starts with. */
        @Valid
        private List<NodeSpec> nodes = new ArrayList<>();
        /** Address pattern for replicas added by scale-up, %d is the replica ordinal. */
        private String replicaAddressTemplate = "replica-%d:3306";
    }
}
