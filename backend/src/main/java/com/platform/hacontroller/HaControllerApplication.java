package com.platform.hacontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HA Controller Application
 *
 * Keeps a primary/replica data store writable and right-sized:
 * - Health probing and quorum-confirmed failure detection
 * - Fenced, least-lagged replica promotion
 * - Versioned write/read endpoint routing
 * - Metric-driven replica autoscaling
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class HaControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HaControllerApplication.class, args);
    }
}
