package com.frontier.outpost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Outpost Sync Application.
 *
 * Control plane for the outpost fleet: logs in to each node, exports and
 * imports inventory between pairs of nodes and keeps an audit of every run.
 * The fleet is declared under app.outposts.nodes.
 */
@SpringBootApplication
public class OutpostSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutpostSyncApplication.class, args);
    }
}
