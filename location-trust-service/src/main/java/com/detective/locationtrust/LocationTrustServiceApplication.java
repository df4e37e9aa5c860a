package com.detective.locationtrust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Location-trust engine for Detective Anywhere.
 *
 * <p>Decides whether a player's GPS fix is close and trustworthy enough to discover an evidence
 * item, flags likely spoofed fixes using per-player history, and applies the scored, at-most-once
 * discovery to the game session. The request layer and session store are external; this
 * application wires the engine beans, configuration, metrics and health reporting.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.detective.locationtrust.config")
public class LocationTrustServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocationTrustServiceApplication.class, args);
    }
}
