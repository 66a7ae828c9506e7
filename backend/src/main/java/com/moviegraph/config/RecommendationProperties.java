package com.moviegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunable recommendation policy. The weights only apply to the combined strategy.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "moviegraph.recommendation")
public class RecommendationProperties {
    private double genreWeight = 2.0;
    private double actorWeight = 3.0;
    private int defaultLimit = 5;
    private Duration queryTimeout = Duration.ofSeconds(10);

    // Blank means the server's default database
    private String database;
}
