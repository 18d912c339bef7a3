package com.rebalance.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Layout and freshness thresholds of the file-based broker bridge.
 */
@Configuration
@ConfigurationProperties(prefix = "bridge")
@Data
@Validated
public class BridgeProperties {

    @NotBlank
    private String root = "./data/lean_bridge";

    @Min(1)
    private long heartbeatStaleSeconds = 10;

    @Min(1)
    private long snapshotStaleSeconds = 60;

    // Unprocessed commands older than this mark the leader channel unhealthy
    @Min(1)
    private long commandStaleSeconds = 30;

    // Commands older than this are treated as abandoned and no longer count against channel health
    @Min(1)
    private long commandIgnoreAfterSeconds = 600;

    @Min(5)
    private long commandExpirySeconds = 120;

    private LeaderProperties leader = new LeaderProperties();

    public Path rootPath() {
        return Path.of(root);
    }

    @Data
    public static class LeaderProperties {
        private boolean enabled = true;
    }
}
