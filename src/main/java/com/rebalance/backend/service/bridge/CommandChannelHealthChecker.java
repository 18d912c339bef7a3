package com.rebalance.backend.service.bridge;

import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.service.bridge.BridgeSnapshots.BridgeStatus;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PendingCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decides whether the leader session can take new commands: its status must be fresh and healthy and the
 * queue must not hold commands it has been ignoring.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommandChannelHealthChecker {

    private final BridgeProperties bridgeProperties;
    private final BridgeReader bridgeReader;
    private final Clock clock;

    public record ChannelHealth(boolean healthy, String reason, BridgeStatus status, int stuckCommands) {
    }

    public ChannelHealth check() {
        BridgeStatus status = bridgeReader.readStatus();
        if (!bridgeProperties.getLeader().isEnabled()) {
            return new ChannelHealth(false, "leader_disabled", status, 0);
        }
        if (status.stale()) {
            return new ChannelHealth(false, "bridge_status_stale", status, 0);
        }
        if (!status.isHealthy()) {
            return new ChannelHealth(false, "bridge_status_" + status.status(), status, 0);
        }
        int stuck = countStuckCommands(bridgeReader.listPendingCommands());
        if (stuck > 0) {
            log.warn("Leader command queue stuck count={}", stuck);
            return new ChannelHealth(false, "command_queue_stuck", status, stuck);
        }
        return new ChannelHealth(true, "ok", status, 0);
    }

    int countStuckCommands(List<PendingCommand> pending) {
        Instant now = Instant.now(clock);
        int stuck = 0;
        for (PendingCommand command : pending) {
            long ageSeconds = Duration.between(command.requestedAt(), now).getSeconds();
            if (ageSeconds >= bridgeProperties.getCommandStaleSeconds()
                    && ageSeconds < bridgeProperties.getCommandIgnoreAfterSeconds()) {
                stuck++;
            }
        }
        return stuck;
    }
}
