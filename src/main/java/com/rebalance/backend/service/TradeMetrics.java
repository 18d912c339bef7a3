package com.rebalance.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

@Service
public class TradeMetrics {

    private final Counter fillsRecorded;
    private final Counter fallbacksLaunched;
    private final Counter runsStalled;
    private final Counter runsBlocked;
    private final Counter commandsWritten;

    public TradeMetrics(MeterRegistry meterRegistry) {
        this.fillsRecorded = Counter.builder("trade_fills_recorded_total").register(meterRegistry);
        this.fallbacksLaunched = Counter.builder("trade_fallbacks_launched_total").register(meterRegistry);
        this.runsStalled = Counter.builder("trade_runs_stalled_total").register(meterRegistry);
        this.runsBlocked = Counter.builder("trade_runs_blocked_total").register(meterRegistry);
        this.commandsWritten = Counter.builder("trade_bridge_commands_total").register(meterRegistry);
    }

    public void recordFill() {
        fillsRecorded.increment();
    }

    public void recordFallbackLaunched() {
        fallbacksLaunched.increment();
    }

    public void recordRunStalled() {
        runsStalled.increment();
    }

    public void recordRunBlocked() {
        runsBlocked.increment();
    }

    public void recordCommandsWritten(int count) {
        commandsWritten.increment(count);
    }
}
