package com.flagship.revenue_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the ledger and the recognition engine.
 *
 * Metrics exposed:
 * - ledger.journal_entries.posted{source}: entries moved to POSTED (manual or recognition)
 * - ledger.journal_entries.voided: entries voided
 * - recognition.lines{outcome}: per-line outcome of recognition runs
 * - recognition.run.duration{mode}: wall time of a run, live or dry
 * - allocation.lines: contract lines that received an allocated price
 * - outbox.events{result}: publish attempts
 * - outbox.backlog / outbox.dead_letters: gauges refreshed by {@link MetricsScheduler}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter entriesVoided;
    private final Counter allocatedLines;
    private final AtomicLong outboxBacklog = new AtomicLong();
    private final AtomicLong outboxDeadLetters = new AtomicLong();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.entriesVoided = Counter.builder("ledger.journal_entries.voided")
            .description("Journal entries voided")
            .register(registry);
        this.allocatedLines = Counter.builder("allocation.lines")
            .description("Contract lines that received an allocated transaction price")
            .register(registry);
        Gauge.builder("outbox.backlog", outboxBacklog, AtomicLong::get)
            .description("Unpublished outbox events")
            .register(registry);
        Gauge.builder("outbox.dead_letters", outboxDeadLetters, AtomicLong::get)
            .description("Outbox events that exhausted their retries")
            .register(registry);
    }

    public void recordJournalEntryPosted(String source) {
        registry.counter("ledger.journal_entries.posted", "source", source).increment();
    }

    public void recordJournalEntryVoided() {
        entriesVoided.increment();
    }

    public void recordRecognitionLine(String outcome) {
        registry.counter("recognition.lines", "outcome", outcome).increment();
    }

    public void recordRecognitionRun(boolean dryRun, Duration duration) {
        Timer.builder("recognition.run.duration")
            .tag("mode", dryRun ? "dry_run" : "live")
            .publishPercentiles(0.5, 0.95)
            .register(registry)
            .record(duration);
    }

    public void recordAllocation(int lineCount) {
        allocatedLines.increment(lineCount);
    }

    public void recordOutboxPublished(String eventType) {
        registry.counter("outbox.events", "event_type", eventType, "result", "published").increment();
    }

    public void recordOutboxFailed(String eventType) {
        registry.counter("outbox.events", "event_type", eventType, "result", "failed").increment();
    }

    public void updateOutboxGauges(long backlog, long deadLetters) {
        outboxBacklog.set(backlog);
        outboxDeadLetters.set(deadLetters);
    }
}
