package com.whereq.scribe.state;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Builder;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide aggregate counters over completed optimizations
 */
@Component
public class OptimizationStats {

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalWordsGenerated = new AtomicLong();
    private final AtomicLong totalImproved = new AtomicLong();
    private final AtomicLong lastRunTime = new AtomicLong();

    @Autowired
    private MeterRegistry meterRegistry;

    @PostConstruct
    public void initialize() {
        Gauge.builder("scribe.pages.processed", totalProcessed::get)
            .description("Pages optimized since startup")
            .register(meterRegistry);

        Gauge.builder("scribe.words.generated", totalWordsGenerated::get)
            .description("Words published since startup")
            .register(meterRegistry);

        Gauge.builder("scribe.pages.improved", totalImproved::get)
            .description("Pages whose final score reached the improvement threshold")
            .register(meterRegistry);
    }

    /**
     * Record a completed optimization
     */
    public void recordCompletion(int wordCount, long processingTime, boolean improved) {
        totalProcessed.incrementAndGet();
        totalWordsGenerated.addAndGet(wordCount);
        lastRunTime.set(processingTime);
        if (improved) {
            totalImproved.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        return Snapshot.builder()
            .totalProcessed(totalProcessed.get())
            .totalWordsGenerated(totalWordsGenerated.get())
            .totalImproved(totalImproved.get())
            .lastRunTime(lastRunTime.get())
            .build();
    }

    @Value
    @Builder
    public static class Snapshot {
        long totalProcessed;
        long totalWordsGenerated;
        long totalImproved;
        long lastRunTime;
    }
}
