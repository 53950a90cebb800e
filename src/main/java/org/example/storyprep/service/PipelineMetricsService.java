package org.example.storyprep.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class PipelineMetricsService {

    private final ConcurrentMap<String, LongAdder> extractionSucceededByMethod = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> chunkingByStrategy = new ConcurrentHashMap<>();
    private final LongAdder extractionFailed = new LongAdder();
    private final LongAdder chunkingFallbacks = new LongAdder();
    private final LongAdder storiesChunked = new LongAdder();
    private final LongAdder storiesFailed = new LongAdder();
    private final LongAdder storiesRetried = new LongAdder();
    private final LongAdder chunksDelivered = new LongAdder();
    private final LongAdder deliveryFailed = new LongAdder();
    private final LongAdder deliveryQueueEmpty = new LongAdder();
    private final LongAdder deliveryClaimsLost = new LongAdder();
    private final AtomicLong processingLatencyTotalMs = new AtomicLong(0);

    public void recordExtractionSucceeded(String method) {
        extractionSucceededByMethod.computeIfAbsent(method, key -> new LongAdder()).increment();
    }

    public void recordExtractionFailed() {
        extractionFailed.increment();
    }

    public void recordChunkingCompleted(String strategy) {
        chunkingByStrategy.computeIfAbsent(strategy, key -> new LongAdder()).increment();
    }

    public void recordChunkingFallback() {
        chunkingFallbacks.increment();
    }

    public void recordStoryChunked(long durationMs) {
        storiesChunked.increment();
        if (durationMs > 0) {
            processingLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordStoryFailed(long durationMs) {
        storiesFailed.increment();
        if (durationMs > 0) {
            processingLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordStoryRetried() {
        storiesRetried.increment();
    }

    public void recordChunkDelivered() {
        chunksDelivered.increment();
    }

    public void recordDeliveryFailed() {
        deliveryFailed.increment();
    }

    public void recordQueueEmpty() {
        deliveryQueueEmpty.increment();
    }

    public void recordDeliveryClaimLost() {
        deliveryClaimsLost.increment();
    }

    public Map<String, Object> snapshot() {
        long chunked = storiesChunked.sum();
        long failed = storiesFailed.sum();
        long measured = chunked + failed;
        long avgLatencyMs = measured == 0 ? 0 : processingLatencyTotalMs.get() / measured;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("extractionSucceededByMethod", sums(extractionSucceededByMethod));
        metrics.put("extractionFailed", extractionFailed.sum());
        metrics.put("chunkingByStrategy", sums(chunkingByStrategy));
        metrics.put("chunkingFallbacks", chunkingFallbacks.sum());
        metrics.put("storiesChunked", chunked);
        metrics.put("storiesFailed", failed);
        metrics.put("storiesRetried", storiesRetried.sum());
        metrics.put("processingAverageLatencyMs", avgLatencyMs);
        metrics.put("chunksDelivered", chunksDelivered.sum());
        metrics.put("deliveryFailed", deliveryFailed.sum());
        metrics.put("deliveryQueueEmpty", deliveryQueueEmpty.sum());
        metrics.put("deliveryClaimsLost", deliveryClaimsLost.sum());
        return metrics;
    }

    private static Map<String, Long> sums(Map<String, LongAdder> counters) {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((key, adder) -> result.put(key, adder.sum()));
        return result;
    }
}
