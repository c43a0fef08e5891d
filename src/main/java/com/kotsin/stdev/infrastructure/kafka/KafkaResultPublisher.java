package com.kotsin.stdev.infrastructure.kafka;

import com.kotsin.stdev.batch.ResultSink;
import com.kotsin.stdev.model.StdevResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes results to Kafka keyed by entity id.
 *
 * Sends are asynchronous; {@link #complete()} waits for all of them and fails if any did.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaResultPublisher implements ResultSink {

    private final KafkaTemplate<String, StdevResult> kafkaTemplate;
    private final String topic;
    private final Duration timeout;
    private final List<CompletableFuture<SendResult<String, StdevResult>>> pending = new ArrayList<>();

    @Override
    public void accept(StdevResult result) {
        pending.add(kafkaTemplate.send(topic, result.getEntityId(), result));
    }

    @Override
    public void complete() {
        int count = pending.size();
        try {
            kafkaTemplate.flush();
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing results to " + topic, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to publish results to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out after " + timeout + " publishing " + count
                + " results to " + topic, e);
        } finally {
            pending.clear();
        }
        log.info("📤 Published {} results to {}", count, topic);
    }
}
