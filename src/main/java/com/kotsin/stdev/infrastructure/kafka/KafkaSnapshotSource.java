package com.kotsin.stdev.infrastructure.kafka;

import com.kotsin.stdev.batch.SnapshotSource;
import com.kotsin.stdev.model.Snapshot;
import com.kotsin.stdev.util.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads snapshots from a Kafka topic for one batch.
 *
 * The topic is read from the beginning up to the end offsets seen when the fetch starts, so a
 * batch sees a fixed set of records even while producers keep writing. Records outside the
 * requested range are dropped; the rest are sorted by entity id and timestamp.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaSnapshotSource implements SnapshotSource {

    private static final Comparator<Snapshot> ENTITY_TIME_ORDER =
        Comparator.comparing(Snapshot::getEntityId).thenComparing(Snapshot::getTimestamp);

    private final Supplier<Consumer<String, Snapshot>> consumerSupplier;
    private final String topic;
    private final Duration pollTimeout;
    private final int maxEmptyPolls;

    @Override
    public Stream<Snapshot> fetch(Instant from, Instant to) {
        List<Snapshot> snapshots = new ArrayList<>();
        long recordsRead = 0;

        try (Consumer<String, Snapshot> consumer = consumerSupplier.get()) {
            List<TopicPartition> partitions = partitions(consumer);
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);
            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);

            int emptyPolls = 0;
            while (!reachedEnd(consumer, endOffsets)) {
                ConsumerRecords<String, Snapshot> records = consumer.poll(pollTimeout);
                if (records.isEmpty()) {
                    if (++emptyPolls >= maxEmptyPolls) {
                        throw new IllegalStateException("Gave up reading topic " + topic + " after "
                            + emptyPolls + " empty polls before reaching end offsets " + endOffsets);
                    }
                    continue;
                }
                emptyPolls = 0;

                for (ConsumerRecord<String, Snapshot> record : records) {
                    TopicPartition tp = new TopicPartition(record.topic(), record.partition());
                    if (record.offset() >= endOffsets.getOrDefault(tp, 0L)) {
                        continue;
                    }
                    recordsRead++;
                    Snapshot snapshot = record.value();
                    if (snapshot == null) {
                        log.debug("Skipping tombstone at {}@{}", tp, record.offset());
                        continue;
                    }
                    if (!ValidationUtils.isRoutable(snapshot)) {
                        throw new IllegalArgumentException("Snapshot without entity id or timestamp at "
                            + tp + "@" + record.offset());
                    }
                    Instant timestamp = snapshot.getTimestamp();
                    if (!timestamp.isBefore(from) && !timestamp.isAfter(to)) {
                        snapshots.add(snapshot);
                    }
                }
            }
        }

        snapshots.sort(ENTITY_TIME_ORDER);
        log.info("📥 Read {} records from {}, {} snapshots in [{} .. {}]",
            recordsRead, topic, snapshots.size(), from, to);
        return snapshots.stream();
    }

    private List<TopicPartition> partitions(Consumer<String, Snapshot> consumer) {
        List<PartitionInfo> infos = consumer.partitionsFor(topic);
        if (infos == null || infos.isEmpty()) {
            throw new IllegalStateException("Snapshot topic " + topic + " has no partitions");
        }
        return infos.stream()
            .map(info -> new TopicPartition(info.topic(), info.partition()))
            .collect(Collectors.toList());
    }

    private static boolean reachedEnd(Consumer<String, Snapshot> consumer, Map<TopicPartition, Long> endOffsets) {
        for (Map.Entry<TopicPartition, Long> entry : endOffsets.entrySet()) {
            if (consumer.position(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }
}
