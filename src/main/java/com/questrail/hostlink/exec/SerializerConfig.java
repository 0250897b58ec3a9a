package com.questrail.hostlink.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Queue sizing and backpressure policy for {@link ExecutionSerializer}.
 *
 * @param queueCapacity  maximum number of queued commands, at least 1
 * @param queueFullPolicy behaviour when the queue is full
 * @param offerTimeout   maximum wait for space under {@link QueueFullPolicy#BLOCK}
 */
public record SerializerConfig(int queueCapacity, QueueFullPolicy queueFullPolicy, Duration offerTimeout) {

    public static final int DEFAULT_QUEUE_CAPACITY = 4096;
    public static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofMillis(250);

    public SerializerConfig {
        Objects.requireNonNull(queueFullPolicy, "queueFullPolicy");
        Objects.requireNonNull(offerTimeout, "offerTimeout");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must not be negative");
        }
    }

    public static SerializerConfig defaults() {
        return new SerializerConfig(DEFAULT_QUEUE_CAPACITY, QueueFullPolicy.REJECT, DEFAULT_OFFER_TIMEOUT);
    }

    public SerializerConfig withQueueCapacity(int capacity) {
        return new SerializerConfig(capacity, queueFullPolicy, offerTimeout);
    }

    public SerializerConfig withQueueFullPolicy(QueueFullPolicy policy) {
        return new SerializerConfig(queueCapacity, policy, offerTimeout);
    }

    public SerializerConfig withOfferTimeout(Duration timeout) {
        return new SerializerConfig(queueCapacity, queueFullPolicy, timeout);
    }
}
