package io.github.hotbrkm.mailqueue.agent.transport;

import io.github.hotbrkm.mailqueue.core.message.Transport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Counts transport calls by outcome under {@value #METRIC_NAME}.
 */
public class MeteredTransport implements Transport {

    public static final String METRIC_NAME = "mailqueue.transport.send";
    public static final String OUTCOME_TAG = "outcome";

    private final Transport delegate;
    private final MeterRegistry registry;

    public MeteredTransport(Transport delegate, MeterRegistry registry) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    @Override
    public boolean send(String recipientLine, String subject, String body, String headerBlock) {
        boolean accepted;
        try {
            accepted = delegate.send(recipientLine, subject, body, headerBlock);
        } catch (RuntimeException e) {
            record("error");
            throw e;
        }
        record(accepted ? "success" : "failure");
        return accepted;
    }

    private void record(String outcome) {
        registry.counter(METRIC_NAME, OUTCOME_TAG, outcome).increment();
    }
}
