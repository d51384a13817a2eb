package com.placement.route;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.placement.model.OfferBatch;
import org.apache.camel.LoggingLevel;
import org.apache.camel.builder.RouteBuilder;
import org.apache.camel.component.jackson.JacksonDataFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Apache Camel route consuming offer batches from Kafka.
 *
 * Flow:
 * 1. Consume from the offer batch topic (manual offset commit)
 * 2. Deserialize JSON to OfferBatch with the application's snake_case ObjectMapper
 * 3. Reconcile via OfferBatchProcessor
 * 4. Batches that keep failing go to the dead letter route
 */
@Component
public class OfferBatchRoute extends RouteBuilder {

    static final String ROUTE_ID = "offer-batch-consumer";

    private final ObjectMapper objectMapper;

    @Value("${app.kafka.topic.offer-batches:placement-offer-batches}")
    private String offerBatchesTopic;

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String kafkaBootstrapServers;

    @Value("${spring.kafka.consumer.group-id:placement-reconciler-group}")
    private String consumerGroupId;

    @Value("${spring.kafka.consumer.max-poll-records:50}")
    private int maxPollRecords;

    @Value("${camel.route.autostart:false}")
    private boolean autoStartRoute;

    public OfferBatchRoute(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void configure() throws Exception {

        // ═══════════════════════════════════════════════════════════════
        // Global error handler with Dead Letter Channel
        // ═══════════════════════════════════════════════════════════════
        errorHandler(deadLetterChannel("direct:dlq")
                .maximumRedeliveries(3)
                .redeliveryDelay(1000)
                .useExponentialBackOff()
                .retryAttemptedLogLevel(LoggingLevel.WARN)
                .logRetryAttempted(true)
                .logExhausted(true)
                .useOriginalMessage());

        // ═══════════════════════════════════════════════════════════════
        // Dead Letter Queue Route
        // ═══════════════════════════════════════════════════════════════
        from("direct:dlq")
                .routeId("offer-batch-dlq-route")
                .log(LoggingLevel.ERROR, "DLQ: Failed to reconcile batch after retries: ${exception.message}")
                .process("deadLetterProcessor");

        // ═══════════════════════════════════════════════════════════════
        // Main Kafka Consumer Route
        // ═══════════════════════════════════════════════════════════════
        from(buildKafkaUri())
                .routeId(ROUTE_ID)
                .autoStartup(autoStartRoute)

                // trace ids first, so every later log line carries them
                .process("traceIdProcessor")

                .onCompletion()
                        .process(TraceIdProcessor::clearTraceContext)
                .end()

                .log(LoggingLevel.INFO, "Received offer batch from ${headers.kafka.TOPIC} "
                        + "partition ${headers.kafka.PARTITION} offset ${headers.kafka.OFFSET}")

                .unmarshal(new JacksonDataFormat(objectMapper, OfferBatch.class))

                .process("offerBatchProcessor")

                .log(LoggingLevel.INFO, "Successfully reconciled batch ${headers.batchId}");
    }

    /**
     * Build the Kafka consumer URI with all configuration options.
     */
    String buildKafkaUri() {
        return String.format(
                "kafka:%s?" +
                "brokers=%s" +
                "&groupId=%s" +
                "&maxPollRecords=%d" +
                "&autoOffsetReset=earliest" +
                "&autoCommitEnable=false" +          // Manual commit
                "&allowManualCommit=true" +
                "&breakOnFirstError=true" +          // Redeliver the failed batch before moving on
                "&sessionTimeoutMs=30000" +
                "&maxPollIntervalMs=600000" +
                "&consumersCount=1",
                offerBatchesTopic,
                kafkaBootstrapServers,
                consumerGroupId,
                maxPollRecords
        );
    }
}
