package com.placement.route;

import com.placement.exception.StoreUnavailableException;
import com.placement.model.BatchResult;
import com.placement.model.Offer;
import com.placement.model.OfferBatch;
import com.placement.service.OfferBatchService;
import org.apache.camel.Exchange;
import org.apache.camel.Message;
import org.apache.camel.component.kafka.KafkaConstants;
import org.apache.camel.component.kafka.consumer.KafkaManualCommit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OfferBatchProcessor (Camel Processor).
 *
 * Tests verify:
 * - Batch extraction from Camel Exchange
 * - Delegation to OfferBatchService
 * - Kafka offset commit
 * - Error handling
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OfferBatchProcessorTest {

    @Mock private OfferBatchService offerBatchService;
    @Mock private Exchange exchange;
    @Mock private Message message;
    @Mock private KafkaManualCommit manualCommit;

    private OfferBatchProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new OfferBatchProcessor(offerBatchService);
        when(exchange.getIn()).thenReturn(message);
        when(message.getHeader(KafkaConstants.MANUAL_COMMIT)).thenReturn(manualCommit);
    }

    @Test
    @DisplayName("Should reconcile the batch and then commit the Kafka offset")
    void shouldProcessBatchAndCommitOffset() throws Exception {
        OfferBatch batch = createTestBatch();
        when(message.getBody(OfferBatch.class)).thenReturn(batch);
        when(offerBatchService.process(batch))
                .thenReturn(Optional.of(new BatchResult(1, 1, 0, 0, 0, List.of(), List.of(), 12)));

        processor.process(exchange);

        InOrder inOrder = inOrder(offerBatchService, manualCommit);
        inOrder.verify(offerBatchService).process(batch);
        inOrder.verify(manualCommit).commit();
        verify(message).setHeader(OfferBatchProcessor.BATCH_ID_HEADER, "batch-1");
    }

    @Test
    @DisplayName("Should still commit the offset for a duplicate batch")
    void shouldCommitForDuplicateBatch() throws Exception {
        OfferBatch batch = createTestBatch();
        when(message.getBody(OfferBatch.class)).thenReturn(batch);
        when(offerBatchService.process(batch)).thenReturn(Optional.empty());

        processor.process(exchange);

        verify(manualCommit).commit();
    }

    @Test
    @DisplayName("Should not commit and rethrow when the store is unavailable")
    void shouldRethrowBatchFailure() {
        OfferBatch batch = createTestBatch();
        when(message.getBody(OfferBatch.class)).thenReturn(batch);
        when(offerBatchService.process(batch)).thenThrow(new StoreUnavailableException("down"));

        assertThatThrownBy(() -> processor.process(exchange)).isInstanceOf(StoreUnavailableException.class);

        verify(manualCommit, never()).commit();
    }

    @Test
    @DisplayName("Should commit and skip an empty message")
    void shouldSkipEmptyMessage() throws Exception {
        when(message.getBody(OfferBatch.class)).thenReturn(null);

        processor.process(exchange);

        verifyNoInteractions(offerBatchService);
        verify(manualCommit).commit();
    }

    @Test
    @DisplayName("Should tolerate a missing manual commit header")
    void shouldHandleMissingCommitHeader() throws Exception {
        OfferBatch batch = createTestBatch();
        when(message.getBody(OfferBatch.class)).thenReturn(batch);
        when(message.getHeader(KafkaConstants.MANUAL_COMMIT)).thenReturn(null);
        when(offerBatchService.process(batch)).thenReturn(Optional.of(BatchResult.empty()));

        processor.process(exchange);

        verify(offerBatchService).process(batch);
    }

    private OfferBatch createTestBatch() {
        return new OfferBatch("batch-1", List.of(new Offer("Acme", List.of(), List.of())));
    }
}
