package com.placement.repository;

import com.mongodb.client.result.UpdateResult;
import com.placement.config.AppMetrics;
import com.placement.exception.StoreUnavailableException;
import com.placement.model.InsertResult;
import com.placement.model.PlacementDocument;
import com.placement.model.PlacementRecord;
import com.placement.model.Student;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoPlacementRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private MongoTemplate mongoTemplate;
    @Mock private PlacementDocumentRepository repository;
    @Mock private AppMetrics metrics;

    private MongoPlacementRecordStore store;

    @BeforeEach
    void setUp() {
        store = new MongoPlacementRecordStore(mongoTemplate, repository, metrics, 2000, 2, 1L);
    }

    @Test
    @DisplayName("Should assign an id before inserting")
    void shouldAssignIdOnInsert() {
        when(mongoTemplate.insert(any(PlacementDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        InsertResult result = store.insert(record(null, 0L));

        ArgumentCaptor<PlacementDocument> captor = ArgumentCaptor.forClass(PlacementDocument.class);
        verify(mongoTemplate).insert(captor.capture());
        assertThat(result.status()).isEqualTo(InsertResult.Status.INSERTED);
        assertThat(result.id()).isNotBlank().isEqualTo(captor.getValue().getId());
        assertThat(captor.getValue().getStudentsSelected()).hasSize(1);
        assertThat(captor.getValue().getNumberOfOffers()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the same id across retries and treat a duplicate key as done")
    void shouldTreatDuplicateKeyAsAlreadyExists() {
        when(mongoTemplate.insert(any(PlacementDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("socket closed"))
                .thenThrow(new DuplicateKeyException("E11000"));

        InsertResult result = store.insert(record(null, 0L));

        ArgumentCaptor<PlacementDocument> captor = ArgumentCaptor.forClass(PlacementDocument.class);
        verify(mongoTemplate, times(2)).insert(captor.capture());
        assertThat(result.status()).isEqualTo(InsertResult.Status.ALREADY_EXISTS);
        assertThat(captor.getAllValues()).extracting(PlacementDocument::getId).containsOnly(result.id());
    }

    @Test
    @DisplayName("Should report a lost compare-and-swap as false")
    void shouldReturnFalseWhenVersionMoved() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(PlacementDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertThat(store.updateConditional("r1", 3L, record("r1", 3L))).isFalse();
        assertThat(store.updateConditional("r1", 4L, record("r1", 4L))).isTrue();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, times(2)).updateFirst(query.capture(), update.capture(), eq(PlacementDocument.class));
        assertThat(query.getAllValues().get(0).getQueryObject()).containsEntry("_id", "r1").containsEntry("version", 3L);
        assertThat(update.getAllValues().get(0).getUpdateObject().get("$inc", Document.class))
                .containsEntry("version", 1);
    }

    @Test
    @DisplayName("Should retry transient failures then give up with StoreUnavailableException")
    void shouldGiveUpAfterRetries() {
        when(mongoTemplate.executeCommand(any(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("no primary"));

        assertThatThrownBy(() -> store.ping())
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("after 3 attempts");
        verify(mongoTemplate, times(3)).executeCommand(any(Document.class));
    }

    @Test
    @DisplayName("Should not retry non-transient failures")
    void shouldNotRetryProgrammingErrors() {
        when(repository.findById("r1")).thenThrow(new InvalidDataAccessApiUsageException("bad query"));

        assertThatThrownBy(() -> store.findById("r1")).isInstanceOf(InvalidDataAccessApiUsageException.class);
        verify(repository, times(1)).findById("r1");
    }

    @Test
    @DisplayName("Should map documents back to records")
    void shouldMapDocumentsToRecords() {
        PlacementDocument document = PlacementDocument.fromRecord(record("r1", 7L));
        when(mongoTemplate.find(any(Query.class), eq(PlacementDocument.class))).thenReturn(List.of(document));

        List<PlacementRecord> records = store.findByCompany("Acme");

        assertThat(records).singleElement().satisfies(r -> {
            assertThat(r.id()).isEqualTo("r1");
            assertThat(r.version()).isEqualTo(7L);
            assertThat(r.studentsSelected().get("E001").packageValue()).isEqualByComparingTo("10.0");
        });
    }

    private static PlacementRecord record(String id, long version) {
        return new PlacementRecord(id, "Acme", Map.of(),
                Map.of("E001", new Student("Alice", "E001", "SDE", new BigDecimal("10.0"))),
                NOW, NOW, version);
    }
}
