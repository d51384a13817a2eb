package com.placement.controller;

import com.placement.config.JacksonConfig;
import com.placement.exception.StoreUnavailableException;
import com.placement.model.BatchResult;
import com.placement.model.DuplicateReport;
import com.placement.model.OfferBatch;
import com.placement.model.PlacementRecord;
import com.placement.model.PlacementStats;
import com.placement.model.Resolution;
import com.placement.model.RolePackage;
import com.placement.model.Student;
import com.placement.service.DuplicateJanitor;
import com.placement.service.IdentityResolver;
import com.placement.service.OfferBatchService;
import com.placement.service.PlacementStatsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PlacementControllerTest {

    @Mock private OfferBatchService offerBatchService;
    @Mock private IdentityResolver identityResolver;
    @Mock private DuplicateJanitor duplicateJanitor;
    @Mock private PlacementStatsService statsService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PlacementController controller =
                new PlacementController(offerBatchService, identityResolver, duplicateJanitor, statsService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(JacksonConfig.createObjectMapper()))
                .build();
    }

    @Test
    void reconcileReadsSnakeCaseBatch() throws Exception {
        when(offerBatchService.process(any()))
                .thenReturn(Optional.of(new BatchResult(1, 1, 0, 0, 0, List.of(), List.of(), 3)));

        String body = """
                {"batch_id": "b-7",
                 "offers": [{"company": "Acme",
                             "roles": [{"role": "SDE", "package": 12.5, "package_details": "CTC"}],
                             "students_selected": [{"name": "Alice", "enrollment_number": "E001",
                                                    "role": "SDE", "package": 12.5}],
                             "number_of_offers": 1,
                             "email_sender": "tpo@college.edu"}]}
                """;

        mockMvc.perform(post("/api/placements/reconcile").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.processing_time_ms").value(3));

        ArgumentCaptor<OfferBatch> captor = ArgumentCaptor.forClass(OfferBatch.class);
        verify(offerBatchService).process(captor.capture());
        OfferBatch batch = captor.getValue();
        assertThat(batch.batchId()).isEqualTo("b-7");
        assertThat(batch.offers().get(0).roles().get(0).packageValue()).isEqualByComparingTo("12.5");
        assertThat(batch.offers().get(0).studentsSelected().get(0).enrollmentNumber()).isEqualTo("E001");
    }

    @Test
    void reconcileReturnsConflictForReplayedBatch() throws Exception {
        when(offerBatchService.process(any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/placements/reconcile").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"batch_id\": \"b-7\", \"offers\": []}"))
                .andExpect(status().isConflict());
    }

    @Test
    void reconcileReturnsServiceUnavailableWhenStoreIsDown() throws Exception {
        when(offerBatchService.process(any())).thenThrow(new StoreUnavailableException("no primary"));

        mockMvc.perform(post("/api/placements/reconcile").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"offers\": []}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorKind").value("STORE_UNAVAILABLE"));
    }

    @Test
    void getCompanyReturnsCanonicalRecord() throws Exception {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        PlacementRecord record = new PlacementRecord("r1", "Acme",
                Map.of("SDE", new RolePackage("SDE", new BigDecimal("10.0"))),
                Map.of("E001", new Student("Alice", "E001", "SDE", new BigDecimal("10.0"))),
                now, now, 2L);
        when(identityResolver.resolve("Acme")).thenReturn(Resolution.one(record));

        mockMvc.perform(get("/api/placements/Acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("r1"))
                .andExpect(jsonPath("$.number_of_offers").value(1))
                .andExpect(jsonPath("$.students_selected.E001.enrollment_number").value("E001"));
    }

    @Test
    void getCompanyReturnsNotFoundForUnknownCompany() throws Exception {
        when(identityResolver.resolve("Nobody")).thenReturn(Resolution.none());

        mockMvc.perform(get("/api/placements/Nobody")).andExpect(status().isNotFound());
    }

    @Test
    void duplicatesAndStatsEndpoints() throws Exception {
        when(duplicateJanitor.scan()).thenReturn(List.of(new DuplicateReport("Acme", List.of("r2", "r1"), "r2")));
        when(statsService.computeStats()).thenReturn(new PlacementStats(2, 3,
                new BigDecimal("9.33"), new BigDecimal("10.00"), new BigDecimal("12"), List.of()));

        mockMvc.perform(get("/api/placements/duplicates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chosen_target_id").value("r2"));
        mockMvc.perform(get("/api/placements/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_students").value(3));
    }
}
