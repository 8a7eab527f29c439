package com.govinsights.payrollcatalog.application.ingest.controller;

import com.govinsights.payrollcatalog.application.common.error.GlobalExceptionHandler;
import com.govinsights.payrollcatalog.application.common.error.NotFoundException;
import com.govinsights.payrollcatalog.application.common.error.StructuralException;
import com.govinsights.payrollcatalog.application.ingest.PayrollDatasetReader;
import com.govinsights.payrollcatalog.application.ingest.PayrollIngestService;
import com.govinsights.payrollcatalog.application.ingest.dto.IngestSummary;
import com.govinsights.payrollcatalog.application.load.FailedBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webflux.test.autoconfigure.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * {@link PayrollImportController} WebFlux 슬라이스 테스트.
 *
 * <p>요청 바디 검증, 응답 요약 구조, 구조 오류/파일 없음의 에러 바디를 검증한다.</p>
 */
@DisplayName("payroll import controller 테스트")
@WebFluxTest(controllers = PayrollImportController.class)
@Import(GlobalExceptionHandler.class)
class PayrollImportControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockitoBean
    PayrollIngestService service;

    @Test
    @DisplayName("회계연도를 주면 적재 결과 요약을 200으로 반환")
    void ok_returnsSummary() {
        // given
        var summary = new IngestSummary(
                2024, IngestSummary.Status.COMPLETED,
                4, 3, 3, 1, 2, 1,
                Map.of("compensation_rate", 1),
                2, 0, 1, 2,
                List.of(new FailedBatch(1, 2, 3, "insert failed")),
                null
        );
        when(service.ingest(2024)).thenReturn(Mono.just(summary));

        // when / then
        webTestClient.post()
                .uri("/api/admin/payroll/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"fiscalYear\":2024}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.fiscalYear").isEqualTo(2024)
                .jsonPath("$.status").isEqualTo("COMPLETED")
                .jsonPath("$.combinedRows").isEqualTo(3)
                .jsonPath("$.skippedRows").isEqualTo(1)
                .jsonPath("$.fieldAnomalies.compensation_rate").isEqualTo(1)
                .jsonPath("$.inserted").isEqualTo(2)
                .jsonPath("$.failed").isEqualTo(1)
                .jsonPath("$.failedBatches.length()").isEqualTo(1)
                .jsonPath("$.failedBatches[0].fromRow").isEqualTo(2)
                .jsonPath("$.failedBatches[0].message").isEqualTo("insert failed");

        verify(service).ingest(2024);
        verifyNoMoreInteractions(service);
    }

    @Test
    @DisplayName("회계연도 범위가 벗어나면 400 및 VALIDATION_ERROR")
    void badRequest_whenYearOutOfRange() {
        webTestClient.post()
                .uri("/api/admin/payroll/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"fiscalYear\":1999}") // @Min(2000) 위반
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.path").isEqualTo("/api/admin/payroll/import")
                .jsonPath("$.message").value(v -> assertThat(v.toString()).contains("fiscalYear"));

        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("회계연도가 없으면 400 및 VALIDATION_ERROR")
    void badRequest_whenYearMissing() {
        webTestClient.post()
                .uri("/api/admin/payroll/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");

        verifyNoInteractions(service);
    }

    @Test
    @DisplayName("필수 시트가 없으면 400 및 STRUCTURE_ERROR")
    void badRequest_whenStructuralError() {
        when(service.ingest(anyInt())).thenReturn(Mono.error(
                new StructuralException("fiscal-year-2024.xlsx", "no sheet matching 'EARNINGS'")));

        webTestClient.post()
                .uri("/api/admin/payroll/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"fiscalYear\":2024}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Bad Request")
                .jsonPath("$.code").isEqualTo(StructuralException.CODE)
                .jsonPath("$.message").value(v -> assertThat(v.toString()).contains("EARNINGS"));
    }

    @Test
    @DisplayName("워크북 파일이 없으면 404 및 DATASET_NOT_FOUND")
    void notFound_whenWorkbookMissing() {
        when(service.ingest(anyInt())).thenReturn(Mono.error(
                new NotFoundException("workbook not found: fiscal-year-2024.xlsx", PayrollDatasetReader.DATASET_NOT_FOUND)));

        webTestClient.post()
                .uri("/api/admin/payroll/import")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"fiscalYear\":2024}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.timestamp").exists()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.code").isEqualTo("DATASET_NOT_FOUND")
                .jsonPath("$.message").isEqualTo("workbook not found: fiscal-year-2024.xlsx");
    }
}
