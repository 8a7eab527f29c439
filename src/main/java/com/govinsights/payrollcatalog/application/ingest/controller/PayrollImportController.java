package com.govinsights.payrollcatalog.application.ingest.controller;

import com.govinsights.payrollcatalog.application.ingest.PayrollIngestService;
import com.govinsights.payrollcatalog.application.ingest.dto.IngestSummary;
import com.govinsights.payrollcatalog.application.ingest.dto.PayrollImportRequest;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 급여 워크북 import 관리자 API 컨트롤러.
 *
 * <p>요청한 회계연도의 워크북을 읽어 payroll 테이블에 적재하고 결과 요약을 반환한다.</p>
 */
@RestController
@RequestMapping("/api/admin/payroll")
@Validated
public class PayrollImportController {
    private final PayrollIngestService service;

    public PayrollImportController(PayrollIngestService service) {
        this.service = service;
    }

    /**
     * 회계연도 워크북을 적재한다.
     *
     * @param request 회계연도(2000~2100)
     * @return 적재 결과 요약
     */
    @PostMapping("/import")
    public Mono<IngestSummary> importPayroll(@Valid @RequestBody PayrollImportRequest request) {
        return service.ingest(request.fiscalYear());
    }
}
