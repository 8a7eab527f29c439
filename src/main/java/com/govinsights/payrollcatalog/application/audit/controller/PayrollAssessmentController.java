package com.govinsights.payrollcatalog.application.audit.controller;

import com.govinsights.payrollcatalog.application.audit.PayrollAuditService;
import com.govinsights.payrollcatalog.application.audit.dto.DatasetAssessment;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 급여 워크북 진단 관리자 API 컨트롤러.
 */
@RestController
@RequestMapping("/api/admin/payroll")
@Validated
public class PayrollAssessmentController {
    private final PayrollAuditService service;

    public PayrollAssessmentController(PayrollAuditService service) {
        this.service = service;
    }

    /**
     * 회계연도 워크북의 구조와 데이터 품질을 진단한다(적재하지 않음).
     *
     * @param fiscalYear 회계연도(2000~2100)
     * @return 진단 결과
     */
    @GetMapping("/assessment/{fiscalYear}")
    public Mono<DatasetAssessment> assess(@PathVariable @Min(2000) @Max(2100) int fiscalYear) {
        return service.assess(fiscalYear);
    }
}
