package com.govinsights.payrollcatalog.application.ingest.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 급여 워크북 import 요청 DTO.
 *
 * @param fiscalYear 적재할 회계연도
 */
public record PayrollImportRequest(
        @NotNull @Min(2000) @Max(2100) Integer fiscalYear
) {}
