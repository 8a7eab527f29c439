package com.govinsights.payrollcatalog.config;

import com.govinsights.payrollcatalog.application.join.DuplicateKeyPolicy;
import com.govinsights.payrollcatalog.application.load.ConflictPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.List;

/**
 * 급여 워크북 ingest 설정({@code payroll.ingest.*}).
 *
 * <pre>
 * payroll:
 *   ingest:
 *     workbook-dir: ./minnesota_gov/State Payrole
 *     file-name-pattern: fiscal-year-%d.xlsx
 *     fiscal-years: [2020, 2021, 2022, 2023, 2024, 2025]
 *     batch-size: 1000
 *     conflict-policy: SKIP
 *     detail-duplicate-policy: LAST_WINS
 * </pre>
 *
 * @param workbookDir           워크북 파일 디렉터리
 * @param fileNamePattern       회계연도 → 파일명 패턴({@link String#format} 형식)
 * @param fiscalYears           러너가 처리할 회계연도 목록(순서대로 처리)
 * @param batchSize             적재 배치 크기
 * @param conflictPolicy        자연키 충돌 시 정책
 * @param detailDuplicatePolicy EARNINGS 시트의 중복 TEMPORARY_ID 처리 정책
 * @param rosterSheetPattern    roster 시트 이름 패턴
 * @param detailSheetPattern    detail 시트 이름 패턴
 * @param activeColumnPattern   연도별로 이름이 바뀌는 재직 여부 컬럼 패턴
 */
@ConfigurationProperties(prefix = "payroll.ingest")
public record PayrollIngestProperties(
        Path workbookDir,
        String fileNamePattern,
        List<Integer> fiscalYears,
        int batchSize,
        ConflictPolicy conflictPolicy,
        DuplicateKeyPolicy detailDuplicatePolicy,
        String rosterSheetPattern,
        String detailSheetPattern,
        String activeColumnPattern
) {
    public static final int DEFAULT_BATCH_SIZE = 1000;

    public PayrollIngestProperties {
        if (workbookDir == null) workbookDir = Path.of("minnesota_gov", "State Payrole");
        if (fileNamePattern == null || fileNamePattern.isBlank()) fileNamePattern = "fiscal-year-%d.xlsx";
        fiscalYears = fiscalYears == null ? List.of() : List.copyOf(fiscalYears);
        if (batchSize <= 0) batchSize = DEFAULT_BATCH_SIZE;
        if (conflictPolicy == null) conflictPolicy = ConflictPolicy.SKIP;
        if (detailDuplicatePolicy == null) detailDuplicatePolicy = DuplicateKeyPolicy.LAST_WINS;
        if (rosterSheetPattern == null || rosterSheetPattern.isBlank()) rosterSheetPattern = "HR INFO";
        if (detailSheetPattern == null || detailSheetPattern.isBlank()) detailSheetPattern = "EARNINGS";
        if (activeColumnPattern == null || activeColumnPattern.isBlank()) activeColumnPattern = "ACTIVE_ON_JUNE_30";
    }

    /** 모든 값을 기본값으로 채운 설정 */
    public static PayrollIngestProperties defaults() {
        return new PayrollIngestProperties(null, null, null, 0, null, null, null, null, null);
    }

    /**
     * 회계연도에 해당하는 워크북 파일명을 반환합니다.
     *
     * @param fiscalYear 회계연도
     * @return 파일명 (예: {@code fiscal-year-2024.xlsx})
     */
    public String fileNameFor(int fiscalYear) {
        return String.format(fileNamePattern, fiscalYear);
    }
}
