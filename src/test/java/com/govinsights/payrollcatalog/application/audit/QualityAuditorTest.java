package com.govinsights.payrollcatalog.application.audit;

import com.govinsights.payrollcatalog.application.audit.AuditReport.DuplicateKey;
import com.govinsights.payrollcatalog.application.audit.AuditReport.GroupCount;
import com.govinsights.payrollcatalog.infrastructure.mapper.NormalizedRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link QualityAuditor} 단위 테스트.
 */
@DisplayName("품질 점검 테스트")
class QualityAuditorTest {

    private static final AuditCriteria CRITERIA = new AuditCriteria(
            List.of("temporary_id", "employee_name", "agency_name"),
            "agency_name",
            List.of("temporary_id", "record_nbr"),
            List.of("total_wages"),
            2
    );

    private final QualityAuditor auditor = new QualityAuditor();

    @DisplayName("필수 필드 누락, 그룹 카디널리티와 상위 그룹, 숫자 범위를 집계")
    @Test
    void audit_countsNullsGroupsAndRanges() {
        List<NormalizedRecord> records = List.of(
                rec("A1", 1L, "Ann", "Revenue", "100.00"),
                rec("A2", 1L, null, "Revenue", "250.50"),
                rec("A3", 1L, "  ", "Health", "0"),
                rec("A4", 1L, "Dan", null, null),
                rec("A5", 1L, "Eve", "Transportation", "75")
        );

        AuditReport report = auditor.audit(records, CRITERIA);

        assertEquals(5, report.recordCount());
        assertEquals(0L, report.nullCounts().get("temporary_id"));
        assertEquals(2L, report.nullCounts().get("employee_name"));
        assertEquals(1L, report.nullCounts().get("agency_name"));

        assertEquals(3, report.groupCardinality());
        assertEquals(List.of(new GroupCount("Revenue", 2), new GroupCount("Health", 1)), report.topGroups());

        AuditReport.NumericRange wages = report.ranges().get("total_wages");
        assertEquals(0, BigDecimal.ZERO.compareTo(wages.min()));
        assertEquals(0, new BigDecimal("250.50").compareTo(wages.max()));
        assertEquals(4, wages.count());

        assertTrue(report.unique());
        assertTrue(report.duplicates().isEmpty());
    }

    @DisplayName("유일성 필드 조합이 중복되면 조합과 등장 횟수를 보고(null 포함)")
    @Test
    void audit_reportsDuplicateKeys() {
        List<NormalizedRecord> records = List.of(
                rec("A1", 1L, "Ann", "Revenue", "1"),
                rec("A1", 1L, "Ann", "Revenue", "2"),
                rec("B1", null, "Bob", "Health", "3"),
                rec("B1", null, "Bob", "Health", "4"),
                rec("B1", null, "Bob", "Health", "5"),
                rec("A1", 2L, "Ann", "Revenue", "6")
        );

        AuditReport report = auditor.audit(records, CRITERIA);

        assertFalse(report.unique());
        assertEquals(List.of(
                new DuplicateKey(List.of("A1", 1L), 2),
                new DuplicateKey(Arrays.asList("B1", null), 3)
        ), report.duplicates());
    }

    @DisplayName("빈 입력은 카운트 0, 범위 없음, 유일")
    @Test
    void audit_empty() {
        AuditReport report = auditor.audit(List.of(), CRITERIA);

        assertEquals(0, report.recordCount());
        assertEquals(0, report.groupCardinality());
        assertTrue(report.unique());
        assertNull(report.ranges().get("total_wages").min());
        assertEquals(0, report.ranges().get("total_wages").count());
    }

    private static NormalizedRecord rec(String id, Long nbr, String name, String agency, String total) {
        Map<String, Object> m = new HashMap<>();
        m.put("temporary_id", id);
        m.put("record_nbr", nbr);
        m.put("employee_name", name);
        m.put("agency_name", agency);
        m.put("total_wages", total == null ? null : new BigDecimal(total));
        return NormalizedRecord.of(m);
    }
}
