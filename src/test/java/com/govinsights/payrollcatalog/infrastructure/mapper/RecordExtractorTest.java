package com.govinsights.payrollcatalog.infrastructure.mapper;

import com.govinsights.payrollcatalog.infrastructure.input.workbook.RawRow;
import com.govinsights.payrollcatalog.infrastructure.mapper.RecordExtractor.ExtractionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RecordExtractor} 단위 테스트.
 *
 * <p>스키마의 모든 필드가 결과에 존재하는지, 해석 불가 셀이 필드별로 집계되는지,
 * 연도별 컬럼 라벨이 반영되는지를 검증한다.</p>
 */
@DisplayName("레코드 추출 테스트")
class RecordExtractorTest {

    @DisplayName("roster 행을 스키마 필드 전체를 가진 레코드로 변환")
    @Test
    void extract_roster_fillsEveryField() {
        Map<String, Object> cells = new HashMap<>();
        cells.put("TEMPORARY_ID", " A1 ");
        cells.put("RECORD_NBR", 0.0);
        cells.put("EMPLOYEE_NAME", "Doe, Jane");
        cells.put("AGENCY_NAME", "-");
        cells.put("COMPENSATION_RATE", "1,250.75");
        cells.put("SALARY_GRADE_RANGE", "n/a");
        cells.put("ACTIVE_ON_JUNE_30_2024", "Y");

        ExtractionResult result = RecordExtractor.extract(
                List.of(RawRow.fromValues(cells)).iterator(),
                PayrollSchemas.roster("ACTIVE_ON_JUNE_30_2024"));

        assertEquals(1, result.rowsRead());
        NormalizedRecord r = result.records().get(0);

        assertEquals(PayrollSchemas.ROSTER.fieldNames().size(), r.fields().size());
        assertEquals("A1", r.get("temporary_id"));
        assertEquals(0L, r.get("record_nbr"));
        assertEquals("Doe, Jane", r.get("employee_name"));
        assertNull(r.get("agency_name"));
        assertEquals(0, new BigDecimal("1250.75").compareTo((BigDecimal) r.get("compensation_rate")));
        assertNull(r.get("salary_grade_range"));
        assertNull(r.get("job_title"));
        assertEquals("Y", r.get("active_on_june_30"));

        assertEquals(Map.of("salary_grade_range", 1), result.anomaliesByField());
        assertEquals(1, result.anomalies());
    }

    @DisplayName("재직 여부 컬럼이 없으면 해당 필드는 null")
    @Test
    void extract_withoutActiveColumn_leavesFieldNull() {
        ExtractionResult result = RecordExtractor.extract(
                List.of(RawRow.fromValues(Map.of("TEMPORARY_ID", "A1", "ACTIVE_ON_JUNE_30_2023", "Y"))).iterator(),
                PayrollSchemas.roster(null));

        NormalizedRecord r = result.records().get(0);
        assertTrue(r.has("active_on_june_30"));
        assertNull(r.get("active_on_june_30"));
    }

    @DisplayName("detail 금액은 비어 있거나 해석할 수 없으면 0")
    @Test
    void extract_detail_wagesDefaultToZero() {
        Map<String, Object> cells = new HashMap<>();
        cells.put("TEMPORARY_ID", "A1");
        cells.put("REGULAR_WAGES", " 1,234.50 ");
        cells.put("OVERTIME_WAGES", "-");
        cells.put("OTHER_WAGES", "");
        cells.put("TOTAL_WAGES", "oops");

        ExtractionResult result = RecordExtractor.extract(
                List.of(RawRow.fromValues(cells)).iterator(), PayrollSchemas.DETAIL);

        NormalizedRecord r = result.records().get(0);
        assertEquals(0, new BigDecimal("1234.50").compareTo((BigDecimal) r.get("regular_wages")));
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) r.get("overtime_wages")));
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) r.get("other_wages")));
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) r.get("total_wages")));
        assertEquals(Map.of("total_wages", 1), result.anomaliesByField());
    }

    @DisplayName("스키마에 없는 필드의 컬럼 변경은 거부")
    @Test
    void withColumn_unknownField_throws() {
        assertThrows(IllegalArgumentException.class, () -> PayrollSchemas.DETAIL.withColumn("nope", "X"));
    }
}
