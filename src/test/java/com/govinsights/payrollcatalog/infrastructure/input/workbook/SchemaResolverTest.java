package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import com.govinsights.payrollcatalog.application.common.error.StructuralException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link SchemaResolver} 단위 테스트.
 */
@DisplayName("스키마 해석 테스트")
class SchemaResolverTest {

    @DisplayName("시트 이름은 대소문자 구분 없이 부분 일치하는 첫 번째 시트")
    @Test
    void findSheet_caseInsensitiveContains_firstMatch() {
        List<String> sheets = List.of("README", "hr info fy2024", "HR INFO (old)", "EARNINGS");
        assertEquals(Optional.of("hr info fy2024"), SchemaResolver.findSheet(sheets, "HR INFO"));
        assertEquals(Optional.of("EARNINGS"), SchemaResolver.findSheet(sheets, "earnings"));
        assertEquals(Optional.empty(), SchemaResolver.findSheet(sheets, "DEDUCTIONS"));
    }

    @DisplayName("연도 접미사가 붙은 컬럼을 패턴으로 찾음")
    @Test
    void findColumn_matchesYearSuffixedLabel() {
        List<String> header = List.of("TEMPORARY_ID", "RECORD_NBR", "ACTIVE_ON_JUNE_30_2024");
        assertEquals(Optional.of("ACTIVE_ON_JUNE_30_2024"), SchemaResolver.findColumn(header, "ACTIVE_ON_JUNE_30"));
    }

    @DisplayName("필수 시트/컬럼이 없으면 StructuralException")
    @Test
    void require_missing_throwsStructuralException() {
        StructuralException e = assertThrows(StructuralException.class,
                () -> SchemaResolver.requireSheet("fiscal-year-2024.xlsx", List.of("HR INFO"), "EARNINGS"));
        assertEquals("fiscal-year-2024.xlsx", e.dataset());
        assertEquals("STRUCTURE_ERROR", e.code());

        assertThrows(StructuralException.class,
                () -> SchemaResolver.requireColumn("f.xlsx", "EARNINGS", List.of("NAME"), "TEMPORARY_ID"));
        assertEquals("TEMPORARY_ID",
                SchemaResolver.requireColumn("f.xlsx", "EARNINGS", List.of("NAME", "TEMPORARY_ID"), "TEMPORARY_ID"));
    }
}
