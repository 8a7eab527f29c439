package com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.repo;

import com.govinsights.payrollcatalog.application.load.ConflictPolicy;
import com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.row.PayrollRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * {@link PayrollRepo} 단위 테스트.
 *
 * <p>충돌 정책별 SQL 생성, null-safe 바인딩, 파라미터 한도에 따른 statement 분할을
 * mock {@link DatabaseClient}로 검증한다.</p>
 */
@DisplayName("payroll repo 테스트")
class PayrollRepoTest {

    private static final List<String> KEY = List.of("temporary_id", "record_nbr", "fiscal_year");

    private DatabaseClient db;
    private DatabaseClient.GenericExecuteSpec spec;
    private PayrollRepo repo;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        db = mock(DatabaseClient.class);
        spec = mock(DatabaseClient.GenericExecuteSpec.class);
        FetchSpec<Map<String, Object>> fetch = mock(FetchSpec.class);

        when(db.sql(anyString())).thenReturn(spec);
        when(spec.bind(anyString(), any())).thenReturn(spec);
        when(spec.bindNull(anyString(), any())).thenReturn(spec);
        when(spec.fetch()).thenReturn(fetch);
        when(fetch.rowsUpdated()).thenAnswer(inv -> Mono.just(1L));

        repo = new PayrollRepo(db);
    }

    @DisplayName("SKIP 정책은 ON CONFLICT ... DO NOTHING")
    @Test
    void upsertSql_skip_doNothing() {
        String sql = PayrollRepo.upsertSql(2, KEY, ConflictPolicy.SKIP);

        assertTrue(sql.startsWith("INSERT INTO payroll (temporary_id, record_nbr, "));
        assertTrue(sql.contains("(:p0_0, :p0_1, "));
        assertTrue(sql.contains("(:p1_0, :p1_1, "));
        assertFalse(sql.contains(":p2_0"));
        assertTrue(sql.endsWith("ON CONFLICT (temporary_id, record_nbr, fiscal_year) DO NOTHING"));
    }

    @DisplayName("REPLACE 정책은 자연키 외 컬럼을 EXCLUDED 값으로 갱신")
    @Test
    void upsertSql_replace_updatesNonKeyColumns() {
        String sql = PayrollRepo.upsertSql(1, KEY, ConflictPolicy.REPLACE);

        assertTrue(sql.contains("DO UPDATE SET"));
        assertTrue(sql.contains("total_wages = EXCLUDED.total_wages"));
        assertTrue(sql.contains("employee_name = EXCLUDED.employee_name"));
        assertFalse(sql.contains("temporary_id = EXCLUDED.temporary_id"));
        assertFalse(sql.contains("fiscal_year = EXCLUDED.fiscal_year"));
        assertTrue(sql.contains("updated_at = now()"));
    }

    @DisplayName("insert는 충돌 처리 절이 없음")
    @Test
    void insertSql_hasNoConflictClause() {
        assertFalse(PayrollRepo.insertSql(3).contains("ON CONFLICT"));
    }

    @DisplayName("upsert 시 값은 bind, null은 컬럼 타입으로 bindNull")
    @Test
    void upsert_bindsValuesAndNulls() {
        PayrollRow row = row("A1", null);

        StepVerifier.create(repo.upsert(List.of(row), KEY, ConflictPolicy.SKIP))
                .expectNext(1L)
                .verifyComplete();

        int tid = PayrollRow.COLUMNS.indexOf("temporary_id");
        int nbr = PayrollRow.COLUMNS.indexOf("record_nbr");
        int fy = PayrollRow.COLUMNS.indexOf("fiscal_year");
        verify(spec).bind("p0_" + tid, "A1");
        verify(spec).bindNull("p0_" + nbr, Long.class);
        verify(spec).bind("p0_" + fy, 2024);
        long nonNull = row.values().stream().filter(v -> v != null).count();
        verify(spec, times((int) nonNull)).bind(anyString(), any());
        verify(spec, times(PayrollRow.COLUMNS.size() - (int) nonNull)).bindNull(anyString(), any());
    }

    @DisplayName("잘못된 자연키 컬럼이면 SQL을 실행하지 않고 error")
    @Test
    void upsert_unknownConflictField_errors() {
        StepVerifier.create(repo.upsert(List.of(row("A1", 1L)), List.of("temporary_id", "nope"), ConflictPolicy.SKIP))
                .expectError(IllegalArgumentException.class)
                .verify();

        verifyNoInteractions(db);
    }

    @DisplayName("파라미터 한도를 넘는 row 수는 여러 statement로 나누어 실행")
    @Test
    void insert_overChunk_splitsStatements() {
        List<PayrollRow> rows = new ArrayList<>();
        for (int i = 0; i < PayrollRepo.CHUNK + 1; i++) rows.add(row("T" + i, (long) i));

        StepVerifier.create(repo.insert(rows))
                .expectNext(2L)
                .verifyComplete();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(db, times(2)).sql(sql.capture());
        assertTrue(sql.getAllValues().get(1).contains(":p0_0"));
        assertFalse(sql.getAllValues().get(1).contains(":p1_0"));
        assertTrue(PayrollRepo.CHUNK * PayrollRow.COLUMNS.size() <= 65535);
    }

    @DisplayName("REPLACE 정책은 같은 자연키 row를 마지막 값 하나로 합쳐 한 번만 갱신")
    @Test
    void upsert_replace_collapsesDuplicateKeysToLast() {
        List<PayrollRow> rows = List.of(
                row("A1", 1L, "First"),
                row("B1", 1L, "Other"),
                row("A1", 1L, "Second")
        );

        StepVerifier.create(repo.upsert(rows, KEY, ConflictPolicy.REPLACE))
                .expectNext(1L)
                .verifyComplete();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(db).sql(sql.capture());
        assertTrue(sql.getValue().contains(":p1_0"));
        assertFalse(sql.getValue().contains(":p2_0"));

        int name = PayrollRow.COLUMNS.indexOf("employee_name");
        verify(spec).bind("p0_" + name, "Second");
        verify(spec).bind("p1_" + name, "Other");
        verify(spec, never()).bind(anyString(), eq("First"));
    }

    @DisplayName("record_nbr가 null인 row끼리도 같은 자연키로 합침")
    @Test
    void lastPerKey_treatsNullsAsEqual() {
        List<PayrollRow> rows = List.of(row("A1", null, "First"), row("A1", null, "Second"));

        List<PayrollRow> collapsed = PayrollRepo.lastPerKey(rows, KEY);

        assertEquals(1, collapsed.size());
        assertEquals("Second", collapsed.get(0).employeeName());
    }

    @DisplayName("SKIP 정책은 입력을 그대로 실행(DO NOTHING은 중복 자연키를 허용)")
    @Test
    void upsert_skip_keepsDuplicateRows() {
        List<PayrollRow> rows = List.of(row("A1", 1L, "First"), row("A1", 1L, "Second"));

        StepVerifier.create(repo.upsert(rows, KEY, ConflictPolicy.SKIP))
                .expectNext(1L)
                .verifyComplete();

        int name = PayrollRow.COLUMNS.indexOf("employee_name");
        verify(spec).bind("p0_" + name, "First");
        verify(spec).bind("p1_" + name, "Second");
    }

    private static PayrollRow row(String id, Long recordNbr) {
        return row(id, recordNbr, "Employee");
    }

    private static PayrollRow row(String id, Long recordNbr, String employeeName) {
        return new PayrollRow(
                id, recordNbr, employeeName, null, "Revenue",
                null, null, null, null, null, null, null, null, null,
                null, null, null, null,
                null, null, null,
                null, null, null,
                null, null, null,
                null, null, null,
                null, null, null,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.TEN,
                2024
        );
    }
}
