package com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.repo;

import com.govinsights.payrollcatalog.application.load.ConflictPolicy;
import com.govinsights.payrollcatalog.application.load.RecordStore;
import com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.row.PayrollRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * payroll 테이블에 대한 배치 upsert/insert 기능을 제공하는 Repository입니다.
 * <p>
 * 자연키 {@code (temporary_id, record_nbr, fiscal_year)}에는
 * {@code UNIQUE NULLS NOT DISTINCT} 제약이 걸려 있어 record_nbr가 null인 row도 한 번만 저장됩니다.
 */
@Component
public class PayrollRepo extends BatchSqlSupport implements RecordStore<PayrollRow> {

    /** PostgreSQL 바인딩 파라미터 한도(65535) 안에 들어가는 statement당 최대 row 수 */
    static final int CHUNK = 65535 / PayrollRow.COLUMNS.size();

    private static final Logger log = LoggerFactory.getLogger(PayrollRepo.class);

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 배치 SQL 실행 기반을 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public PayrollRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * row 목록을 upsert 합니다.
     * <p>
     * SKIP이면 {@code ON CONFLICT ... DO NOTHING}, REPLACE이면 자연키 외 컬럼을
     * {@code EXCLUDED} 값으로 갱신합니다.
     * <p>
     * PostgreSQL은 한 statement에서 같은 row를 두 번 갱신할 수 없으므로,
     * REPLACE일 때는 입력 안의 같은 자연키 row를 마지막 값 하나로 합친 뒤 실행합니다.
     *
     * @param rows           저장할 row
     * @param conflictFields 자연키 컬럼명(모두 payroll 컬럼이어야 함)
     * @param policy         충돌 정책
     * @return 영향을 받은 행 수(SKIP이면 신규 insert 수)
     */
    @Override
    public Mono<Long> upsert(List<PayrollRow> rows, List<String> conflictFields, ConflictPolicy policy) {
        if (conflictFields == null || conflictFields.isEmpty()
                || !PayrollRow.COLUMNS.containsAll(conflictFields)) {
            return Mono.error(new IllegalArgumentException("Invalid conflict fields: " + conflictFields));
        }
        List<PayrollRow> target = policy == ConflictPolicy.REPLACE ? lastPerKey(rows, conflictFields) : rows;
        return chunkedSum(target, CHUNK, chunk -> executeOnce(chunk, upsertSql(chunk.size(), conflictFields, policy)));
    }

    /**
     * 충돌 처리 없이 insert 합니다. 자연키가 이미 있으면 unique 제약 위반 오류가 발생합니다.
     *
     * @param rows 저장할 row
     * @return 영향을 받은 행 수
     */
    @Override
    public Mono<Long> insert(List<PayrollRow> rows) {
        return chunkedSum(rows, CHUNK, chunk -> executeOnce(chunk, insertSql(chunk.size())));
    }

    /**
     * 자연키가 같은 row를 마지막 값 하나로 합칩니다. 결과 순서는 각 자연키가 처음 나온 순서입니다.
     *
     * @param rows      입력 row
     * @param keyFields 자연키 컬럼명
     * @return 자연키당 row 하나
     */
    static List<PayrollRow> lastPerKey(List<PayrollRow> rows, List<String> keyFields) {
        if (rows == null || rows.size() < 2) return rows;

        int[] idx = keyFields.stream().mapToInt(PayrollRow.COLUMNS::indexOf).toArray();
        Map<List<Object>, PayrollRow> byKey = new LinkedHashMap<>();
        for (PayrollRow r : rows) {
            List<Object> values = r.values();
            List<Object> key = new ArrayList<>(idx.length);
            for (int i : idx) key.add(values.get(i));
            byKey.put(key, r);
        }
        if (byKey.size() == rows.size()) return rows;

        log.warn("{} rows share a natural key with a later row in the same batch; keeping the last", rows.size() - byKey.size());
        return new ArrayList<>(byKey.values());
    }

    private Mono<Long> executeOnce(List<PayrollRow> rows, String sql) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        spec = bindRows(spec, rows.stream().map(PayrollRow::values).toList(), PayrollRow.TYPES);
        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rowCount) {
        return "INSERT INTO payroll (" + String.join(", ", PayrollRow.COLUMNS) + ") VALUES\n"
                + valuesClause(rowCount, PayrollRow.COLUMNS.size());
    }

    static String upsertSql(int rowCount, List<String> conflictFields, ConflictPolicy policy) {
        StringBuilder sql = new StringBuilder(insertSql(rowCount));
        sql.append("\nON CONFLICT (").append(String.join(", ", conflictFields)).append(") ");

        if (policy == ConflictPolicy.REPLACE) {
            String set = PayrollRow.COLUMNS.stream()
                    .filter(c -> !conflictFields.contains(c))
                    .map(c -> c + " = EXCLUDED." + c)
                    .collect(Collectors.joining(",\n  "));
            sql.append("DO UPDATE SET\n  ").append(set).append(",\n  updated_at = now()");
        } else {
            sql.append("DO NOTHING");
        }
        return sql.toString();
    }
}
