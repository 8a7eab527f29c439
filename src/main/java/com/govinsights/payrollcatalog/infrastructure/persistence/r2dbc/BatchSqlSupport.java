package com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * R2DBC 다중 row INSERT SQL 작성을 위한 공통 베이스 클래스입니다.
 * <p>
 * 한 statement의 바인딩 파라미터 수가 드라이버 한도를 넘지 않도록 chunk 단위로 나누어 순차 실행하고,
 * {@code VALUES (:p0_0, :p0_1, ...), (:p1_0, ...)} 형태의 named parameter 목록 생성과
 * null-safe 바인딩 편의 메서드를 제공합니다.
 */
public abstract class BatchSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 아이템 목록을 chunk 단위로 나누어 순차(concat) 실행하고 rowsUpdated를 합산합니다.
     *
     * @param items  처리할 전체 아이템 목록
     * @param chunk  한 statement에 담을 최대 아이템 수
     * @param onceFn chunk 단위로 실행할 함수
     * @param <T>    아이템 타입
     * @return rowsUpdated 합계
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * row 위치와 컬럼 위치로 named parameter 이름을 만듭니다.
     *
     * @param row row 위치
     * @param col 컬럼 위치
     * @return 파라미터 이름(예: {@code p3_12})
     */
    protected static String paramName(int row, int col) {
        return "p" + row + "_" + col;
    }

    /**
     * 다중 row VALUES 절을 작성합니다.
     *
     * @param rowCount    row 수
     * @param columnCount 컬럼 수
     * @return {@code (:p0_0, :p0_1), (:p1_0, :p1_1)} 형태의 문자열
     */
    protected static String valuesClause(int rowCount, int columnCount) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rowCount; i++) {
            if (i > 0) sb.append(",\n");
            sb.append("(");
            for (int c = 0; c < columnCount; c++) {
                if (c > 0) sb.append(", ");
                sb.append(':').append(paramName(i, c));
            }
            sb.append(")");
        }
        return sb.toString();
    }

    /**
     * row별 값 목록을 {@link #valuesClause}의 파라미터 이름에 바인딩합니다.
     *
     * @param spec   바인딩 대상 spec
     * @param values row별 값 목록(컬럼 순서)
     * @param types  null 바인딩 시 사용할 컬럼 타입
     * @return 바인딩이 적용된 spec
     */
    protected DatabaseClient.GenericExecuteSpec bindRows(
            DatabaseClient.GenericExecuteSpec spec, List<List<Object>> values, List<Class<?>> types
    ) {
        for (int i = 0; i < values.size(); i++) {
            List<Object> row = values.get(i);
            for (int c = 0; c < row.size(); c++) {
                spec = bindOrNull(spec, paramName(i, c), row.get(c), types.get(c));
            }
        }
        return spec;
    }

    /**
     * 값이 null인 경우 {@code bindNull}, 아니면 {@code bind}를 수행하는 null-safe 바인딩 헬퍼입니다.
     *
     * @param spec  바인딩 대상 {@link org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec}
     * @param name  파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type  null 바인딩 시 사용할 타입
     * @return 바인딩이 적용된 spec
     */
    protected DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, Object value, Class<?> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }
}
