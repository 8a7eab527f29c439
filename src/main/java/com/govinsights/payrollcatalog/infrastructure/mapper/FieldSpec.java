package com.govinsights.payrollcatalog.infrastructure.mapper;

/**
 * 정규화 필드 하나의 정의.
 *
 * @param field  정규 필드명(DB 컬럼명과 동일)
 * @param column 원본 헤더 라벨(Nullable: 해당 연도 시트에 없는 선택 컬럼)
 * @param type   의미 타입
 */
public record FieldSpec(String field, String column, FieldType type) {

    public static FieldSpec of(String field, String column, FieldType type) {
        return new FieldSpec(field, column, type);
    }

    public FieldSpec withColumn(String newColumn) {
        return new FieldSpec(field, newColumn, type);
    }
}
