package com.govinsights.payrollcatalog.infrastructure.mapper;

import com.govinsights.payrollcatalog.infrastructure.input.workbook.CellValue;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.FieldNormalizer;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.ParseResult;

import java.math.BigDecimal;

/**
 * 정규화 대상 필드의 의미 타입.
 * <p>
 * 각 타입은 {@link FieldNormalizer}의 규칙 하나와, 값이 없을 때의 기본값을 가집니다.
 */
public enum FieldType {
    INTEGER,
    DECIMAL,
    /** EMPTY/INVALID 모두 0 */
    WAGE,
    TEXT,
    DATE_SERIAL,
    /** serial과 날짜 문자열이 섞인 불투명 텍스트 */
    HIRE_DATE_TEXT;

    /**
     * 셀 값을 이 타입의 규칙으로 정규화합니다.
     *
     * @param v 셀 값
     * @return 정규화 결과(WAGE도 원래 결과를 그대로 반환하며 0 적용은 {@link #resolve}에서 수행)
     */
    public ParseResult<?> parse(CellValue v) {
        switch (this) {
            case INTEGER:
                return FieldNormalizer.integer(v);
            case DECIMAL:
            case WAGE:
                return FieldNormalizer.decimal(v);
            case DATE_SERIAL:
                return FieldNormalizer.dateSerial(v);
            case HIRE_DATE_TEXT:
                return FieldNormalizer.hireDateText(v);
            case TEXT:
            default:
                return FieldNormalizer.text(v);
        }
    }

    /**
     * 정규화 결과에 기본값 정책을 적용해 최종 값을 만듭니다.
     *
     * @param result 정규화 결과
     * @return 최종 값(Nullable, WAGE는 null 아님)
     */
    public Object resolve(ParseResult<?> result) {
        Object v = result.orNull();
        return v == null ? defaultValue() : v;
    }

    /** 값이 없을 때(조인 미일치 포함) 사용하는 기본값 */
    public Object defaultValue() {
        return this == WAGE ? BigDecimal.ZERO : null;
    }
}
