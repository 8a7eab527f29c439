package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 시트 셀 하나의 원본 값을 표현하는 태그(kind) 기반 값 객체입니다.
 * <p>
 * 같은 컬럼이라도 연도/행마다 텍스트, 숫자, 날짜가 섞여 들어오므로
 * 입력 어댑터 경계에서 {@link Kind}를 붙여 두고, 정규화 단계는 kind로만 분기합니다.
 *
 * @param kind   값 종류
 * @param text   TEXT일 때의 원본 문자열
 * @param number NUMBER일 때의 숫자 값(정확한 10진수)
 * @param date   DATE일 때의 날짜/시각 값
 */
public record CellValue(Kind kind, String text, BigDecimal number, LocalDateTime date) {

    /** 셀 값 종류 */
    public enum Kind { TEXT, NUMBER, DATE, BLANK }

    private static final CellValue BLANK = new CellValue(Kind.BLANK, null, null, null);

    public static CellValue blank() {
        return BLANK;
    }

    public static CellValue text(String s) {
        return s == null ? BLANK : new CellValue(Kind.TEXT, s, null, null);
    }

    /**
     * 시트의 double 숫자 셀을 감쌉니다. NaN/무한대는 10진수로 표현할 수 없으므로 TEXT로 남깁니다.
     */
    public static CellValue number(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return text(String.valueOf(d));
        return new CellValue(Kind.NUMBER, null, BigDecimal.valueOf(d), null);
    }

    public static CellValue number(BigDecimal d) {
        return d == null ? BLANK : new CellValue(Kind.NUMBER, null, d, null);
    }

    public static CellValue date(LocalDateTime dt) {
        return dt == null ? BLANK : new CellValue(Kind.DATE, null, null, dt);
    }

    /**
     * 타입이 정해지지 않은 값을 kind에 맞춰 감쌉니다.
     * <p>
     * null → BLANK, {@link Number} → NUMBER(정수/BigDecimal은 자릿수 손실 없이), {@link LocalDate}/{@link LocalDateTime} → DATE,
     * 그 외는 {@code toString()} 결과를 TEXT로 취급합니다.
     *
     * @param raw 원본 값
     * @return 대응되는 CellValue
     */
    public static CellValue of(Object raw) {
        if (raw == null) return BLANK;
        if (raw instanceof CellValue) return (CellValue) raw;
        if (raw instanceof BigDecimal) return number((BigDecimal) raw);
        if (raw instanceof BigInteger) return number(new BigDecimal((BigInteger) raw));
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return number(BigDecimal.valueOf(((Number) raw).longValue()));
        }
        if (raw instanceof Number) return number(((Number) raw).doubleValue());
        if (raw instanceof LocalDateTime) return date((LocalDateTime) raw);
        if (raw instanceof LocalDate) return date(((LocalDate) raw).atStartOfDay());
        return text(raw.toString());
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }
}
