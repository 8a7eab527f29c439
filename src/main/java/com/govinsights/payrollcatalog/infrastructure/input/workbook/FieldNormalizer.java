package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 원본 셀 값을 타입별로 정규화하는 유틸리티입니다.
 * <p>
 * - 공백/공백문자열/대시("-") placeholder는 EMPTY
 * - 숫자 형태 문자열("12", "12.0", "1,234.50")은 숫자로 해석
 * - 해석할 수 없는 값은 예외 대신 INVALID 결과로 반환
 * <p>
 * 모든 메서드는 순수 함수이며 예외를 던지지 않습니다.
 */
public final class FieldNormalizer {
    private FieldNormalizer() {}

    /** 스프레드시트 날짜 serial 기준일(1899-12-30)과 1970-01-01 사이의 일수 */
    public static final long SERIAL_EPOCH_OFFSET = 25569L;

    /** 값 없음을 나타내는 placeholder */
    private static final String DASH = "-";

    /**
     * 정수 규칙: 숫자는 0 방향으로 절삭, 숫자 문자열("12.0" 포함)은 파싱 후 절삭합니다.
     *
     * @param v 셀 값
     * @return Long 결과
     */
    public static ParseResult<Long> integer(CellValue v) {
        switch (kindOf(v)) {
            case NUMBER:
                return truncate(v.number(), v.number().toPlainString());
            case TEXT: {
                String s = norm(v.text());
                if (s == null) return ParseResult.empty();
                BigDecimal bd = decimalOrNull(s);
                if (bd == null) return ParseResult.invalid(s);
                return truncate(bd, s);
            }
            case DATE:
                return ParseResult.invalid(v.date().toString());
            default:
                return ParseResult.empty();
        }
    }

    /**
     * 소수 규칙: 천 단위 구분자(,)를 제거한 뒤 파싱합니다.
     *
     * @param v 셀 값
     * @return BigDecimal 결과
     */
    public static ParseResult<BigDecimal> decimal(CellValue v) {
        switch (kindOf(v)) {
            case NUMBER:
                return ParseResult.of(v.number());
            case TEXT: {
                String s = norm(v.text());
                if (s == null) return ParseResult.empty();
                BigDecimal bd = decimalOrNull(s.replace(",", ""));
                return bd == null ? ParseResult.invalid(s) : ParseResult.of(bd);
            }
            case DATE:
                return ParseResult.invalid(v.date().toString());
            default:
                return ParseResult.empty();
        }
    }

    /**
     * 급여 규칙: 소수 규칙과 같지만 EMPTY/INVALID 모두 0으로 취급합니다.
     * <p>
     * 급여 기록이 없다는 것은 "모름"이 아니라 "0원"이므로 null을 반환하지 않습니다.
     *
     * @param v 셀 값
     * @return 급여 금액(절대 null 아님)
     */
    public static BigDecimal wage(CellValue v) {
        return decimal(v).orElse(BigDecimal.ZERO);
    }

    /**
     * 텍스트 규칙: trim 후 빈 문자열이거나 "-"이면 EMPTY입니다.
     * <p>
     * 숫자 셀은 정수면 소수점 없이(12345.0 → "12345"), 아니면 plain 표기로 변환합니다.
     *
     * @param v 셀 값
     * @return 문자열 결과
     */
    public static ParseResult<String> text(CellValue v) {
        switch (kindOf(v)) {
            case TEXT:
                return ParseResult.of(norm(v.text()));
            case NUMBER:
                return ParseResult.of(numberText(v.number()));
            case DATE:
                return ParseResult.of(v.date().toLocalDate().toString());
            default:
                return ParseResult.empty();
        }
    }

    /**
     * 날짜 serial 규칙: 정수 일수 또는 달력 날짜를 스프레드시트 serial(1899-12-30 = 0)로 변환합니다.
     * <p>
     * 텍스트는 숫자 형태면 일수로, {@code yyyy-MM-dd} 형태면 날짜로 해석합니다.
     *
     * @param v 셀 값
     * @return serial 일수 결과
     */
    public static ParseResult<Long> dateSerial(CellValue v) {
        switch (kindOf(v)) {
            case NUMBER:
                return truncate(v.number(), v.number().toPlainString());
            case DATE:
                return ParseResult.of(toSerial(v.date().toLocalDate()));
            case TEXT: {
                String s = norm(v.text());
                if (s == null) return ParseResult.empty();
                BigDecimal bd = decimalOrNull(s);
                if (bd != null) return truncate(bd, s);
                try {
                    return ParseResult.of(toSerial(LocalDate.parse(s)));
                } catch (DateTimeParseException e) {
                    return ParseResult.invalid(s);
                }
            }
            default:
                return ParseResult.empty();
        }
    }

    /**
     * 최종 입사일(LAST_HIRE_DATE) 규칙: serial 정수와 날짜 문자열이 섞인 컬럼을 불투명 텍스트로 보존합니다.
     * <p>
     * 숫자/숫자 문자열은 정수 serial 문자열로, 날짜 셀은 serial 문자열로, 그 외 문자열은 trim 그대로 둡니다.
     * 이 규칙은 INVALID를 반환하지 않습니다.
     *
     * @param v 셀 값
     * @return 문자열 결과
     */
    public static ParseResult<String> hireDateText(CellValue v) {
        switch (kindOf(v)) {
            case NUMBER: {
                ParseResult<Long> serial = truncate(v.number(), v.number().toPlainString());
                return serial.isInvalid() ? ParseResult.of(numberText(v.number())) : ParseResult.of(String.valueOf(serial.value()));
            }
            case DATE:
                return ParseResult.of(String.valueOf(toSerial(v.date().toLocalDate())));
            case TEXT: {
                String s = norm(v.text());
                if (s == null) return ParseResult.empty();
                BigDecimal bd = decimalOrNull(s);
                if (bd != null) {
                    ParseResult<Long> serial = truncate(bd, s);
                    if (!serial.isInvalid()) return ParseResult.of(String.valueOf(serial.value()));
                }
                return ParseResult.of(s);
            }
            default:
                return ParseResult.empty();
        }
    }

    /**
     * 문자열을 정규화합니다. trim 후 빈 문자열이거나 "-"이면 null입니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() || DASH.equals(t) ? null : t;
    }

    /** 1970-01-01 기준 날짜 → 스프레드시트 serial */
    public static long toSerial(LocalDate date) {
        return date.toEpochDay() + SERIAL_EPOCH_OFFSET;
    }

    private static CellValue.Kind kindOf(CellValue v) {
        return v == null ? CellValue.Kind.BLANK : v.kind();
    }

    private static ParseResult<Long> truncate(BigDecimal bd, String raw) {
        BigDecimal whole = bd.setScale(0, RoundingMode.DOWN);
        if (whole.toBigInteger().bitLength() > 63) return ParseResult.invalid(raw);
        return ParseResult.of(whole.longValue());
    }

    /** 엄격한 10진수 파싱(16진수, "NaN", "5d" 등은 거부) */
    private static BigDecimal decimalOrNull(String s) {
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** 정수면 소수점 없이, 아니면 뒤쪽 0을 뗀 plain 표기 */
    private static String numberText(BigDecimal bd) {
        if (bd.signum() == 0) return "0";
        return bd.stripTrailingZeros().toPlainString();
    }
}
