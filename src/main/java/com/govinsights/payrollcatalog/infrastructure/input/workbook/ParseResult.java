package com.govinsights.payrollcatalog.infrastructure.input.workbook;

/**
 * 셀 하나를 특정 타입으로 정규화한 결과.
 * <p>
 * 값이 있음({@code VALUE}), 비어 있음({@code EMPTY}: null/공백/"-"),
 * 해석 불가({@code INVALID}) 세 가지를 구분합니다. null/0 기본값 적용은 호출자가 한 번만 수행합니다.
 *
 * @param status 결과 상태
 * @param value  VALUE일 때의 값
 * @param raw    INVALID일 때의 원본 문자열(진단용)
 * @param <T>    값 타입
 */
public record ParseResult<T>(Status status, T value, String raw) {

    public enum Status { VALUE, EMPTY, INVALID }

    public static <T> ParseResult<T> of(T value) {
        return value == null ? empty() : new ParseResult<>(Status.VALUE, value, null);
    }

    public static <T> ParseResult<T> empty() {
        return new ParseResult<>(Status.EMPTY, null, null);
    }

    public static <T> ParseResult<T> invalid(String raw) {
        return new ParseResult<>(Status.INVALID, null, raw);
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    public T orNull() {
        return value;
    }

    public T orElse(T fallback) {
        return status == Status.VALUE ? value : fallback;
    }
}
