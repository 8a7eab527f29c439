package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import com.govinsights.payrollcatalog.application.common.error.StructuralException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 연도마다 이름이 조금씩 바뀌는 시트/컬럼을 부분 문자열 매칭으로 찾는 유틸리티입니다.
 * <p>
 * 위치(index)가 아니라 이름 패턴으로 찾기 때문에 접미사 변경(예: {@code ACTIVE_ON_JUNE_30_2024})이나
 * 보조 컬럼 추가/삭제에 영향을 받지 않습니다. 매칭은 대소문자를 구분하지 않으며 첫 번째 일치 항목을 반환합니다.
 */
public final class SchemaResolver {
    private SchemaResolver() {}

    /**
     * 이름에 pattern을 포함하는 첫 번째 시트를 찾습니다.
     *
     * @param sheetNames 시트 이름 목록
     * @param pattern    찾을 부분 문자열(예: "HR INFO")
     * @return 시트 이름, 없으면 empty
     */
    public static Optional<String> findSheet(List<String> sheetNames, String pattern) {
        return firstContaining(sheetNames, pattern);
    }

    /**
     * 헤더 라벨 중 pattern을 포함하는 첫 번째 라벨을 찾습니다.
     *
     * @param header  헤더 라벨 목록
     * @param pattern 찾을 부분 문자열(예: "ACTIVE_ON_JUNE_30")
     * @return 헤더 라벨, 없으면 empty
     */
    public static Optional<String> findColumn(List<String> header, String pattern) {
        return firstContaining(header, pattern);
    }

    /**
     * 필수 시트를 찾고, 없으면 {@link StructuralException}을 던집니다.
     */
    public static String requireSheet(String dataset, List<String> sheetNames, String pattern) {
        return findSheet(sheetNames, pattern)
                .orElseThrow(() -> new StructuralException(dataset,
                        "Required sheet not found: '" + pattern + "' in " + dataset + " (sheets=" + sheetNames + ")"));
    }

    /**
     * 필수 컬럼을 찾고, 없으면 {@link StructuralException}을 던집니다.
     */
    public static String requireColumn(String dataset, String sheet, List<String> header, String pattern) {
        return findColumn(header, pattern)
                .orElseThrow(() -> new StructuralException(dataset,
                        "Required column not found: '" + pattern + "' in sheet '" + sheet + "' of " + dataset));
    }

    private static Optional<String> firstContaining(List<String> candidates, String pattern) {
        if (candidates == null || pattern == null) return Optional.empty();
        String p = pattern.toLowerCase(Locale.ROOT);
        for (String c : candidates) {
            if (c != null && c.toLowerCase(Locale.ROOT).contains(p)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
