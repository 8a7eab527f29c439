package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 시트에서 읽은 데이터 행 하나(헤더 라벨 → 셀 값)입니다.
 * <p>
 * 라벨 순서는 헤더 순서를 따르며, 추출 단계가 끝나면 버려지는 일시적인 객체입니다.
 *
 * @param cells 라벨 → 셀 값 (헤더 순서 유지)
 */
public record RawRow(Map<String, CellValue> cells) {

    public RawRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /**
     * 헤더와 셀 목록을 위치 기준으로 짝지어 행을 만듭니다.
     * <p>
     * 행이 헤더보다 짧으면 남는 라벨은 BLANK로 채우고, 같은 라벨이 반복되면 뒤쪽 값이 남습니다.
     *
     * @param header 헤더 라벨 목록
     * @param values 셀 값 목록
     * @return RawRow
     */
    public static RawRow of(List<String> header, List<CellValue> values) {
        Map<String, CellValue> m = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            CellValue v = i < values.size() ? values.get(i) : null;
            m.put(header.get(i), v == null ? CellValue.blank() : v);
        }
        return new RawRow(m);
    }

    /** 라벨 → 원본 값 맵으로부터 행 생성 (값은 {@link CellValue#of(Object)}로 감쌈) */
    public static RawRow fromValues(Map<String, ?> values) {
        Map<String, CellValue> m = new LinkedHashMap<>();
        values.forEach((k, v) -> m.put(k, CellValue.of(v)));
        return new RawRow(m);
    }

    /**
     * 라벨에 해당하는 셀 값을 반환합니다. 없는 라벨이면 BLANK입니다.
     *
     * @param label 헤더 라벨 (null이면 BLANK)
     * @return 셀 값
     */
    public CellValue get(String label) {
        if (label == null) return CellValue.blank();
        CellValue v = cells.get(label);
        return v == null ? CellValue.blank() : v;
    }

    public List<String> labels() {
        return List.copyOf(cells.keySet());
    }
}
