package com.govinsights.payrollcatalog.infrastructure.mapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 정규화된 레코드(정규 필드명 → 타입이 정해진 Nullable 값).
 * <p>
 * 스키마의 모든 필드가 key로 존재하며(값은 null 가능), 공백/"-" 같은 원본 흔적은 null로 정리된 상태입니다.
 * 생성 후에는 변경되지 않으며, 조인 보강은 {@link #with(Map)}로 새 레코드를 만듭니다.
 */
public final class NormalizedRecord {

    private final Map<String, Object> values;

    private NormalizedRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 스키마 기준으로 레코드를 만듭니다. 스키마에 있지만 values에 없는 필드는 null로 채웁니다.
     *
     * @param schema 목표 스키마
     * @param values 필드명 → 값
     * @return 레코드
     */
    public static NormalizedRecord of(RecordSchema schema, Map<String, ?> values) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (String field : schema.fieldNames()) {
            m.put(field, values.get(field));
        }
        return new NormalizedRecord(m);
    }

    /** 주어진 값 그대로(순서 유지) 레코드 생성 */
    public static NormalizedRecord of(Map<String, ?> values) {
        return new NormalizedRecord(new LinkedHashMap<>(values));
    }

    public Object get(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    /**
     * 필드 값을 trim된 문자열로 반환합니다. null/빈 문자열이면 null입니다.
     */
    public String text(String field) {
        Object v = values.get(field);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public Set<String> fields() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * extra 필드를 덧붙인(같은 필드는 extra 값으로 덮어쓴) 새 레코드를 반환합니다.
     */
    public NormalizedRecord with(Map<String, ?> extra) {
        Map<String, Object> m = new LinkedHashMap<>(values);
        m.putAll(extra);
        return new NormalizedRecord(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedRecord)) return false;
        return values.equals(((NormalizedRecord) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "NormalizedRecord" + values;
    }
}
