package com.govinsights.payrollcatalog.infrastructure.mapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 레코드 집합 하나(roster 또는 detail)의 목표 스키마.
 *
 * @param name   스키마 이름(로그용)
 * @param fields 필드 정의 목록(순서 유지, 필드명 중복 불가)
 */
public record RecordSchema(String name, List<FieldSpec> fields) {

    public RecordSchema {
        fields = List.copyOf(fields);
        long distinct = fields.stream().map(FieldSpec::field).distinct().count();
        if (distinct != fields.size()) {
            throw new IllegalArgumentException("Duplicate field in schema " + name);
        }
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::field).toList();
    }

    public Optional<FieldSpec> field(String fieldName) {
        return fields.stream().filter(f -> f.field().equals(fieldName)).findFirst();
    }

    /**
     * 필드의 원본 컬럼 라벨을 바꾼 스키마를 반환합니다(연도별로 바뀌는 컬럼 대응).
     *
     * @param fieldName 필드명
     * @param column    실제 헤더 라벨(Nullable)
     * @return 새 스키마
     * @throws IllegalArgumentException 필드가 없는 경우
     */
    public RecordSchema withColumn(String fieldName, String column) {
        if (field(fieldName).isEmpty()) {
            throw new IllegalArgumentException("Unknown field '" + fieldName + "' in schema " + name);
        }
        List<FieldSpec> out = new ArrayList<>(fields.size());
        for (FieldSpec f : fields) {
            out.add(f.field().equals(fieldName) ? f.withColumn(column) : f);
        }
        return new RecordSchema(name, out);
    }

    /** 필드명 → 기본값(조인 미일치 시 채울 값) */
    public Map<String, Object> defaults() {
        Map<String, Object> m = new LinkedHashMap<>();
        for (FieldSpec f : fields) {
            m.put(f.field(), f.type().defaultValue());
        }
        return m;
    }
}
