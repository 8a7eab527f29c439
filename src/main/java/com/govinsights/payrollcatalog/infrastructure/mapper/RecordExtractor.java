package com.govinsights.payrollcatalog.infrastructure.mapper;

import com.govinsights.payrollcatalog.infrastructure.input.workbook.ParseResult;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.RawRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 시트 행({@link RawRow})을 스키마에 따라 {@link NormalizedRecord}로 변환한다.
 * <p>
 * 해석할 수 없는 셀은 null(WAGE는 0)로 처리하고 필드별로 개수만 센다. 행 단위 오류로 중단하지 않는다.
 */
public final class RecordExtractor {

    private RecordExtractor() {}

    /**
     * 추출 결과.
     *
     * @param records          정규화된 레코드(행 순서 유지)
     * @param rowsRead         읽은 데이터 행 수
     * @param anomaliesByField 필드별 INVALID 셀 수
     */
    public record ExtractionResult(
            List<NormalizedRecord> records,
            int rowsRead,
            Map<String, Integer> anomaliesByField
    ) {
        public ExtractionResult {
            records = Collections.unmodifiableList(records);
            anomaliesByField = Collections.unmodifiableMap(anomaliesByField);
        }

        public int anomalies() {
            return anomaliesByField.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    /**
     * 행 전체를 정규화한다.
     *
     * @param rows   데이터 행(헤더 제외)
     * @param schema 목표 스키마
     * @return 추출 결과
     */
    public static ExtractionResult extract(Iterator<RawRow> rows, RecordSchema schema) {
        List<NormalizedRecord> out = new ArrayList<>();
        Map<String, Integer> anomalies = new LinkedHashMap<>();
        int read = 0;

        while (rows.hasNext()) {
            RawRow row = rows.next();
            read++;
            out.add(toRecord(row, schema, anomalies));
        }
        return new ExtractionResult(out, read, anomalies);
    }

    /**
     * 행 하나를 정규화한다.
     *
     * @param row       원본 행
     * @param schema    목표 스키마
     * @param anomalies 필드별 INVALID 카운터(갱신됨)
     * @return 정규화 레코드
     */
    static NormalizedRecord toRecord(RawRow row, RecordSchema schema, Map<String, Integer> anomalies) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec f : schema.fields()) {
            if (f.column() == null) {
                values.put(f.field(), f.type().defaultValue());
                continue;
            }
            ParseResult<?> r = f.type().parse(row.get(f.column()));
            if (r.isInvalid()) anomalies.merge(f.field(), 1, Integer::sum);
            values.put(f.field(), f.type().resolve(r));
        }
        return NormalizedRecord.of(schema, values);
    }
}
