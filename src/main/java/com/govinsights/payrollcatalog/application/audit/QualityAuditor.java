package com.govinsights.payrollcatalog.application.audit;

import com.govinsights.payrollcatalog.application.audit.AuditReport.DuplicateKey;
import com.govinsights.payrollcatalog.application.audit.AuditReport.GroupCount;
import com.govinsights.payrollcatalog.application.audit.AuditReport.NumericRange;
import com.govinsights.payrollcatalog.infrastructure.mapper.NormalizedRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정규화 레코드 집합의 품질(누락, 그룹 분포, 키 유일성, 숫자 범위)을 점검한다.
 * <p>
 * 읽기 전용이며 적재 경로와 무관하다.
 */
@Component
public class QualityAuditor {

    /**
     * 레코드 집합을 점검한다.
     *
     * @param records  점검 대상
     * @param criteria 점검 기준
     * @return 점검 결과
     */
    public AuditReport audit(List<NormalizedRecord> records, AuditCriteria criteria) {
        Map<String, Long> nulls = new LinkedHashMap<>();
        criteria.requiredFields().forEach(f -> nulls.put(f, 0L));

        Map<String, Long> groups = new HashMap<>();
        Map<List<Object>, Long> keys = new LinkedHashMap<>();
        Map<String, BigDecimal[]> minMax = new LinkedHashMap<>();
        Map<String, Long> numericCounts = new HashMap<>();
        criteria.rangeFields().forEach(f -> minMax.put(f, new BigDecimal[2]));

        for (NormalizedRecord r : records) {
            for (String f : criteria.requiredFields()) {
                if (r.text(f) == null) nulls.merge(f, 1L, Long::sum);
            }

            String group = r.text(criteria.groupingField());
            if (group != null) groups.merge(group, 1L, Long::sum);

            List<Object> key = new ArrayList<>(criteria.uniquenessFields().size());
            for (String f : criteria.uniquenessFields()) key.add(r.get(f));
            keys.merge(key, 1L, Long::sum);

            for (String f : criteria.rangeFields()) {
                BigDecimal v = toDecimal(r.get(f));
                if (v == null) continue;
                BigDecimal[] mm = minMax.get(f);
                if (mm[0] == null || v.compareTo(mm[0]) < 0) mm[0] = v;
                if (mm[1] == null || v.compareTo(mm[1]) > 0) mm[1] = v;
                numericCounts.merge(f, 1L, Long::sum);
            }
        }

        List<GroupCount> top = groups.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(criteria.topGroupLimit())
                .map(e -> new GroupCount(e.getKey(), e.getValue()))
                .toList();

        List<DuplicateKey> duplicates = keys.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(e -> new DuplicateKey(e.getKey(), e.getValue()))
                .toList();

        Map<String, NumericRange> ranges = new LinkedHashMap<>();
        minMax.forEach((f, mm) -> ranges.put(f, new NumericRange(mm[0], mm[1], numericCounts.getOrDefault(f, 0L))));

        return new AuditReport(
                records.size(),
                nulls,
                criteria.groupingField(),
                groups.size(),
                top,
                criteria.uniquenessFields(),
                duplicates.isEmpty(),
                duplicates,
                ranges
        );
    }

    private static BigDecimal toDecimal(Object v) {
        if (v == null) return null;
        if (v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Number) return new BigDecimal(v.toString());
        try {
            return new BigDecimal(v.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
