package com.govinsights.payrollcatalog.application.join;

import com.govinsights.payrollcatalog.infrastructure.mapper.NormalizedRecord;
import com.govinsights.payrollcatalog.infrastructure.mapper.RecordSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * roster 레코드에 detail 레코드를 식별자 기준으로 left join 합니다.
 * <p>
 * 식별자가 있는 roster 레코드 하나당 결과 레코드 하나를 roster 순서대로 만들며,
 * 일치하는 detail이 없으면 detail 필드는 타입별 기본값(금액은 0)으로 채웁니다.
 * detail 조회용 맵은 호출마다 새로 만들고 호출이 끝나면 버립니다.
 */
@Component
public class RecordJoiner {

    /**
     * 기본 정책({@link DuplicateKeyPolicy#LAST_WINS})으로 조인합니다.
     *
     * @see #join(List, List, String, RecordSchema, DuplicateKeyPolicy)
     */
    public JoinResult join(List<NormalizedRecord> roster,
                           List<NormalizedRecord> detail,
                           String keyField,
                           RecordSchema detailSchema) {
        return join(roster, detail, keyField, detailSchema, DuplicateKeyPolicy.LAST_WINS);
    }

    /**
     * roster × detail left join.
     *
     * @param roster       기준 레코드(순서 유지)
     * @param detail       보강 레코드(식별자가 비어 있으면 무시)
     * @param keyField     조인 키 필드명
     * @param detailSchema detail 스키마(붙일 필드와 기본값 결정)
     * @param policy       detail 중복 식별자 처리 정책
     * @return 조인 결과
     */
    public JoinResult join(List<NormalizedRecord> roster,
                           List<NormalizedRecord> detail,
                           String keyField,
                           RecordSchema detailSchema,
                           DuplicateKeyPolicy policy) {
        Map<String, NormalizedRecord> lookup = new HashMap<>();
        int duplicates = 0;
        for (NormalizedRecord d : detail) {
            String id = d.text(keyField);
            if (id == null) continue;
            if (lookup.containsKey(id)) {
                duplicates++;
                if (policy == DuplicateKeyPolicy.FIRST_WINS) continue;
            }
            lookup.put(id, d);
        }

        Map<String, Object> defaults = detailSchema.defaults();
        defaults.remove(keyField);

        List<NormalizedRecord> combined = new ArrayList<>(roster.size());
        int dropped = 0;
        int matched = 0;
        for (NormalizedRecord r : roster) {
            String id = r.text(keyField);
            if (id == null) {
                dropped++;
                continue;
            }
            NormalizedRecord d = lookup.get(id);
            if (d == null) {
                combined.add(r.with(defaults));
                continue;
            }
            matched++;
            Map<String, Object> extra = new LinkedHashMap<>();
            for (String field : defaults.keySet()) {
                Object v = d.get(field);
                extra.put(field, v == null ? defaults.get(field) : v);
            }
            combined.add(r.with(extra));
        }
        return new JoinResult(combined, dropped, matched, duplicates);
    }
}
