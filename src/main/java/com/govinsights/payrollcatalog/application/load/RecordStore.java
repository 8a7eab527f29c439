package com.govinsights.payrollcatalog.application.load;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link BatchLoader}가 사용하는 저장소 포트.
 * <p>
 * 두 메서드 모두 실패 시 error 신호를 보내야 하며, 반환 count는 참고용입니다.
 * 빈 {@link Mono}는 "count를 보고하지 않음"을 뜻하고 배치 전체 성공으로 취급됩니다.
 *
 * @param <T> 저장 row 타입
 */
public interface RecordStore<T> {

    /**
     * conflictFields가 같은 기존 row가 있으면 policy에 따라 유지하거나 덮어씁니다.
     *
     * @param rows           저장할 row(비어 있지 않음)
     * @param conflictFields 자연키 컬럼명
     * @param policy         충돌 정책
     * @return 저장소가 보고한 변경 row 수(없으면 empty)
     */
    Mono<Long> upsert(List<T> rows, List<String> conflictFields, ConflictPolicy policy);

    /**
     * 충돌 처리 없이 그대로 insert 합니다(upsert 실패 시 fallback).
     *
     * @param rows 저장할 row(비어 있지 않음)
     * @return 저장소가 보고한 변경 row 수(없으면 empty)
     */
    Mono<Long> insert(List<T> rows);
}
