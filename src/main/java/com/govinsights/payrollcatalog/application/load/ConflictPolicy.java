package com.govinsights.payrollcatalog.application.load;

/**
 * 자연키가 이미 존재할 때 적용하는 충돌 처리 정책.
 */
public enum ConflictPolicy {
    /** 기존 row 유지(신규 row 무시) */
    SKIP,
    /** 기존 row를 신규 값으로 덮어쓰기 */
    REPLACE
}
