package com.govinsights.payrollcatalog.application.join;

/**
 * detail 집합에 같은 식별자가 여러 번 나올 때 어떤 row를 조인에 사용할지 정하는 정책.
 */
public enum DuplicateKeyPolicy {
    /** 처음 나온 row 사용 */
    FIRST_WINS,
    /** 마지막에 나온 row 사용 */
    LAST_WINS
}
