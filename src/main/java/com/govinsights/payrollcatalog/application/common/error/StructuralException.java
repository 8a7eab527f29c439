package com.govinsights.payrollcatalog.application.common.error;

/**
 * 데이터셋에 필수 구조(시트/컬럼)가 없을 때 발생하는 예외.
 *
 * <p>해당 데이터셋(회계연도) 처리만 중단하며, 다른 데이터셋 처리는 계속된다.</p>
 */
public class StructuralException extends RuntimeException {

    public static final String CODE = "STRUCTURE_ERROR";

    /** 구조 오류가 발생한 데이터셋 핸들 */
    private final String dataset;

    public StructuralException(String dataset, String message) {
        super(message);
        this.dataset = dataset;
    }

    public String dataset() {
        return dataset;
    }

    public String code() {
        return CODE;
    }
}
