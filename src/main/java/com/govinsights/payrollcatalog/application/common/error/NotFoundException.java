package com.govinsights.payrollcatalog.application.common.error;

/**
 * 요청한 데이터셋(워크북 파일 등)을 찾거나 열 수 없을 때 사용하는 예외.
 *
 * <p>ingest 실행 전체를 중단시키는 유일한 입력 오류이며, HTTP에서는 404로 변환된다.</p>
 */
public class NotFoundException extends RuntimeException {
    private final String code;

    public NotFoundException(String message, String code) {
        super(message);
        this.code = code;
    }

    public NotFoundException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
