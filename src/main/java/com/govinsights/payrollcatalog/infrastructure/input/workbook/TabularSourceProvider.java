package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import java.io.IOException;

/**
 * 데이터셋 핸들(파일명 등)로 {@link TabularSource}를 여는 입력 어댑터입니다.
 */
public interface TabularSourceProvider {

    /**
     * 데이터셋을 엽니다. 호출자가 close 책임을 집니다.
     *
     * @param handle 데이터셋 핸들
     * @return 열린 TabularSource
     * @throws IOException 파일이 없거나 읽을 수 없는 경우
     */
    TabularSource open(String handle) throws IOException;
}
