package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * 열려 있는 데이터셋(워크북 등) 하나에 대한 읽기 전용 뷰입니다.
 * <p>
 * 시트 이름 목록, 시트별 헤더(1행), 헤더를 제외한 데이터 행 iterator를 제공합니다.
 */
public interface TabularSource extends AutoCloseable {

    /** 데이터셋 식별자(파일명 등) */
    String handle();

    /** 시트 이름 목록(워크북 순서) */
    List<String> sheetNames();

    /**
     * 시트의 헤더 라벨 목록을 반환합니다.
     *
     * @param sheetName 시트 이름
     * @return 헤더 라벨 목록(빈 시트면 빈 리스트)
     * @throws IllegalArgumentException 시트가 없는 경우
     */
    List<String> header(String sheetName);

    /**
     * 헤더를 제외한 데이터 행을 순서대로 반환합니다.
     *
     * @param sheetName 시트 이름
     * @return 데이터 행 iterator
     * @throws IllegalArgumentException 시트가 없는 경우
     */
    Iterator<RawRow> rows(String sheetName);

    @Override
    void close() throws IOException;
}
