package com.govinsights.payrollcatalog.infrastructure.input.workbook;

import com.govinsights.payrollcatalog.config.PayrollIngestProperties;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Apache POI로 xlsx/xls 워크북을 읽는 {@link TabularSourceProvider} 구현체입니다.
 * <p>
 * 핸들은 워크북 디렉터리 기준 상대 경로(예: {@code fiscal-year-2024.xlsx})입니다.
 * 셀은 {@link CellValue}로 변환하며, 날짜 서식이 적용된 숫자 셀은 DATE로 취급합니다.
 */
@Component
public class PoiTabularSourceProvider implements TabularSourceProvider {

    private static final Logger log = LoggerFactory.getLogger(PoiTabularSourceProvider.class);

    /** 워크북 파일이 위치한 디렉터리 */
    private final Path baseDir;

    @Autowired
    public PoiTabularSourceProvider(PayrollIngestProperties props) {
        this(props.workbookDir());
    }

    public PoiTabularSourceProvider(Path baseDir) {
        this.baseDir = baseDir;
    }

    /**
     * 워크북 파일을 읽기 전용으로 엽니다.
     *
     * @param handle 워크북 디렉터리 기준 파일 경로
     * @return 워크북 기반 TabularSource
     * @throws NoSuchFileException 파일이 없는 경우
     * @throws IOException 워크북을 해석할 수 없는 경우
     */
    @Override
    public TabularSource open(String handle) throws IOException {
        Path file = baseDir.resolve(handle);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        log.info("Opening workbook {}", file);
        Workbook wb;
        try {
            wb = WorkbookFactory.create(file.toFile(), null, true);
        } catch (RuntimeException e) {
            // POI는 손상된 파일에 대해 unchecked 예외를 던지기도 함
            throw new IOException("Unreadable workbook: " + file, e);
        }
        return new PoiTabularSource(handle, wb);
    }

    /** POI {@link Workbook}을 감싼 TabularSource */
    static final class PoiTabularSource implements TabularSource {

        private final String handle;
        private final Workbook wb;
        private final DataFormatter formatter = new DataFormatter();

        PoiTabularSource(String handle, Workbook wb) {
            this.handle = handle;
            this.wb = wb;
        }

        @Override
        public String handle() {
            return handle;
        }

        @Override
        public List<String> sheetNames() {
            List<String> names = new ArrayList<>(wb.getNumberOfSheets());
            for (int i = 0; i < wb.getNumberOfSheets(); i++) {
                names.add(wb.getSheetName(i));
            }
            return names;
        }

        @Override
        public List<String> header(String sheetName) {
            Row headerRow = sheet(sheetName).getRow(0);
            if (headerRow == null) return List.of();

            List<String> header = new ArrayList<>();
            short last = headerRow.getLastCellNum();
            for (int c = 0; c < last; c++) {
                Cell cell = headerRow.getCell(c);
                header.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
            }
            return header;
        }

        @Override
        public Iterator<RawRow> rows(String sheetName) {
            Sheet sheet = sheet(sheetName);
            List<String> header = header(sheetName);
            int lastRow = sheet.getLastRowNum();

            return new Iterator<>() {
                private int next = advance(1);

                private int advance(int from) {
                    int i = from;
                    while (i <= lastRow && sheet.getRow(i) == null) i++;
                    return i;
                }

                @Override
                public boolean hasNext() {
                    return !header.isEmpty() && next <= lastRow;
                }

                @Override
                public RawRow next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    Row row = sheet.getRow(next);
                    next = advance(next + 1);

                    List<CellValue> values = new ArrayList<>(header.size());
                    for (int c = 0; c < header.size(); c++) {
                        values.add(toCellValue(row.getCell(c)));
                    }
                    return RawRow.of(header, values);
                }
            };
        }

        @Override
        public void close() throws IOException {
            wb.close();
        }

        private Sheet sheet(String sheetName) {
            Sheet sheet = wb.getSheet(sheetName);
            if (sheet == null) {
                throw new IllegalArgumentException("Sheet not found: " + sheetName);
            }
            return sheet;
        }
    }

    /**
     * POI 셀을 {@link CellValue}로 변환합니다.
     * <p>
     * 수식 셀은 캐시된 결과 타입을 기준으로 변환하고, 오류 셀은 BLANK로 취급합니다.
     *
     * @param cell POI 셀(Nullable)
     * @return 변환된 셀 값
     */
    static CellValue toCellValue(Cell cell) {
        if (cell == null) return CellValue.blank();
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return CellValue.text(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return CellValue.date(cell.getLocalDateTimeCellValue());
                }
                return CellValue.number(cell.getNumericCellValue());
            case BOOLEAN:
                return CellValue.text(Boolean.toString(cell.getBooleanCellValue()).toUpperCase());
            default:
                return CellValue.blank();
        }
    }
}
