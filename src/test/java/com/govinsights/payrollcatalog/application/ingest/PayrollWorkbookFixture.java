package com.govinsights.payrollcatalog.application.ingest;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 테스트용 급여 워크북 생성기.
 *
 * <p>HR INFO 4행(그중 1행은 식별자 없음), EARNINGS 3행(A1, A2, 중복 A1)으로 구성한다.
 * {@link #writeWithoutIdentifiers(Path)}는 HR INFO 모든 행의 식별자가 비어 있는 워크북을 만든다.</p>
 */
final class PayrollWorkbookFixture {

    private PayrollWorkbookFixture() {}

    static void write(Path file, boolean withEarnings) throws Exception {
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet hr = wb.createSheet("HR INFO FY24");
            row(hr, 0, "TEMPORARY_ID", "RECORD_NBR", "EMPLOYEE_NAME", "AGENCY_NAME", "COMPENSATION_RATE", "ACTIVE_ON_JUNE_30_2024");
            row(hr, 1, "A1", 1.0, "Ann", "Revenue", "31.25", "Y");
            row(hr, 2, "A2", 1.0, "Bob", "Health", "n/a", "N");
            row(hr, 3, "-", 1.0, "Nobody", "Health", "10", "N");
            row(hr, 4, "A3", 2.0, "Cy", "Revenue", 20.5, "Y");

            if (withEarnings) {
                Sheet earnings = wb.createSheet("EARNINGS FY24");
                row(earnings, 0, "TEMPORARY_ID", "REGULAR_WAGES", "OVERTIME_WAGES", "OTHER_WAGES", "TOTAL_WAGES");
                row(earnings, 1, "A1", 90.0, 10.0, "-", "100");
                row(earnings, 2, "A2", "-", "", "-", "1,050.25");
                row(earnings, 3, "A1", 190.0, 10.0, 0.0, 200.0);
            }
            wb.write(out);
        }
    }

    static void writeWithoutIdentifiers(Path file) throws Exception {
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet hr = wb.createSheet("HR INFO FY24");
            row(hr, 0, "TEMPORARY_ID", "RECORD_NBR", "EMPLOYEE_NAME", "AGENCY_NAME");
            row(hr, 1, "-", 1.0, "Ann", "Revenue");
            row(hr, 2, " ", 1.0, "Bob", "Health");
            row(hr, 3, "", 2.0, "Cy", "Revenue");

            Sheet earnings = wb.createSheet("EARNINGS FY24");
            row(earnings, 0, "TEMPORARY_ID", "TOTAL_WAGES");
            row(earnings, 1, "A1", 100.0);
            wb.write(out);
        }
    }

    private static void row(Sheet sheet, int index, Object... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            Object v = values[i];
            if (v instanceof Double) {
                row.createCell(i).setCellValue((Double) v);
            } else {
                row.createCell(i).setCellValue((String) v);
            }
        }
    }
}
