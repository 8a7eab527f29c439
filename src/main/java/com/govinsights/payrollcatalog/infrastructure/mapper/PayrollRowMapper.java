package com.govinsights.payrollcatalog.infrastructure.mapper;

import com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.row.PayrollRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * 조인된 {@link NormalizedRecord}를 DB 입력용 {@link PayrollRow}로 변환한다.
 */
@Component
public class PayrollRowMapper {

    /**
     * 레코드 목록을 회계연도 파티션을 붙여 row로 변환한다(순서 유지).
     *
     * @param records    조인 결과 레코드
     * @param fiscalYear 회계연도
     * @return row 목록
     */
    public List<PayrollRow> toRows(List<NormalizedRecord> records, int fiscalYear) {
        return records.stream().map(r -> toRow(r, fiscalYear)).toList();
    }

    /**
     * 레코드 하나를 row로 변환한다. 금액 필드가 비어 있으면 0으로 채운다.
     *
     * @param r          조인 결과 레코드
     * @param fiscalYear 회계연도
     * @return row
     */
    public PayrollRow toRow(NormalizedRecord r, int fiscalYear) {
        return new PayrollRow(
                r.text(PayrollSchemas.KEY_FIELD),
                asLong(r, "record_nbr"),
                r.text("employee_name"),
                r.text("agency_nbr"),
                r.text("agency_name"),
                r.text("department_nbr"),
                r.text("department_name"),
                r.text("branch_code"),
                r.text("branch_name"),
                r.text("job_code"),
                r.text("job_title"),
                r.text("location_nbr"),
                r.text("location_name"),
                r.text("location_county_name"),
                r.text("reg_temp_code"),
                r.text("reg_temp_desc"),
                r.text("classified_code"),
                r.text("classified_desc"),
                asLong(r, "original_hire_date"),
                r.text("last_hire_date"),
                asLong(r, "job_entry_date"),
                r.text("full_part_time_code"),
                r.text("full_part_time_desc"),
                r.text("salary_plan_grid"),
                asLong(r, "salary_grade_range"),
                asLong(r, "max_salary_step"),
                asDecimal(r, "compensation_rate"),
                r.text("comp_frequency_code"),
                r.text("comp_frequency_desc"),
                asDecimal(r, "position_fte"),
                asLong(r, "bargaining_unit_nbr"),
                r.text("bargaining_unit_name"),
                r.text(PayrollSchemas.ACTIVE_FIELD),
                wage(r, "regular_wages"),
                wage(r, "overtime_wages"),
                wage(r, "other_wages"),
                wage(r, "total_wages"),
                fiscalYear
        );
    }

    private static Long asLong(NormalizedRecord r, String field) {
        Object v = r.get(field);
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).longValue();
        throw new IllegalStateException("Field '" + field + "' is not numeric: " + v);
    }

    private static BigDecimal asDecimal(NormalizedRecord r, String field) {
        Object v = r.get(field);
        if (v == null) return null;
        if (v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Number) return new BigDecimal(v.toString());
        throw new IllegalStateException("Field '" + field + "' is not numeric: " + v);
    }

    private static BigDecimal wage(NormalizedRecord r, String field) {
        BigDecimal d = asDecimal(r, field);
        return d == null ? BigDecimal.ZERO : d;
    }
}
