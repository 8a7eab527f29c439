package com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.row;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * payroll 테이블 적재용 row.
 * <p>
 * 한 회계연도 워크북의 roster 레코드 하나에 EARNINGS 금액을 붙인 형태이며,
 * {@code (temporary_id, record_nbr, fiscal_year)}가 자연키입니다.
 * 날짜 필드(original_hire_date, job_entry_date)는 1899-12-30 기준 일련번호입니다.
 */
public record PayrollRow(
        String temporaryId,
        Long recordNbr,
        String employeeName,
        String agencyNbr,
        String agencyName,
        String departmentNbr,
        String departmentName,
        String branchCode,
        String branchName,
        String jobCode,
        String jobTitle,
        String locationNbr,
        String locationName,
        String locationCountyName,
        String regTempCode,
        String regTempDesc,
        String classifiedCode,
        String classifiedDesc,
        Long originalHireDate,
        String lastHireDate,
        Long jobEntryDate,
        String fullPartTimeCode,
        String fullPartTimeDesc,
        String salaryPlanGrid,
        Long salaryGradeRange,
        Long maxSalaryStep,
        BigDecimal compensationRate,
        String compFrequencyCode,
        String compFrequencyDesc,
        BigDecimal positionFte,
        Long bargainingUnitNbr,
        String bargainingUnitName,
        String activeOnJune30,
        BigDecimal regularWages,
        BigDecimal overtimeWages,
        BigDecimal otherWages,
        BigDecimal totalWages,
        int fiscalYear
) {

    /** 컬럼명(바인딩 순서) */
    public static final List<String> COLUMNS = List.of(
            "temporary_id", "record_nbr", "employee_name", "agency_nbr", "agency_name",
            "department_nbr", "department_name", "branch_code", "branch_name",
            "job_code", "job_title", "location_nbr", "location_name", "location_county_name",
            "reg_temp_code", "reg_temp_desc", "classified_code", "classified_desc",
            "original_hire_date", "last_hire_date", "job_entry_date",
            "full_part_time_code", "full_part_time_desc", "salary_plan_grid",
            "salary_grade_range", "max_salary_step", "compensation_rate",
            "comp_frequency_code", "comp_frequency_desc", "position_fte",
            "bargaining_unit_nbr", "bargaining_unit_name", "active_on_june_30",
            "regular_wages", "overtime_wages", "other_wages", "total_wages",
            "fiscal_year"
    );

    /** null 바인딩 시 사용할 타입({@link #COLUMNS}와 같은 순서) */
    public static final List<Class<?>> TYPES = List.of(
            String.class, Long.class, String.class, String.class, String.class,
            String.class, String.class, String.class, String.class,
            String.class, String.class, String.class, String.class, String.class,
            String.class, String.class, String.class, String.class,
            Long.class, String.class, Long.class,
            String.class, String.class, String.class,
            Long.class, Long.class, BigDecimal.class,
            String.class, String.class, BigDecimal.class,
            Long.class, String.class, String.class,
            BigDecimal.class, BigDecimal.class, BigDecimal.class, BigDecimal.class,
            Integer.class
    );

    /**
     * 컬럼 순서대로 값을 반환합니다.
     *
     * @return 값 목록(Nullable 원소 포함)
     */
    public List<Object> values() {
        return Arrays.asList(
                temporaryId, recordNbr, employeeName, agencyNbr, agencyName,
                departmentNbr, departmentName, branchCode, branchName,
                jobCode, jobTitle, locationNbr, locationName, locationCountyName,
                regTempCode, regTempDesc, classifiedCode, classifiedDesc,
                originalHireDate, lastHireDate, jobEntryDate,
                fullPartTimeCode, fullPartTimeDesc, salaryPlanGrid,
                salaryGradeRange, maxSalaryStep, compensationRate,
                compFrequencyCode, compFrequencyDesc, positionFte,
                bargainingUnitNbr, bargainingUnitName, activeOnJune30,
                regularWages, overtimeWages, otherWages, totalWages,
                fiscalYear
        );
    }
}
