package com.govinsights.payrollcatalog.infrastructure.mapper;

import java.util.List;

import static com.govinsights.payrollcatalog.infrastructure.mapper.FieldType.*;

/**
 * 급여 워크북의 HR INFO(roster) / EARNINGS(detail) 시트 스키마.
 * <p>
 * 컬럼 라벨은 연도별 워크북에서 공통인 이름이고, 재직 여부 컬럼처럼 연도마다 바뀌는 라벨은
 * {@link RecordSchema#withColumn(String, String)}으로 실제 라벨을 채운다.
 */
public final class PayrollSchemas {

    private PayrollSchemas() {}

    /** 조인 키 필드 */
    public static final String KEY_FIELD = "temporary_id";

    /** 두 시트에 공통으로 필요한 식별자 컬럼 */
    public static final String ID_COLUMN = "TEMPORARY_ID";

    /** 연도별로 이름이 바뀌는 재직 여부 필드(라벨은 실행 시 결정) */
    public static final String ACTIVE_FIELD = "active_on_june_30";

    public static final String FISCAL_YEAR = "fiscal_year";

    /** 회계연도 파티션 안에서의 자연키 */
    public static final List<String> NATURAL_KEY = List.of(KEY_FIELD, "record_nbr", FISCAL_YEAR);

    public static final RecordSchema ROSTER = new RecordSchema("roster", List.of(
            FieldSpec.of(KEY_FIELD, ID_COLUMN, TEXT),
            FieldSpec.of("record_nbr", "RECORD_NBR", INTEGER),
            FieldSpec.of("employee_name", "EMPLOYEE_NAME", TEXT),
            FieldSpec.of("agency_nbr", "AGENCY_NBR", TEXT),
            FieldSpec.of("agency_name", "AGENCY_NAME", TEXT),
            FieldSpec.of("department_nbr", "DEPARTMENT_NBR", TEXT),
            FieldSpec.of("department_name", "DEPARTMENT_NAME", TEXT),
            FieldSpec.of("branch_code", "BRANCH_CODE", TEXT),
            FieldSpec.of("branch_name", "BRANCH_NAME", TEXT),
            FieldSpec.of("job_code", "JOB_CODE", TEXT),
            FieldSpec.of("job_title", "JOB_TITLE", TEXT),
            FieldSpec.of("location_nbr", "LOCATION_NBR", TEXT),
            FieldSpec.of("location_name", "LOCATION_NAME", TEXT),
            FieldSpec.of("location_county_name", "LOCATION_COUNTY_NAME", TEXT),
            FieldSpec.of("reg_temp_code", "REG_TEMP_CODE", TEXT),
            FieldSpec.of("reg_temp_desc", "REG_TEMP_DESC", TEXT),
            FieldSpec.of("classified_code", "CLASSIFIED_CODE", TEXT),
            FieldSpec.of("classified_desc", "CLASSIFIED_DESC", TEXT),
            FieldSpec.of("original_hire_date", "ORIGINAL_HIRE_DATE", DATE_SERIAL),
            FieldSpec.of("last_hire_date", "LAST_HIRE_DATE", HIRE_DATE_TEXT),
            FieldSpec.of("job_entry_date", "JOB_ENTRY_DATE", DATE_SERIAL),
            FieldSpec.of("full_part_time_code", "FULL_PART_TIME_CODE", TEXT),
            FieldSpec.of("full_part_time_desc", "FULL_PART_TIME_DESC", TEXT),
            FieldSpec.of("salary_plan_grid", "SALARY_PLAN_GRID", TEXT),
            FieldSpec.of("salary_grade_range", "SALARY_GRADE_RANGE", INTEGER),
            FieldSpec.of("max_salary_step", "MAX_SALARY_STEP", INTEGER),
            FieldSpec.of("compensation_rate", "COMPENSATION_RATE", DECIMAL),
            FieldSpec.of("comp_frequency_code", "COMP_FREQUENCY_CODE", TEXT),
            FieldSpec.of("comp_frequency_desc", "COMP_FREQUENCY_DESC", TEXT),
            FieldSpec.of("position_fte", "POSITION_FTE", DECIMAL),
            FieldSpec.of("bargaining_unit_nbr", "BARGAINING_UNIT_NBR", INTEGER),
            FieldSpec.of("bargaining_unit_name", "BARGAINING_UNIT_NAME", TEXT),
            FieldSpec.of(ACTIVE_FIELD, null, TEXT)
    ));

    public static final RecordSchema DETAIL = new RecordSchema("detail", List.of(
            FieldSpec.of(KEY_FIELD, ID_COLUMN, TEXT),
            FieldSpec.of("regular_wages", "REGULAR_WAGES", WAGE),
            FieldSpec.of("overtime_wages", "OVERTIME_WAGES", WAGE),
            FieldSpec.of("other_wages", "OTHER_WAGES", WAGE),
            FieldSpec.of("total_wages", "TOTAL_WAGES", WAGE)
    ));

    /**
     * 실제 재직 여부 컬럼 라벨을 반영한 roster 스키마를 반환한다.
     *
     * @param activeColumn 시트에서 찾은 라벨(Nullable: 없으면 필드는 null)
     * @return roster 스키마
     */
    public static RecordSchema roster(String activeColumn) {
        return ROSTER.withColumn(ACTIVE_FIELD, activeColumn);
    }
}
