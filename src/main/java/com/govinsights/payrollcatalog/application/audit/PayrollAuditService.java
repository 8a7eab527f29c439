package com.govinsights.payrollcatalog.application.audit;

import com.govinsights.payrollcatalog.application.audit.dto.DatasetAssessment;
import com.govinsights.payrollcatalog.application.audit.dto.DatasetAssessment.SheetSummary;
import com.govinsights.payrollcatalog.application.ingest.PayrollDataset;
import com.govinsights.payrollcatalog.application.ingest.PayrollDatasetReader;
import com.govinsights.payrollcatalog.application.join.JoinResult;
import com.govinsights.payrollcatalog.application.join.RecordJoiner;
import com.govinsights.payrollcatalog.config.PayrollIngestProperties;
import com.govinsights.payrollcatalog.infrastructure.mapper.PayrollSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 회계연도 워크북을 적재하지 않고 진단하는 서비스입니다.
 * <p>
 * 시트/행 수, 재직 여부 컬럼, 필수 필드 누락, 기관별 분포, 자연키 중복, 금액 범위를 보고합니다.
 */
@Service
public class PayrollAuditService {

    private static final Logger log = LoggerFactory.getLogger(PayrollAuditService.class);

    /** 워크북 진단 기준 */
    public static final AuditCriteria PAYROLL_CRITERIA = new AuditCriteria(
            List.of(PayrollSchemas.KEY_FIELD, "employee_name", "agency_name"),
            "agency_name",
            List.of(PayrollSchemas.KEY_FIELD, "record_nbr"),
            List.of("compensation_rate", "total_wages"),
            20
    );

    private final PayrollDatasetReader reader;
    private final RecordJoiner joiner;
    private final QualityAuditor auditor;
    private final PayrollIngestProperties props;

    public PayrollAuditService(
            PayrollDatasetReader reader,
            RecordJoiner joiner,
            QualityAuditor auditor,
            PayrollIngestProperties props
    ) {
        this.reader = reader;
        this.joiner = joiner;
        this.auditor = auditor;
        this.props = props;
    }

    /**
     * 회계연도 워크북을 진단합니다.
     *
     * @param fiscalYear 회계연도
     * @return 진단 결과
     */
    public Mono<DatasetAssessment> assess(int fiscalYear) {
        return reader.read(fiscalYear)
                .map(this::assess)
                .doOnNext(a -> log.info("{}: {} records, {} agencies, unique={}",
                        a.handle(), a.report().recordCount(), a.report().groupCardinality(), a.report().unique()));
    }

    DatasetAssessment assess(PayrollDataset ds) {
        JoinResult joined = joiner.join(
                ds.roster().records(),
                ds.detail().records(),
                PayrollSchemas.KEY_FIELD,
                PayrollSchemas.DETAIL,
                props.detailDuplicatePolicy()
        );
        AuditReport report = auditor.audit(joined.combined(), PAYROLL_CRITERIA);

        Map<String, Integer> anomalies = new LinkedHashMap<>(ds.roster().anomaliesByField());
        ds.detail().anomaliesByField().forEach((k, v) -> anomalies.merge(k, v, Integer::sum));

        return new DatasetAssessment(
                ds.fiscalYear(),
                ds.handle(),
                ds.sheetNames(),
                new SheetSummary(ds.rosterSheet(), ds.rosterHeader().size(), ds.roster().rowsRead()),
                new SheetSummary(ds.detailSheet(), ds.detailHeader().size(), ds.detail().rowsRead()),
                ds.activeColumn(),
                anomalies,
                report
        );
    }
}
