package com.govinsights.payrollcatalog.application.ingest;

import com.govinsights.payrollcatalog.application.ingest.dto.IngestSummary;
import com.govinsights.payrollcatalog.application.join.JoinResult;
import com.govinsights.payrollcatalog.application.join.RecordJoiner;
import com.govinsights.payrollcatalog.application.load.BatchLoader;
import com.govinsights.payrollcatalog.application.load.LoadResult;
import com.govinsights.payrollcatalog.application.load.RecordStore;
import com.govinsights.payrollcatalog.config.PayrollIngestProperties;
import com.govinsights.payrollcatalog.infrastructure.mapper.PayrollRowMapper;
import com.govinsights.payrollcatalog.infrastructure.mapper.PayrollSchemas;
import com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.row.PayrollRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 회계연도 워크북 하나를 payroll 테이블에 적재(ingest)하는 서비스입니다.
 * <p>
 * 처리 순서: 워크북 읽기 → roster/detail 정규화 → roster 기준 left join →
 * {@link PayrollRow} 변환 → 배치 멱등 적재.
 * <p>
 * 자연키 {@code (temporary_id, record_nbr, fiscal_year)} 기준으로 적재하므로 같은 연도를 다시 실행해도 안전합니다.
 */
@Service
public class PayrollIngestService {

    private static final Logger log = LoggerFactory.getLogger(PayrollIngestService.class);

    private final PayrollDatasetReader reader;
    private final RecordJoiner joiner;
    private final PayrollRowMapper mapper;
    private final BatchLoader loader;
    private final RecordStore<PayrollRow> store;
    private final PayrollIngestProperties props;

    public PayrollIngestService(
            PayrollDatasetReader reader,
            RecordJoiner joiner,
            PayrollRowMapper mapper,
            BatchLoader loader,
            RecordStore<PayrollRow> store,
            PayrollIngestProperties props
    ) {
        this.reader = reader;
        this.joiner = joiner;
        this.mapper = mapper;
        this.loader = loader;
        this.store = store;
        this.props = props;
    }

    /**
     * 회계연도 워크북을 적재합니다.
     *
     * @param fiscalYear 회계연도
     * @return 적재 결과(파일이 없으면 NotFoundException, 구조 오류면 StructuralException 신호)
     */
    public Mono<IngestSummary> ingest(int fiscalYear) {
        return reader.read(fiscalYear)
                .flatMap(this::load)
                .doOnNext(s -> log.info("Fiscal year {} done. inserted={}, alreadyPresent={}, skipped={}, failed={}, anomalies={}",
                        fiscalYear, s.inserted(), s.alreadyPresent(), s.skippedRows(), s.failed(), s.anomalies()));
    }

    private Mono<IngestSummary> load(PayrollDataset ds) {
        JoinResult joined = joiner.join(
                ds.roster().records(),
                ds.detail().records(),
                PayrollSchemas.KEY_FIELD,
                PayrollSchemas.DETAIL,
                props.detailDuplicatePolicy()
        );
        if (joined.detailDuplicates() > 0) {
            log.warn("{}: {} duplicate identifiers in detail sheet ({})",
                    ds.handle(), joined.detailDuplicates(), props.detailDuplicatePolicy());
        }

        List<PayrollRow> rows = mapper.toRows(joined.combined(), ds.fiscalYear());
        if (rows.isEmpty()) {
            log.warn("{}: no valid records", ds.handle());
        }

        return loader.load(rows, props.batchSize(), store, PayrollSchemas.NATURAL_KEY, props.conflictPolicy())
                .map(result -> summarize(ds, joined, result));
    }

    static IngestSummary summarize(PayrollDataset ds, JoinResult joined, LoadResult result) {
        Map<String, Integer> anomalies = new LinkedHashMap<>(ds.roster().anomaliesByField());
        ds.detail().anomaliesByField().forEach((k, v) -> anomalies.merge(k, v, Integer::sum));

        long inserted = Math.min(result.reported(), result.succeeded());
        return new IngestSummary(
                ds.fiscalYear(),
                IngestSummary.Status.COMPLETED,
                ds.roster().rowsRead(),
                ds.detail().rowsRead(),
                joined.combined().size(),
                joined.droppedRoster(),
                joined.matched(),
                joined.detailDuplicates(),
                anomalies,
                inserted,
                result.succeeded() - inserted,
                result.failed(),
                result.batchesAttempted(),
                result.failedBatches(),
                joined.combined().isEmpty() ? "No valid records" : null
        );
    }
}
