package com.govinsights.payrollcatalog.bootstrap;

import com.govinsights.payrollcatalog.application.common.error.StructuralException;
import com.govinsights.payrollcatalog.application.ingest.PayrollIngestService;
import com.govinsights.payrollcatalog.application.ingest.dto.IngestSummary;
import com.govinsights.payrollcatalog.config.PayrollIngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 설정된 회계연도 워크북들을 순서대로 DB에 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다.</p>
 * <p>구조 오류가 난 연도는 건너뛰고 다음 연도를 계속 처리하지만,
 * 워크북 파일이 없으면 전체 실행을 중단한다.</p>
 */
@Component
@Profile("ingest")
@Order(Ordered.LOWEST_PRECEDENCE)
public class PayrollWorkbookIngestRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PayrollWorkbookIngestRunner.class);

    private final PayrollIngestService ingestService;
    private final PayrollIngestProperties props;

    public PayrollWorkbookIngestRunner(PayrollIngestService ingestService, PayrollIngestProperties props) {
        this.ingestService = ingestService;
        this.props = props;
    }

    /**
     * 애플리케이션 시작 시 실행되는 엔트리 포인트입니다.
     * <p>
     * 전체 처리가 끝날 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(String... args) {
        List<Integer> years = props.fiscalYears();
        if (years.isEmpty()) {
            log.warn("No fiscal years configured (payroll.ingest.fiscal-years). Nothing to ingest.");
            return;
        }
        log.info("Payroll ingest start. years={}, dir={}", years, props.workbookDir());

        List<IngestSummary> summaries = ingestAll(years).block();

        long inserted = 0, present = 0, skipped = 0, failed = 0;
        int structureErrors = 0;
        for (IngestSummary s : summaries) {
            inserted += s.inserted();
            present += s.alreadyPresent();
            skipped += s.skippedRows();
            failed += s.failed();
            if (s.status() == IngestSummary.Status.STRUCTURE_ERROR) structureErrors++;
        }
        log.info("Payroll ingest done. years={}, inserted={}, alreadyPresent={}, skipped={}, failed={}, structureErrors={}",
                summaries.size(), inserted, present, skipped, failed, structureErrors);
    }

    /**
     * 연도별로 순차 적재합니다. {@link StructuralException}은 해당 연도 결과로 바꾸고 나머지 오류는 전파합니다.
     *
     * @param years 회계연도 목록
     * @return 연도별 결과
     */
    Mono<List<IngestSummary>> ingestAll(List<Integer> years) {
        return Flux.fromIterable(years)
                .concatMap(fy -> ingestService.ingest(fy)
                        .onErrorResume(StructuralException.class, e -> {
                            log.error("Fiscal year {} skipped: {}", fy, e.getMessage());
                            return Mono.just(IngestSummary.structureError(fy, e.getMessage()));
                        }))
                .doOnError(e -> log.error("Payroll ingest aborted: {}", e.getMessage()))
                .collectList();
    }
}
