package com.govinsights.payrollcatalog.application.ingest;

import com.govinsights.payrollcatalog.application.common.error.NotFoundException;
import com.govinsights.payrollcatalog.config.PayrollIngestProperties;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.SchemaResolver;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.TabularSource;
import com.govinsights.payrollcatalog.infrastructure.input.workbook.TabularSourceProvider;
import com.govinsights.payrollcatalog.infrastructure.mapper.PayrollSchemas;
import com.govinsights.payrollcatalog.infrastructure.mapper.RecordExtractor;
import com.govinsights.payrollcatalog.infrastructure.mapper.RecordExtractor.ExtractionResult;
import com.govinsights.payrollcatalog.infrastructure.mapper.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * 회계연도 워크북을 열어 구조를 확인하고 두 시트를 정규화 레코드로 읽어옵니다.
 * <p>
 * 파일 I/O는 blocking 이므로 {@link Schedulers#boundedElastic()}에서 수행합니다.
 * 파일이 없거나 열 수 없으면 {@link NotFoundException}({@value #DATASET_NOT_FOUND}),
 * 필수 시트/컬럼이 없으면 {@link com.govinsights.payrollcatalog.application.common.error.StructuralException}을 보냅니다.
 */
@Component
public class PayrollDatasetReader {

    public static final String DATASET_NOT_FOUND = "DATASET_NOT_FOUND";

    private static final Logger log = LoggerFactory.getLogger(PayrollDatasetReader.class);

    private final TabularSourceProvider provider;
    private final PayrollIngestProperties props;

    public PayrollDatasetReader(TabularSourceProvider provider, PayrollIngestProperties props) {
        this.provider = provider;
        this.props = props;
    }

    /**
     * 회계연도 워크북을 읽습니다.
     *
     * @param fiscalYear 회계연도
     * @return 읽은 데이터셋
     */
    public Mono<PayrollDataset> read(int fiscalYear) {
        return Mono.fromCallable(() -> readBlocking(fiscalYear))
                .subscribeOn(Schedulers.boundedElastic());
    }

    PayrollDataset readBlocking(int fiscalYear) {
        String handle = props.fileNameFor(fiscalYear);

        try (TabularSource src = open(handle)) {
            List<String> sheets = src.sheetNames();
            String rosterSheet = SchemaResolver.requireSheet(handle, sheets, props.rosterSheetPattern());
            String detailSheet = SchemaResolver.requireSheet(handle, sheets, props.detailSheetPattern());

            List<String> rosterHeader = src.header(rosterSheet);
            List<String> detailHeader = src.header(detailSheet);
            String rosterId = SchemaResolver.requireColumn(handle, rosterSheet, rosterHeader, PayrollSchemas.ID_COLUMN);
            String detailId = SchemaResolver.requireColumn(handle, detailSheet, detailHeader, PayrollSchemas.ID_COLUMN);

            String activeColumn = SchemaResolver.findColumn(rosterHeader, props.activeColumnPattern()).orElse(null);
            if (activeColumn == null) {
                log.warn("{}: no column matching '{}' in sheet '{}'", handle, props.activeColumnPattern(), rosterSheet);
            }

            RecordSchema rosterSchema = PayrollSchemas.roster(activeColumn)
                    .withColumn(PayrollSchemas.KEY_FIELD, rosterId);
            RecordSchema detailSchema = PayrollSchemas.DETAIL
                    .withColumn(PayrollSchemas.KEY_FIELD, detailId);
            ExtractionResult roster = RecordExtractor.extract(src.rows(rosterSheet), rosterSchema);
            ExtractionResult detail = RecordExtractor.extract(src.rows(detailSheet), detailSchema);

            log.info("{}: read {} roster rows from '{}', {} detail rows from '{}'",
                    handle, roster.rowsRead(), rosterSheet, detail.rowsRead(), detailSheet);

            return new PayrollDataset(fiscalYear, handle, sheets, rosterSheet, detailSheet,
                    rosterHeader, detailHeader, activeColumn, roster, detail);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close workbook " + handle, e);
        }
    }

    private TabularSource open(String handle) {
        try {
            return provider.open(handle);
        } catch (IOException e) {
            throw new NotFoundException("Dataset not found or unreadable: " + handle, DATASET_NOT_FOUND, e);
        }
    }
}
