package com.govinsights.payrollcatalog.application.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * row 목록을 배치 단위로 나누어 순차적으로 멱등 적재합니다.
 * <p>
 * 각 배치는 독립된 트랜잭션에서 upsert 되고, upsert가 실패하면 같은 배치를 한 번 더 insert로 시도합니다.
 * 두 시도가 모두 실패한 배치는 실패로 기록하고 다음 배치를 계속 진행합니다.
 * 이미 커밋된 배치는 되돌리지 않습니다.
 */
@Component
public class BatchLoader {

    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    /** 배치별 트랜잭션 경계 */
    private final TransactionalOperator tx;

    public BatchLoader(TransactionalOperator tx) {
        this.tx = tx;
    }

    /**
     * rows를 batchSize 단위로 적재합니다.
     * <p>
     * 배치는 {@code ceil(N / batchSize)}개이며 {@code concatMap}으로 앞 배치가 끝난 뒤에만 다음 배치가 시작됩니다.
     * 적재 실패는 error 신호로 전파되지 않고 {@link LoadResult}에 집계됩니다.
     *
     * @param rows         적재할 row(순서 유지)
     * @param batchSize    배치 크기(1 이상)
     * @param store        저장소
     * @param naturalKey   자연키 컬럼명
     * @param policy       충돌 정책
     * @param <T>          row 타입
     * @return 적재 결과
     * @throws IllegalArgumentException batchSize가 1 미만인 경우
     */
    public <T> Mono<LoadResult> load(List<T> rows,
                                     int batchSize,
                                     RecordStore<T> store,
                                     List<String> naturalKey,
                                     ConflictPolicy policy) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
        }
        if (rows == null || rows.isEmpty()) return Mono.just(LoadResult.empty());

        List<Slice<T>> slices = slice(rows, batchSize);
        log.info("Loading {} rows in {} batches (batchSize={}, policy={})",
                rows.size(), slices.size(), batchSize, policy);

        return Flux.fromIterable(slices)
                .concatMap(s -> loadSlice(s, store, naturalKey, policy))
                .reduce(LoadResult.empty(), LoadResult::plus);
    }

    /**
     * 배치 하나를 upsert → (실패 시) insert 순서로 적재합니다.
     */
    private <T> Mono<LoadResult> loadSlice(Slice<T> s,
                                           RecordStore<T> store,
                                           List<String> naturalKey,
                                           ConflictPolicy policy) {
        int size = s.rows().size();

        return tx.transactional(Mono.defer(() -> store.upsert(s.rows(), naturalKey, policy)))
                .onErrorResume(e -> {
                    log.warn("Batch {} (rows {}-{}) upsert failed, retrying as insert: {}",
                            s.index(), s.from(), s.to() - 1, e.getMessage());
                    return tx.transactional(Mono.defer(() -> store.insert(s.rows())));
                })
                .map(n -> LoadResult.ofSuccess(size, n))
                .defaultIfEmpty(LoadResult.ofSuccess(size, size))
                .doOnNext(r -> log.debug("Batch {} done. rows={}, reported={}", s.index(), size, r.reported()))
                .onErrorResume(e -> {
                    log.error("Batch {} (rows {}-{}) failed: {}", s.index(), s.from(), s.to() - 1, e.getMessage());
                    return Mono.just(LoadResult.ofFailure(
                            new FailedBatch(s.index(), s.from(), s.to(), String.valueOf(e.getMessage()))));
                });
    }

    /** rows를 연속 구간으로 나눕니다. */
    static <T> List<Slice<T>> slice(List<T> rows, int batchSize) {
        List<Slice<T>> out = new ArrayList<>((rows.size() + batchSize - 1) / batchSize);
        for (int from = 0, i = 0; from < rows.size(); from += batchSize, i++) {
            int to = Math.min(from + batchSize, rows.size());
            out.add(new Slice<>(i, from, to, rows.subList(from, to)));
        }
        return out;
    }

    /** 배치 하나(원본 목록의 연속 구간) */
    record Slice<T>(int index, int from, int to, List<T> rows) {}
}
