package com.govinsights.payrollcatalog.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * 배치 적재의 배치별 트랜잭션 경계를 위한 Reactive 트랜잭션 설정입니다.
 * <p>
 * {@link TransactionalOperator}는 {@code BatchLoader}가 배치 하나의 upsert(또는 fallback insert)를
 * 감쌀 때 사용합니다.
 */
@Configuration
public class R2dbcTxConfig {

    /**
     * R2DBC 트랜잭션 매니저.
     *
     * @param cf R2DBC {@link ConnectionFactory}
     * @return Reactive 트랜잭션 매니저
     */
    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    /**
     * 코드 기반 트랜잭션 적용용 operator.
     *
     * @param tm Reactive 트랜잭션 매니저
     * @return operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm);
    }
}
