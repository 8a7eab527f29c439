package com.govinsights.payrollcatalog.bootstrap;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 payroll 스키마 마이그레이션을 실행하는 설정 클래스입니다.
 *
 * <p>R2DBC는 DDL 마이그레이션을 지원하지 않으므로 JDBC datasource 설정으로 {@link Flyway#migrate()}를
 * 직접 수행합니다. ingest 러너보다 먼저 실행됩니다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}, {@code spring.flyway.baseline-version}</p>
 */
@Configuration
@Profile("local | ingest")
public class FlywayRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * Flyway 마이그레이션 Runner Bean.
     *
     * @param env datasource/flyway 설정 조회용 {@link Environment}
     * @return 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    ApplicationRunner runFlyway(Environment env) {
        return args -> {
            String url = env.getRequiredProperty("spring.datasource.url");
            String user = env.getProperty("spring.datasource.username");
            String pass = env.getProperty("spring.datasource.password");

            Flyway flyway = Flyway.configure()
                    .dataSource(url, user, pass)
                    .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                    .baselineOnMigrate(Boolean.parseBoolean(
                            env.getProperty("spring.flyway.baseline-on-migrate", "false")
                    ))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            MigrateResult result = flyway.migrate();
            log.info("Flyway migrate done. executed={}, targetVersion={}",
                    result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
