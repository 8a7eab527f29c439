package com.govinsights.payrollcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PayrollCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayrollCatalogApplication.class, args);
    }
}
