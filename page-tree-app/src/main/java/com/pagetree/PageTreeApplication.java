package com.pagetree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Resolves page ids of a parent-pointer page tree into site URLs.
 * The data source comes from --dsn, not from spring.datasource.*.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class PageTreeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PageTreeApplication.class, args)));
    }
}
