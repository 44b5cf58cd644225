package com.quorum.books;

import com.quorum.books.config.BooksServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Books service, reference application for Cassandra schema migrations.
 *
 * <p>Spring Boot's Cassandra support opens the {@code CqlSession}; the migration
 * auto-configuration then applies {@code classpath:db/cassandra/migration} to the {@code books}
 * keyspace before the context finishes starting. A failed migration stops the application.
 */
@SpringBootApplication
@EnableConfigurationProperties(BooksServiceProperties.class)
public class BooksServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(BooksServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BooksServiceApplication.class, args);
        log.info("Books service started successfully");
    }
}
