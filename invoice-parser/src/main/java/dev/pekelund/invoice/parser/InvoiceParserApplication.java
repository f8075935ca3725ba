package dev.pekelund.invoice.parser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the invoice extraction service.
 */
@SpringBootApplication
public class InvoiceParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceParserApplication.class, args);
    }
}
