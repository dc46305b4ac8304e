package com.acme.invoicemail.ingest;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {
    "com.acme.invoicemail.ingest",
    "com.acme.invoicemail.core"
})
@EnableConfigurationProperties(InvoiceMailProperties.class)
public class IngestApplication {
    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
