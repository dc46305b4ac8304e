package com.acme.invoicemail.processor;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {
    "com.acme.invoicemail.processor",
    "com.acme.invoicemail.core"
})
@EnableConfigurationProperties(InvoiceMailProperties.class)
public class WebhookProcessorApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebhookProcessorApplication.class, args);
    }
}
