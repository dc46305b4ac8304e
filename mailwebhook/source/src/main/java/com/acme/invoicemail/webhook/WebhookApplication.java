package com.acme.invoicemail.webhook;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {
    "com.acme.invoicemail.webhook",
    "com.acme.invoicemail.core"
})
@EnableConfigurationProperties(InvoiceMailProperties.class)
public class WebhookApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebhookApplication.class, args);
    }
}
