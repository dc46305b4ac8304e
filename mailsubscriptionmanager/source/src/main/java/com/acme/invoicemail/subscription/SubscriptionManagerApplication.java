package com.acme.invoicemail.subscription;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {
    "com.acme.invoicemail.subscription",
    "com.acme.invoicemail.core"
})
@EnableConfigurationProperties(InvoiceMailProperties.class)
public class SubscriptionManagerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SubscriptionManagerApplication.class, args);
    }
}
