package com.acme.invoicemail.core.config;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.net.URI;

/**
 * Points the SQS client at LocalStack when the "local" or "docker" profile
 * is active.
 */
@Configuration
@Profile({"local", "docker"})
public class LocalAwsConfiguration {

    @Value("${invoicemail.aws.endpoint:http://localhost:4566}")
    private String awsEndpoint;

    @Value("${invoicemail.aws.region:us-east-1}")
    private String awsRegion;

    @Bean
    @Primary
    public SqsAsyncClient sqsAsyncClient() {
        return SqsAsyncClient.builder()
                .endpointOverride(URI.create(awsEndpoint))
                .region(Region.of(awsRegion))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create("test", "test")))
                .build();
    }

    @Bean
    public SqsQueueProvisioner sqsQueueProvisioner(SqsAsyncClient sqsAsyncClient,
                                                   InvoiceMailProperties properties) {
        return new SqsQueueProvisioner(sqsAsyncClient, properties.getQueues());
    }
}
