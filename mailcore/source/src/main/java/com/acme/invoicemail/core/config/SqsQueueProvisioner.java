package com.acme.invoicemail.core.config;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;

import java.util.List;
import java.util.Map;

/**
 * Creates the gateway queues, each with a dead-letter queue and redrive
 * policy, before listener containers start. Local development only.
 */
public class SqsQueueProvisioner implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(SqsQueueProvisioner.class);

    private final SqsAsyncClient sqsAsyncClient;
    private final InvoiceMailProperties.Queues queues;

    public SqsQueueProvisioner(SqsAsyncClient sqsAsyncClient, InvoiceMailProperties.Queues queues) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.queues = queues;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (String queue : List.of(queues.getWebhookNotifications(), queues.getRawMail())) {
            provision(queue);
        }
    }

    String provision(String queueName) {
        String dlqName = queueName + queues.getDeadLetterSuffix();
        String dlqUrl = sqsAsyncClient.createQueue(CreateQueueRequest.builder()
                .queueName(dlqName)
                .build()).join().queueUrl();

        String dlqArn = sqsAsyncClient.getQueueAttributes(GetQueueAttributesRequest.builder()
                        .queueUrl(dlqUrl)
                        .attributeNames(QueueAttributeName.QUEUE_ARN)
                        .build()).join()
                .attributes().get(QueueAttributeName.QUEUE_ARN);

        String redrivePolicy = "{\"deadLetterTargetArn\":\"" + dlqArn
                + "\",\"maxReceiveCount\":\"" + queues.getMaxReceiveCount() + "\"}";

        String queueUrl = sqsAsyncClient.createQueue(CreateQueueRequest.builder()
                .queueName(queueName)
                .attributes(Map.of(QueueAttributeName.REDRIVE_POLICY, redrivePolicy))
                .build()).join().queueUrl();

        log.info("Provisioned queue: queue={}, dlq={}, maxReceiveCount={}",
                queueUrl, dlqName, queues.getMaxReceiveCount());
        return queueUrl;
    }
}
