package com.acme.invoicemail.core.service;

import com.acme.invoicemail.core.util.JsonUtils;
import io.awspring.cloud.sqs.operations.SendResult;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Publishes JSON payloads to SQS queues by name.
 */
@Service
public class SqsService {

    private static final Logger log = LoggerFactory.getLogger(SqsService.class);

    private final SqsTemplate sqsTemplate;

    public SqsService(SqsTemplate sqsTemplate) {
        this.sqsTemplate = sqsTemplate;
    }

    public String sendMessage(String queue, Object payload) {
        return sendMessage(queue, payload, Map.of());
    }

    /**
     * @return the SQS message id
     */
    public String sendMessage(String queue, Object payload, Map<String, Object> headers) {
        String body = payload instanceof String text ? text : JsonUtils.toJson(payload);
        SendResult<String> result = sqsTemplate.send(to -> to
                .queue(queue)
                .payload(body)
                .headers(headers));
        log.debug("Sent message: queue={}, messageId={}", queue, result.messageId());
        return String.valueOf(result.messageId());
    }
}
