package com.acme.invoicemail.subscription.service;

import com.acme.invoicemail.core.InvoiceMailProperties;
import com.acme.invoicemail.core.exception.ProviderItemNotFoundException;
import com.acme.invoicemail.core.graph.GraphResourcePath;
import com.acme.invoicemail.core.graph.MailProviderClient;
import com.acme.invoicemail.core.model.GraphSubscription;
import com.acme.invoicemail.core.model.SubscriptionRecord;
import com.acme.invoicemail.core.util.SecretMasking;
import com.acme.invoicemail.core.util.UlidGenerator;
import com.acme.invoicemail.subscription.store.SubscriptionRecordStore;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keeps exactly one live provider subscription on the invoice inbox.
 *
 * <p>The store is the source of truth. Each run reads the active record and
 * either creates a subscription, renews one that is close to expiry, or does
 * nothing. Store writes are conditional, so a replica that loses a race
 * reports {@link LifecycleOutcome#CONFLICT} and leaves the winner's record
 * alone. Failures are logged and retried on the next run.</p>
 */
@Service
public class SubscriptionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleService.class);

    private final SubscriptionRecordStore store;
    private final MailProviderClient mailClient;
    private final InvoiceMailProperties properties;
    private final Clock clock;

    public SubscriptionLifecycleService(
            SubscriptionRecordStore store,
            MailProviderClient mailClient,
            InvoiceMailProperties properties,
            Clock clock) {
        this.store = store;
        this.mailClient = mailClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${invoicemail.subscription.initial-delay-ms:30000}",
            fixedDelayString = "${invoicemail.subscription.check-interval-ms:21600000}")
    @SchedulerLock(name = "subscription-reconcile", lockAtLeastFor = "PT30S", lockAtMostFor = "PT5M")
    public void scheduledReconcile() {
        if (!properties.getSubscription().isEnabled()) {
            log.debug("Subscription management disabled");
            return;
        }
        LifecycleOutcome outcome = reconcile();
        log.info("Scheduled subscription check finished: outcome={}", outcome);
    }

    public LifecycleOutcome reconcile() {
        String resource = watchedResource();
        if (resource == null) {
            return LifecycleOutcome.FAILED;
        }

        Optional<SubscriptionRecord> active;
        try {
            active = store.findActive(resource);
        } catch (DataAccessException e) {
            log.warn("Subscription store unavailable, skipping provider calls: resource={}, error={}",
                    resource, e.toString());
            return LifecycleOutcome.FAILED;
        }

        if (active.isEmpty()) {
            log.info("No active subscription, creating: resource={}", resource);
            return create(resource);
        }

        SubscriptionRecord current = active.get();
        Duration remaining = Duration.between(clock.instant(), current.getExpiresAt());
        if (remaining.compareTo(properties.getSubscription().getRenewalThreshold()) >= 0) {
            log.debug("Subscription healthy: subscriptionId={}, remaining={}", current.getSubscriptionId(), remaining);
            return LifecycleOutcome.UNCHANGED;
        }

        log.info("Subscription due for renewal: subscriptionId={}, remaining={}", current.getSubscriptionId(), remaining);
        return renew(current);
    }

    /**
     * Retires the current record, deletes its provider subscription and
     * starts a fresh one. The record goes first so a store failure never
     * leaves an active record pointing at a deleted subscription.
     */
    public LifecycleOutcome recreate() {
        String resource = watchedResource();
        if (resource == null) {
            return LifecycleOutcome.FAILED;
        }

        Optional<SubscriptionRecord> active;
        try {
            active = store.findActive(resource);
        } catch (DataAccessException e) {
            log.warn("Subscription store unavailable, recreate aborted: resource={}, error={}",
                    resource, e.toString());
            return LifecycleOutcome.FAILED;
        }

        if (active.isPresent()) {
            SubscriptionRecord current = active.get();
            LifecycleOutcome superseded = supersede(current);
            if (superseded != null) {
                return superseded;
            }
            try {
                mailClient.deleteSubscription(current.getSubscriptionId());
            } catch (ProviderItemNotFoundException e) {
                log.info("Subscription already gone at provider: subscriptionId={}", current.getSubscriptionId());
            } catch (RuntimeException e) {
                // duplicate notifications from the old subscription are absorbed by the ledger until it expires
                log.warn("Could not delete old subscription, continuing: subscriptionId={}, error={}",
                        current.getSubscriptionId(), e.toString());
            }
        }
        return create(resource);
    }

    public List<SubscriptionRecord> history() {
        return store.findAll();
    }

    private LifecycleOutcome create(String resource) {
        InvoiceMailProperties.Webhook webhook = properties.getWebhook();
        if (isBlank(webhook.getNotificationUrl()) || isBlank(webhook.getClientState())) {
            log.error("Webhook notification URL or client state not configured, cannot subscribe: resource={}",
                    resource);
            return LifecycleOutcome.FAILED;
        }

        Instant now = clock.instant();
        GraphSubscription created;
        try {
            created = mailClient.createSubscription(
                    resource,
                    webhook.getNotificationUrl(),
                    properties.getSubscription().getChangeType(),
                    webhook.getClientState(),
                    now.plus(properties.getSubscription().getLifetime()));
        } catch (RuntimeException e) {
            log.error("Subscription create failed: resource={}, error={}", resource, e.toString());
            return LifecycleOutcome.FAILED;
        }

        SubscriptionRecord record = SubscriptionRecord.builder()
                .id(UlidGenerator.generate(now))
                .subscriptionId(created.getId())
                .resourceRef(resource)
                .clientStateHint(SecretMasking.prefix(webhook.getClientState(), webhook.getSecretLogPrefixLength()))
                .expiresAt(expiryOf(created, now))
                .active(true)
                .createdAt(now)
                .build();

        try {
            if (!store.insertActive(record)) {
                log.warn("Concurrent create detected, discarding our subscription: subscriptionId={}", created.getId());
                discard(created.getId());
                return LifecycleOutcome.CONFLICT;
            }
        } catch (DataAccessException e) {
            log.error("Could not record new subscription, discarding it: subscriptionId={}, error={}",
                    created.getId(), e.toString());
            discard(created.getId());
            return LifecycleOutcome.FAILED;
        }

        log.info("Subscription created: subscriptionId={}, resource={}, expiresAt={}",
                created.getId(), resource, record.getExpiresAt());
        return LifecycleOutcome.CREATED;
    }

    private LifecycleOutcome renew(SubscriptionRecord current) {
        Instant now = clock.instant();
        GraphSubscription renewed;
        try {
            renewed = mailClient.renewSubscription(
                    current.getSubscriptionId(), now.plus(properties.getSubscription().getLifetime()));
        } catch (ProviderItemNotFoundException e) {
            log.warn("Subscription no longer exists at provider, recreating: subscriptionId={}",
                    current.getSubscriptionId());
            LifecycleOutcome superseded = supersede(current);
            return superseded != null ? superseded : create(current.getResourceRef());
        } catch (RuntimeException e) {
            log.error("Subscription renew failed: subscriptionId={}, error={}",
                    current.getSubscriptionId(), e.toString());
            return LifecycleOutcome.FAILED;
        }

        SubscriptionRecord replacement = current.toBuilder()
                .id(UlidGenerator.generate(now))
                .expiresAt(expiryOf(renewed, now))
                .active(true)
                .createdAt(now)
                .renewedAt(now)
                .build();

        try {
            if (!store.replaceActive(current.getId(), replacement)) {
                log.info("Subscription already renewed by another writer: subscriptionId={}",
                        current.getSubscriptionId());
                return LifecycleOutcome.CONFLICT;
            }
        } catch (DataAccessException e) {
            log.error("Could not record renewal: subscriptionId={}, error={}", current.getSubscriptionId(), e.toString());
            return LifecycleOutcome.FAILED;
        }

        log.info("Subscription renewed: subscriptionId={}, expiresAt={}",
                current.getSubscriptionId(), replacement.getExpiresAt());
        return LifecycleOutcome.RENEWED;
    }

    /**
     * @return null when the record was superseded, otherwise the outcome to report
     */
    private LifecycleOutcome supersede(SubscriptionRecord current) {
        try {
            if (store.supersede(current.getId())) {
                return null;
            }
            log.info("Record already superseded by another writer: id={}", current.getId());
            return LifecycleOutcome.CONFLICT;
        } catch (DataAccessException e) {
            log.error("Could not supersede record: id={}, error={}", current.getId(), e.toString());
            return LifecycleOutcome.FAILED;
        }
    }

    private void discard(String subscriptionId) {
        try {
            mailClient.deleteSubscription(subscriptionId);
        } catch (RuntimeException e) {
            // expires on its own within the subscription lifetime
            log.warn("Could not delete surplus subscription: subscriptionId={}, error={}",
                    subscriptionId, e.toString());
        }
    }

    private Instant expiryOf(GraphSubscription subscription, Instant now) {
        Instant expiry = subscription.getExpirationDateTime();
        return expiry != null ? expiry : now.plus(properties.getSubscription().getLifetime());
    }

    private String watchedResource() {
        String mailbox = properties.getGraph().getMailbox();
        if (isBlank(mailbox)) {
            log.error("No mailbox configured, cannot manage subscription");
            return null;
        }
        return GraphResourcePath.inboxMessages(mailbox);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
