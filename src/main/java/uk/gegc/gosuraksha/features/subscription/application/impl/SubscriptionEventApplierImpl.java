package uk.gegc.gosuraksha.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gosuraksha.features.account.domain.exception.AccountNotFoundException;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;
import uk.gegc.gosuraksha.features.subscription.application.SubscriptionEventApplier;
import uk.gegc.gosuraksha.features.subscription.application.SubscriptionWebhookService.Result;
import uk.gegc.gosuraksha.features.subscription.application.WebhookOutcome;
import uk.gegc.gosuraksha.features.subscription.domain.model.CanonicalSubscriptionEvent;
import uk.gegc.gosuraksha.features.subscription.domain.model.EventProcessingStatus;
import uk.gegc.gosuraksha.features.subscription.domain.model.SubscriptionEvent;
import uk.gegc.gosuraksha.features.subscription.domain.repository.SubscriptionEventRepository;

import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionEventApplierImpl implements SubscriptionEventApplier {

    private final AccountRepository accountRepository;
    private final SubscriptionEventRepository subscriptionEventRepository;

    @Override
    @Transactional
    public WebhookOutcome apply(CanonicalSubscriptionEvent event) {
        UUID accountId = parseAccountId(event.accountRef());

        // Held until commit: a second callback for this account waits here
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new AccountNotFoundException(event.accountRef()));

        if (subscriptionEventRepository.existsByEventId(event.eventId())) {
            log.info("Duplicate subscription event {} for account {}", event.eventId(), accountId);
            return WebhookOutcome.duplicate(event.eventId(), event.eventType());
        }

        SubscriptionEvent row = new SubscriptionEvent();
        row.setEventId(event.eventId());
        row.setAccountId(accountId);
        row.setProvider(event.provider());
        row.setEventType(event.eventType());
        row.setEventAt(event.eventAt());
        row.setPayload(event.payload());
        row.setProcessingStatus(EventProcessingStatus.RECEIVED);
        // A constraint violation here rolls the whole transaction back; the caller classifies it
        row = subscriptionEventRepository.saveAndFlush(row);

        PlanTier previousPlan = account.getPlan();
        SubscriptionStatus previousStatus = account.getSubscriptionStatus();
        Instant previousExpiresAt = account.getSubscriptionExpiresAt();

        if (isOutOfOrder(account, event)) {
            row.setProcessingStatus(EventProcessingStatus.IGNORED_OUT_OF_ORDER);
            log.info("Ignoring out-of-order subscription event {} at {}; account {} already reflects {}",
                    event.eventId(), event.eventAt(), accountId, account.getLastSubscriptionEventAt());
            return outcome(Result.IGNORED_OUT_OF_ORDER, event, account, previousPlan, previousStatus, previousExpiresAt);
        }

        applyTo(account, event);
        row.setProcessingStatus(EventProcessingStatus.APPLIED);
        log.info("Applied subscription event {}: account={}, plan {}->{}, status {}->{}, expires {}->{}",
                event.eventId(), accountId, previousPlan, account.getPlan(), previousStatus,
                account.getSubscriptionStatus(), previousExpiresAt, account.getSubscriptionExpiresAt());
        return outcome(Result.APPLIED, event, account, previousPlan, previousStatus, previousExpiresAt);
    }

    private boolean isOutOfOrder(Account account, CanonicalSubscriptionEvent event) {
        Instant lastApplied = account.getLastSubscriptionEventAt();
        return lastApplied != null && event.eventAt() != null && event.eventAt().isBefore(lastApplied);
    }

    private void applyTo(Account account, CanonicalSubscriptionEvent event) {
        PlanTier before = account.getPlan();
        if (!event.keepsCurrentPlan()) {
            account.setPlan(event.plan());
            account.setSubscriptionExpiresAt(event.expiresAt());
        }
        account.setSubscriptionStatus(event.status());
        if (event.eventAt() != null) {
            account.setLastSubscriptionEventAt(event.eventAt());
        }
        if (!before.isPaid() && account.getPlan().isPaid() && !account.isFirstUpgradeUsed()) {
            account.setFirstUpgradeUsed(true);
        }
    }

    private static WebhookOutcome outcome(Result result, CanonicalSubscriptionEvent event, Account account,
                                          PlanTier previousPlan, SubscriptionStatus previousStatus,
                                          Instant previousExpiresAt) {
        return new WebhookOutcome(result, event.eventId(), event.eventType(), account.getId(),
                account.getPlan(), account.getSubscriptionStatus(), account.getSubscriptionExpiresAt(),
                previousPlan, previousStatus, previousExpiresAt);
    }

    private static UUID parseAccountId(String accountRef) {
        try {
            return UUID.fromString(accountRef.trim());
        } catch (IllegalArgumentException e) {
            throw new AccountNotFoundException(accountRef);
        }
    }
}
