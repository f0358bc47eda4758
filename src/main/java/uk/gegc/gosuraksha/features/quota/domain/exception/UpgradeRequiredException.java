package uk.gegc.gosuraksha.features.quota.domain.exception;

import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeAdvice;

public class UpgradeRequiredException extends RuntimeException {

    private final UpgradeAdvice advice;

    public UpgradeRequiredException(UpgradeAdvice advice) {
        super("Upgrade required");
        this.advice = advice;
    }

    public UpgradeAdvice getAdvice() {
        return advice;
    }
}
