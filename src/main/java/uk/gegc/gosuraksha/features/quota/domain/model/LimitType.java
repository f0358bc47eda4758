package uk.gegc.gosuraksha.features.quota.domain.model;

import uk.gegc.gosuraksha.features.ratelimit.domain.model.LimitWindow;

/**
 * Metered quota dimensions enforced by the quota enforcer, each bound to the plan limit that
 * supplies its ceiling, the calendar window it resets on and the feature it upsells.
 */
public enum LimitType {
    THREAT_DAILY(PlanLimit.THREAT_DAILY, LimitWindow.DAILY, "plan-limit:threat:daily", Feature.THREAT_SCAN),
    EMAIL_MONTHLY(PlanLimit.EMAIL_MONTHLY, LimitWindow.MONTHLY, "plan-limit:email:monthly", Feature.EMAIL_BREACH_COUNT),
    PASSWORD_MONTHLY(PlanLimit.PASSWORD_MONTHLY, LimitWindow.MONTHLY, "plan-limit:password:monthly", Feature.PASSWORD_SCAN),
    QR_WEEKLY(PlanLimit.QR_WEEKLY, LimitWindow.WEEKLY, "plan-limit:qr:weekly", Feature.QR_UNLIMITED),
    AI_IMAGE_LIFETIME(PlanLimit.AI_IMAGE_LIFETIME, LimitWindow.LIFETIME, null, Feature.AI_IMAGE_SCAN);

    private final PlanLimit planLimit;
    private final LimitWindow window;
    private final String namespace;
    private final Feature feature;

    LimitType(PlanLimit planLimit, LimitWindow window, String namespace, Feature feature) {
        this.planLimit = planLimit;
        this.window = window;
        this.namespace = namespace;
        this.feature = feature;
    }

    public PlanLimit getPlanLimit() {
        return planLimit;
    }

    public LimitWindow getWindow() {
        return window;
    }

    /** Counter store namespace; null for lifetime limits, which live on the account row. */
    public String getNamespace() {
        return namespace;
    }

    public Feature getFeature() {
        return feature;
    }

    /** Second subject part of the post-breach cooldown key. */
    public String cooldownSubject() {
        return feature != null ? feature.name() : name();
    }
}
