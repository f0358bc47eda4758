package uk.gegc.gosuraksha.features.subscription.api.dto;

import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;

public record FeatureAccessResponse(Feature feature, PlanTier plan, boolean allowed) {
}
