package uk.gegc.gosuraksha.features.account.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the canonical tier name and reads legacy labels ("PRO", "premium", ...) through the
 * alias table.
 */
@Converter
public class PlanTierConverter implements AttributeConverter<PlanTier, String> {

    @Override
    public String convertToDatabaseColumn(PlanTier attribute) {
        return attribute == null ? PlanTier.GO_FREE.name() : attribute.name();
    }

    @Override
    public PlanTier convertToEntityAttribute(String dbData) {
        return PlanTier.normalize(dbData);
    }
}
