package uk.gegc.gosuraksha.features.quota.api.dto;

/**
 * 403 body when the effective plan lacks a feature: {@code {"error": {"code": "UPGRADE_REQUIRED", ...}}}.
 */
public record UpgradeRequiredResponse(UpgradeAdvice error) {
}
