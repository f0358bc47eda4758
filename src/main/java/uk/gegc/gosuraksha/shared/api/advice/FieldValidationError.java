package uk.gegc.gosuraksha.shared.api.advice;

public record FieldValidationError(String field, String message, Object rejectedValue) {
}
