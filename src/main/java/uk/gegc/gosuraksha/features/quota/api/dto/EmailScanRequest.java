package uk.gegc.gosuraksha.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "EmailScanRequest", description = "Email address to check against breach sources")
public record EmailScanRequest(
        @Schema(description = "Email address", example = "user@example.com")
        @NotBlank(message = "Email must not be blank")
        @Size(max = 254, message = "Email must not exceed 254 characters")
        @Email(message = "Email must be a valid address")
        String email
) {
}
