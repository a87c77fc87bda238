package app.taxguide.ask.ask.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record AskRequest(
        @NotNull UUID accountId,
        @NotBlank @Size(max = 2000) String question,
        String language,
        String mode,
        String channel
) {
}
