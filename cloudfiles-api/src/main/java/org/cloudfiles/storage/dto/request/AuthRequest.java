package org.cloudfiles.storage.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import org.cloudfiles.storage.dto.UserCredentials;

public record AuthRequest(
        @NotBlank @Schema(description = "User login") String login,
        @NotBlank @Schema(description = "Plain text password") String password
) {

    public UserCredentials toCredentials() {
        return new UserCredentials(login, password);
    }
}
