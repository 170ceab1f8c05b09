package org.cloudfiles.storage.dto.response;

public record SignInResponse(String username) {
}
