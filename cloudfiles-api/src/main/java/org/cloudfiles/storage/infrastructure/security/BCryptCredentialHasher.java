package org.cloudfiles.storage.infrastructure.security;

import org.cloudfiles.storage.gateway.CredentialHasher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class BCryptCredentialHasher implements CredentialHasher {

    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder();

    @Override
    public String hash(String text) {
        return encoder.encode(text);
    }

    @Override
    public boolean verify(String text, String hash) {
        return encoder.matches(text, hash);
    }
}
