package org.cloudfiles.storage.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.cloudfiles.storage.exception.DomainValidationException;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Account owning a private namespace in the object store.
 * Every key belonging to the user lives under {@link #getRootPath()}.
 */
@Getter
@EqualsAndHashCode(of = "id")
public final class User {

    private static final Pattern LOGIN_PATTERN = Pattern.compile("^[A-Za-z0-9!@#$%^&*]{3,}$");

    private final UUID id;
    private final String login;
    private final String hashedPassword;

    private User(UUID id, String login, String hashedPassword) {
        if (login == null || !LOGIN_PATTERN.matcher(login).matches()) {
            throw new DomainValidationException("Login must be at least 3 characters long, "
                    + "with only Latin letters, digits and special characters (!@#$%^&*).");
        }
        if (id == null || hashedPassword == null) {
            throw new DomainValidationException("User id and password hash are required");
        }
        this.id = id;
        this.login = login;
        this.hashedPassword = hashedPassword;
    }

    public static User create(String login, String hashedPassword) {
        return new User(UUID.randomUUID(), login, hashedPassword);
    }

    public static User restore(UUID id, String login, String hashedPassword) {
        return new User(id, login, hashedPassword);
    }

    public VirtualPath getRootPath() {
        return VirtualPath.of("user-" + id + "-files/");
    }

    @Override
    public String toString() {
        return "User(id=" + id + ", login=" + login + ")";
    }
}
