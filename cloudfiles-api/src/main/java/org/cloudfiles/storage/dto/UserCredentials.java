package org.cloudfiles.storage.dto;

public record UserCredentials(String login, String password) {

    @Override
    public String toString() {
        return "UserCredentials[login=" + login + "]";
    }
}
