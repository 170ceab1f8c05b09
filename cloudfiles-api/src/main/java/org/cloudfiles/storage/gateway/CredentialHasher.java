package org.cloudfiles.storage.gateway;

public interface CredentialHasher {

    String hash(String text);

    boolean verify(String text, String hash);
}
