package org.cloudfiles.storage.config;

public interface RestApiVersion {

    String API_VERSION = "v1";
    String API_PREFIX = "/api/" + API_VERSION;

    String ENDPOINT_AUTH = "/auth";
    String ENDPOINT_DIRECTORY = "/directory";
    String ENDPOINT_RESOURCE = "/resource";
}
