package org.cloudfiles.storage.domain;

public enum ResourceType {
    FILE, DIRECTORY;

    public static ResourceType of(VirtualPath path) {
        return path.isDirectory() ? DIRECTORY : FILE;
    }
}
