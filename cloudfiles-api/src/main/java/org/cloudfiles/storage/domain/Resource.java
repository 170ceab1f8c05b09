package org.cloudfiles.storage.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cloudfiles.storage.exception.DomainValidationException;

/**
 * A file or directory exposed to a user. Files always carry their size in bytes, directories never do.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Resource {

    private final VirtualPath path;
    private final ResourceType type;
    private final Long size;

    private Resource(VirtualPath path, ResourceType type, Long size) {
        this.path = path;
        this.type = type;
        this.size = size;
    }

    public static Resource of(VirtualPath path, ResourceType type, Long size) {
        if (path == null || type == null) {
            throw new DomainValidationException("Resource path and type are required");
        }
        if (type == ResourceType.DIRECTORY) {
            if (size != null) {
                throw new DomainValidationException("Directory cannot have size");
            }
            if (!path.isDirectory()) {
                throw new DomainValidationException("Directory path must end with /: " + path);
            }
        } else {
            if (size == null) {
                throw new DomainValidationException("File must have size");
            }
            if (size < 0) {
                throw new DomainValidationException("Resource size cannot be negative");
            }
            if (path.isDirectory()) {
                throw new DomainValidationException("File path cannot denote a directory: '" + path + "'");
            }
        }
        return new Resource(path, type, size);
    }

    public static Resource file(VirtualPath path, long size) {
        return of(path, ResourceType.FILE, size);
    }

    public static Resource directory(VirtualPath path) {
        return of(path, ResourceType.DIRECTORY, null);
    }

    public String getName() {
        return path.getName();
    }

    public VirtualPath getParentPath() {
        return path.getParent();
    }

    public boolean isFile() {
        return type == ResourceType.FILE;
    }

    public boolean isDirectory() {
        return type == ResourceType.DIRECTORY;
    }
}
