package org.cloudfiles.storage.domain;

import org.cloudfiles.storage.exception.NotDirectoryJoinException;
import org.cloudfiles.storage.exception.NotNestedPathException;
import org.cloudfiles.storage.exception.PathValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Slash delimited location of a resource, relative to a user's namespace root.
 * <p>
 * A value ending with {@code /} denotes a directory, the empty value is the root directory,
 * anything else denotes a file. Instances are immutable and only created through {@link #of(String)}.
 */
public final class VirtualPath {

    public static final String SEPARATOR = "/";

    public static final VirtualPath ROOT = new VirtualPath("");

    private static final char[] FORBIDDEN_CHARS = {'\0', '\n', '\r', '\t', '"', '\''};

    private final String value;

    private VirtualPath(String value) {
        this.value = value;
    }

    public static VirtualPath of(String value) {
        validate(value);
        return value.isEmpty() ? ROOT : new VirtualPath(value);
    }

    private static void validate(String value) {
        if (value == null) {
            throw new PathValidationException("Path cannot be null");
        }
        if (value.startsWith(SEPARATOR)) {
            throw PathValidationException.invalidFormat(value, "must not start with /");
        }
        if (value.contains("//")) {
            throw PathValidationException.invalidFormat(value, "must not contain double slashes");
        }
        if (value.contains("..")) {
            throw PathValidationException.invalidFormat(value, "must not contain '..'");
        }
        for (char c : FORBIDDEN_CHARS) {
            if (value.indexOf(c) >= 0) {
                throw PathValidationException.invalidFormat(value, "contains a forbidden character");
            }
        }
    }

    public String getValue() {
        return value;
    }

    public boolean isRoot() {
        return value.isEmpty();
    }

    public boolean isDirectory() {
        return isRoot() || value.endsWith(SEPARATOR);
    }

    public List<String> getParts() {
        if (isRoot()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(SEPARATOR))
                .filter(part -> !part.isEmpty())
                .toList();
    }

    public int getDepth() {
        return getParts().size();
    }

    public String getName() {
        List<String> parts = getParts();
        return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
    }

    /**
     * Parent directory; the root is its own parent.
     */
    public VirtualPath getParent() {
        List<String> parts = getParts();
        if (parts.size() <= 1) {
            return ROOT;
        }
        return new VirtualPath(String.join(SEPARATOR, parts.subList(0, parts.size() - 1)) + SEPARATOR);
    }

    /**
     * Directories enclosing this path, nearest first. The root is not included.
     */
    public List<VirtualPath> getAncestors() {
        List<VirtualPath> ancestors = new ArrayList<>();
        VirtualPath current = getParent();
        while (!current.isRoot()) {
            ancestors.add(current);
            current = current.getParent();
        }
        return ancestors;
    }

    public VirtualPath join(VirtualPath other) {
        if (other.isRoot()) {
            return this;
        }
        if (!isDirectory()) {
            throw new NotDirectoryJoinException(value, other.value);
        }
        return isRoot() ? other : new VirtualPath(value + other.value);
    }

    public VirtualPath join(String other) {
        return join(of(other));
    }

    public VirtualPath relativeTo(VirtualPath base) {
        if (!base.isDirectory() || !value.startsWith(base.value)) {
            throw new NotNestedPathException(value, base.value);
        }
        String relative = value.substring(base.value.length());
        return relative.isEmpty() ? ROOT : new VirtualPath(relative);
    }

    public boolean isAncestorOf(VirtualPath other) {
        return isDirectory() && !equals(other) && other.value.startsWith(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VirtualPath other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
