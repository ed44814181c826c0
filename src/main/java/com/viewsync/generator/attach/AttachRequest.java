package com.viewsync.generator.attach;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * A generated type waiting to be attached to its root. Encoded as
 * {@code rootIdentity|typeName|artifactPath}.
 */
@Value
public class AttachRequest {
    private static final String SEPARATOR = "|";

    @NonNull String rootIdentity;
    @NonNull String typeName;
    @NonNull String artifactPath;

    public String encode() {
        return rootIdentity + SEPARATOR + typeName + SEPARATOR + artifactPath;
    }

    /**
     * @return the request, or empty if the line has no type name
     */
    public static Optional<AttachRequest> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String[] parts = line.trim().split("\\|", 3);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        String artifactPath = parts.length >= 3 ? parts[2] : "";
        return Optional.of(new AttachRequest(parts[0], parts[1], artifactPath));
    }
}
