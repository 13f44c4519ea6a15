package com.example.crmaccess.access.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * Visibility policy of a module, as carried by the CRM's share type.
 */
public enum AccessType {

    /**
     * Owner and users at or above the owner's role level.
     */
    PRIVATE("private"),

    /**
     * Every active user whose profile enables the module.
     */
    PUBLIC("public"),

    /**
     * Same visibility as {@link #PUBLIC}; the read-only aspect is enforced elsewhere.
     */
    PUBLIC_READ_ONLY("public_read_only");

    private final String shareType;

    AccessType(String shareType) {
        this.shareType = shareType;
    }

    @JsonValue
    public String shareType() {
        return shareType;
    }

    public boolean isPublic() {
        return this != PRIVATE;
    }

    /**
     * Maps a raw CRM share type. Matching is exact; unknown values yield empty.
     */
    public static Optional<AccessType> fromShareType(@Nullable String shareType) {
        if (shareType == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.shareType.equals(shareType))
                .findFirst();
    }
}
