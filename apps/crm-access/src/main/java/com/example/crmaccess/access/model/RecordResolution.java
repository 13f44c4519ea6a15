package com.example.crmaccess.access.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

/**
 * Per-record entry of a batch resolution: either a result or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordResolution(
        String recordId,
        @Nullable ResolutionResult result,
        @Nullable String error,
        @Nullable String message
) {
    public static final String NOT_FOUND = "not_found";
    public static final String CONFIGURATION_ERROR = "configuration_error";

    public static RecordResolution resolved(String recordId, ResolutionResult result) {
        return new RecordResolution(recordId, result, null, null);
    }

    public static RecordResolution failed(String recordId, String error, String message) {
        return new RecordResolution(recordId, null, error, message);
    }

    @JsonIgnore
    public boolean isResolved() {
        return result != null;
    }
}
