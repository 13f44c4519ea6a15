package com.example.crmaccess.access.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for a single-record visibility check.
 */
public record PermissionCheckRequest(
        @NotBlank(message = "Module name is required")
        @Size(max = 64)
        String moduleName,

        @NotBlank(message = "Record ID is required")
        @Size(max = 128)
        String recordId
) {}
