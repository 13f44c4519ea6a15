package com.example.crmaccess.access.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for checking several records of one module.
 */
public record BatchPermissionCheckRequest(
        @NotBlank(message = "Module name is required")
        @Size(max = 64)
        String moduleName,

        @NotEmpty(message = "At least one record ID is required")
        List<@NotBlank @Size(max = 128) String> recordIds
) {}
