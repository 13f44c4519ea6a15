package com.example.crmaccess.directory.model;

/**
 * Per-module capability flag of a profile.
 */
public record ModulePermission(String module, boolean enabled) {
}
