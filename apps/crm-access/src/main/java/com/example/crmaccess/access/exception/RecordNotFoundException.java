package com.example.crmaccess.access.exception;

/**
 * Thrown when a record exists under neither its local nor its CRM-issued identifier.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String moduleName;
    private final String recordId;

    public RecordNotFoundException(String moduleName, String recordId) {
        super(String.format("Record not found: %s with ID %s", moduleName, recordId));
        this.moduleName = moduleName;
        this.recordId = recordId;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getRecordId() {
        return recordId;
    }
}
