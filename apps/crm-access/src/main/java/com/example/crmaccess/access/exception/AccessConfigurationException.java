package com.example.crmaccess.access.exception;

/**
 * Thrown when the mirrored directory is not set up well enough to resolve visibility,
 * e.g. the sharing-rule sync has not run yet. Not transient; retrying will not help.
 */
public class AccessConfigurationException extends RuntimeException {

    public enum Reason {
        UNSUPPORTED_MODULE,
        ORGANIZATION_UNDETERMINED,
        SHARING_RULE_MISSING,
        UNSUPPORTED_SHARE_TYPE
    }

    private final Reason reason;

    public AccessConfigurationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static AccessConfigurationException unsupportedModule(String moduleName) {
        return new AccessConfigurationException(Reason.UNSUPPORTED_MODULE,
                "Unsupported module: " + moduleName);
    }

    public static AccessConfigurationException organizationUndetermined(String moduleName, String recordId) {
        return new AccessConfigurationException(Reason.ORGANIZATION_UNDETERMINED,
                String.format("Could not determine organization of %s record %s", moduleName, recordId));
    }

    public static AccessConfigurationException sharingRuleMissing(String moduleName) {
        return new AccessConfigurationException(Reason.SHARING_RULE_MISSING,
                String.format("No sharing rule found for module \"%s\" in organization", moduleName));
    }

    public static AccessConfigurationException unsupportedShareType(String shareType) {
        return new AccessConfigurationException(Reason.UNSUPPORTED_SHARE_TYPE,
                "Unsupported share type: " + shareType);
    }

    public Reason getReason() {
        return reason;
    }
}
