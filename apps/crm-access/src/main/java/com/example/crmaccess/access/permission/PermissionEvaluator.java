package com.example.crmaccess.access.permission;

import com.example.crmaccess.common.util.StringSanitizer;
import com.example.crmaccess.directory.DirectoryStore;
import com.example.crmaccess.directory.model.CrmProfile;
import com.example.crmaccess.directory.model.CrmUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Answers whether a user's profile enables a module. Fail-closed: a missing profile
 * or a missing permission entry means no access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PermissionEvaluator {

    private final DirectoryStore directoryStore;

    /**
     * Check module access through the user's assigned profile.
     *
     * @param user       the user to check
     * @param moduleName module API name
     * @return Mono emitting true iff the profile has an enabled entry for the module
     */
    public Mono<Boolean> hasModuleAccess(CrmUser user, String moduleName) {
        if (user.profileId() == null) {
            log.debug("User {} has no profile assigned", StringSanitizer.forLog(user.id()));
            return Mono.just(false);
        }

        return directoryStore.getProfileWithPermissions(user.profileId())
                .map(profile -> grants(profile, moduleName))
                .doOnNext(granted -> log.debug("User {} {} module {}",
                        StringSanitizer.forLog(user.id()),
                        granted ? "has access to" : "has no access to",
                        StringSanitizer.forLog(moduleName)))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Profile {} of user {} not found",
                            StringSanitizer.forLog(user.profileId()), StringSanitizer.forLog(user.id()));
                    return false;
                }));
    }

    /**
     * Whether any entry of the profile enables the module. Duplicate entries are tolerated.
     */
    public static boolean grants(CrmProfile profile, String moduleName) {
        return profile.permissions().stream()
                .anyMatch(permission -> permission.enabled() && moduleName.equals(permission.module()));
    }
}
