package com.example.crmaccess.access.controller;

import com.example.crmaccess.access.dto.BatchPermissionCheckRequest;
import com.example.crmaccess.access.dto.PermissionCheckRequest;
import com.example.crmaccess.access.model.PermissionSummary;
import com.example.crmaccess.access.model.RecordResolution;
import com.example.crmaccess.access.model.ResolutionResult;
import com.example.crmaccess.access.service.PermissionCheckService;
import com.example.crmaccess.common.util.StringSanitizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final PermissionCheckService permissionCheckService;

    @PostMapping("/check")
    public Mono<ResolutionResult> check(@Valid @RequestBody PermissionCheckRequest request) {
        log.debug("POST /check - module: {}, recordId: {}",
                StringSanitizer.forLog(request.moduleName()), StringSanitizer.forLog(request.recordId()));
        return permissionCheckService.check(request.moduleName(), request.recordId());
    }

    @PostMapping("/check/batch")
    public Mono<List<RecordResolution>> checkBatch(@Valid @RequestBody BatchPermissionCheckRequest request) {
        log.debug("POST /check/batch - module: {}, records: {}",
                StringSanitizer.forLog(request.moduleName()), request.recordIds().size());
        return permissionCheckService.checkBatch(request.moduleName(), request.recordIds());
    }

    @GetMapping("/summary/{organizationId}/{moduleName}")
    public Mono<PermissionSummary> summary(
            @PathVariable String organizationId,
            @PathVariable String moduleName) {
        log.debug("GET /summary - organization: {}, module: {}",
                StringSanitizer.forLog(organizationId), StringSanitizer.forLog(moduleName));
        return permissionCheckService.summarize(organizationId, moduleName);
    }
}
