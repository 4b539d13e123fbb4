package com.numbertrack.backend.modules.verification.presentation;

import java.util.List;
import java.util.UUID;

import com.numbertrack.backend.global.security.SecurityUtils;
import com.numbertrack.backend.modules.verification.application.ReportedIssueReviewService;
import com.numbertrack.backend.modules.verification.application.VerificationBatchService;
import com.numbertrack.backend.modules.verification.application.VerificationStatusService;
import com.numbertrack.backend.modules.verification.presentation.dto.BatchStatusResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.InitiateVerificationRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.InitiateVerificationResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.ReportedIssueResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.ResolveIssueRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/verification")
@Tag(name = "Verification (admin)", description = "Campaign runs, progress and reported issues")
public class VerificationAdminController {

    private final VerificationBatchService batchService;
    private final VerificationStatusService statusService;
    private final ReportedIssueReviewService issueReviewService;

    public VerificationAdminController(
            VerificationBatchService batchService,
            VerificationStatusService statusService,
            ReportedIssueReviewService issueReviewService
    ) {
        this.batchService = batchService;
        this.statusService = statusService;
        this.issueReviewService = issueReviewService;
    }

    @PostMapping("/initiate")
    @Operation(summary = "Start a verification campaign; returns at once with the batch id")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Queued"),
            @ApiResponse(responseCode = "404", description = "Scope matches no active employee"),
            @ApiResponse(responseCode = "503", description = "Worker queue full")
    })
    public ResponseEntity<InitiateVerificationResponse> initiate(@Valid @RequestBody InitiateVerificationRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(batchService.initiate(request, SecurityUtils.getCurrentUserId()));
    }

    @GetMapping({"/batch/{batchId}", "/batch/{batchId}/status"})
    @Operation(summary = "Progress counters of a campaign run")
    public ResponseEntity<BatchStatusResponse> batchStatus(@PathVariable UUID batchId) {
        return ResponseEntity.ok(batchService.getBatchStatus(batchId));
    }

    @GetMapping({"/admin/phone-status", "/admin/status"})
    @Operation(summary = "Confirmation statistics, outstanding links and reports")
    public ResponseEntity<VerificationStatusResponse> status(
            @RequestParam(name = "employeeId", required = false) String employeeId,
            @RequestParam(name = "departmentName", required = false) String departmentName,
            @RequestParam(name = "departmentId", required = false) String departmentId
    ) {
        String department = departmentName != null ? departmentName : departmentId;
        return ResponseEntity.ok(statusService.getStatus(employeeId, department));
    }

    @GetMapping("/admin/issues")
    public ResponseEntity<List<ReportedIssueResponse>> issues(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "issueType", required = false) String issueType
    ) {
        return ResponseEntity.ok(issueReviewService.listIssues(status, issueType));
    }

    @PostMapping("/admin/issues/{issueId}/resolve")
    @Operation(summary = "Close a pending report as resolved or ignored")
    public ResponseEntity<ReportedIssueResponse> resolve(
            @PathVariable UUID issueId,
            @Valid @RequestBody ResolveIssueRequest request
    ) {
        return ResponseEntity.ok(issueReviewService.resolve(issueId, request, SecurityUtils.getCurrentUserId()));
    }
}
