package com.numbertrack.backend.modules.verification.presentation;

import com.numbertrack.backend.modules.verification.application.VerificationSubmissionService;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationInfoResponse;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionRequest;
import com.numbertrack.backend.modules.verification.presentation.dto.VerificationSubmissionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints reached from the emailed link. The token query parameter is the only credential.
 */
@RestController
@RequestMapping("/verification")
@Tag(name = "Verification (public)", description = "Employee confirmation page")
public class VerificationController {

    private final VerificationSubmissionService submissionService;

    public VerificationController(VerificationSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @GetMapping("/info")
    @Operation(summary = "Numbers the link owner holds, with answers given so far under this link")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "410", description = "Link invalid or expired")
    })
    public ResponseEntity<VerificationInfoResponse> info(@RequestParam(name = "token") String token) {
        return ResponseEntity.ok(submissionService.getInfo(token));
    }

    @PostMapping("/submit")
    @Operation(summary = "Confirm or report held numbers and report unlisted ones; can be repeated until expiry")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recorded"),
            @ApiResponse(responseCode = "400", description = "A number is not held by the link owner"),
            @ApiResponse(responseCode = "410", description = "Link invalid or expired")
    })
    public ResponseEntity<VerificationSubmissionResponse> submit(
            @RequestParam(name = "token") String token,
            @Valid @RequestBody VerificationSubmissionRequest request
    ) {
        return ResponseEntity.ok(submissionService.submit(token, request));
    }
}
