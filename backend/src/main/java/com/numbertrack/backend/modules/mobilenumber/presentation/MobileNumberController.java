package com.numbertrack.backend.modules.mobilenumber.presentation;

import com.numbertrack.backend.global.error.ProblemException;
import com.numbertrack.backend.global.security.SecurityUtils;
import com.numbertrack.backend.modules.auth.application.AuthService;
import com.numbertrack.backend.modules.auth.domain.AdminUser;
import com.numbertrack.backend.modules.mobilenumber.application.MobileNumberService;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.AssignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.CreateMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.HandleRiskRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberDetailResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberPageResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.MobileNumberResponse;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UnassignMobileNumberRequest;
import com.numbertrack.backend.modules.mobilenumber.presentation.dto.UpdateMobileNumberRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mobilenumbers")
@Tag(name = "Mobile numbers", description = "Company number lifecycle")
public class MobileNumberController {

    private final MobileNumberService mobileNumberService;
    private final AuthService authService;

    public MobileNumberController(MobileNumberService mobileNumberService, AuthService authService) {
        this.mobileNumberService = mobileNumberService;
        this.authService = authService;
    }

    @PostMapping
    @Operation(summary = "Register a new number in idle state")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid phone format"),
            @ApiResponse(responseCode = "404", description = "Applicant not found"),
            @ApiResponse(responseCode = "409", description = "Number already registered")
    })
    public ResponseEntity<MobileNumberResponse> create(@Valid @RequestBody CreateMobileNumberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mobileNumberService.createNumber(request));
    }

    @GetMapping
    @Operation(summary = "List numbers other than risk_pending ones")
    public ResponseEntity<MobileNumberPageResponse> list(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "applicantStatus", required = false) String applicantStatus
    ) {
        return ResponseEntity.ok(mobileNumberService.listNumbers(page, limit, sortBy, sortOrder, search, status, applicantStatus));
    }

    @GetMapping("/risk-pending")
    @Operation(summary = "List numbers waiting for a risk decision")
    public ResponseEntity<MobileNumberPageResponse> listRiskPending(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "applicantStatus", required = false) String applicantStatus
    ) {
        return ResponseEntity.ok(mobileNumberService.listRiskPendingNumbers(page, limit, sortBy, sortOrder, search, applicantStatus));
    }

    @GetMapping("/{phoneNumber}")
    public ResponseEntity<MobileNumberDetailResponse> get(@PathVariable String phoneNumber) {
        return ResponseEntity.ok(mobileNumberService.getNumber(phoneNumber));
    }

    @PatchMapping("/{phoneNumber}")
    @Operation(summary = "Patch status or descriptive fields of a number without a holder")
    public ResponseEntity<MobileNumberResponse> update(
            @PathVariable String phoneNumber,
            @Valid @RequestBody UpdateMobileNumberRequest request
    ) {
        return ResponseEntity.ok(mobileNumberService.updateNumber(phoneNumber, request));
    }

    @PostMapping("/{phoneNumber}/assign")
    @Operation(summary = "Hand an idle number to an active employee")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assigned"),
            @ApiResponse(responseCode = "409", description = "Number is not idle"),
            @ApiResponse(responseCode = "422", description = "Employee is not active")
    })
    public ResponseEntity<MobileNumberResponse> assign(
            @PathVariable String phoneNumber,
            @Valid @RequestBody AssignMobileNumberRequest request
    ) {
        return ResponseEntity.ok(mobileNumberService.assignNumber(phoneNumber, request));
    }

    @PostMapping("/{phoneNumber}/unassign")
    @Operation(summary = "Reclaim a number from its holder")
    public ResponseEntity<MobileNumberResponse> unassign(
            @PathVariable String phoneNumber,
            @Valid @RequestBody(required = false) UnassignMobileNumberRequest request
    ) {
        return ResponseEntity.ok(mobileNumberService.unassignNumber(phoneNumber, request));
    }

    @PostMapping("/{phoneNumber}/handle-risk")
    @Operation(summary = "Resolve a risk_pending number by changing applicant, reclaiming or deactivating it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Handled"),
            @ApiResponse(responseCode = "409", description = "Number is not risk_pending"),
            @ApiResponse(responseCode = "422", description = "Operator is not an active employee")
    })
    public ResponseEntity<MobileNumberResponse> handleRisk(
            @PathVariable String phoneNumber,
            @Valid @RequestBody HandleRiskRequest request
    ) {
        return ResponseEntity.ok(mobileNumberService.handleRisk(phoneNumber, request, currentOperatorEmployeeId()));
    }

    private String currentOperatorEmployeeId() {
        AdminUser admin = authService.loadAdmin(SecurityUtils.getCurrentUserId());
        if (admin.getEmployeeBusinessId() == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "OPERATOR_NOT_LINKED",
                    "admin account %s is not linked to an employee".formatted(admin.getUsername()));
        }
        return admin.getEmployeeBusinessId();
    }
}
