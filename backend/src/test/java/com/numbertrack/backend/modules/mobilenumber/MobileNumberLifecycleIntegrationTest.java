package com.numbertrack.backend.modules.mobilenumber;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import com.numbertrack.backend.modules.audit.domain.AuditLog;
import com.numbertrack.backend.modules.audit.infrastructure.AuditLogRepository;
import com.numbertrack.backend.modules.employee.domain.Employee;
import com.numbertrack.backend.support.AbstractPostgresIntegrationTest;
import com.numbertrack.backend.support.AdminSession;
import com.numbertrack.backend.support.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class MobileNumberLifecycleIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PHONE = "13800138000";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestDataFactory testDataFactory;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Employee applicant;
    private Employee holder;
    private Employee operator;
    private String bearer;

    @BeforeEach
    void setUp() throws Exception {
        applicant = testDataFactory.activeEmployee("Applicant One", "Sales", "applicant@example.com");
        holder = testDataFactory.activeEmployee("Holder Two", "Sales", "holder@example.com");
        operator = testDataFactory.activeEmployee("Operator Three", "IT", "operator@example.com");
        testDataFactory.admin("lifecycle-admin", "admin-pass-1", operator.getEmployeeId());
        bearer = AdminSession.login(mockMvc, objectMapper, "lifecycle-admin", "admin-pass-1");
    }

    @Test
    void assignAndReclaimKeepUsageHistoryConsistent() throws Exception {
        createNumber(PHONE, applicant.getEmployeeId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("idle"))
                .andExpect(jsonPath("$.applicantName").value("Applicant One"));

        assign(PHONE, holder.getEmployeeId(), "2024-03-01")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_use"))
                .andExpect(jsonPath("$.currentEmployeeId").value(holder.getEmployeeId()));

        assign(PHONE, operator.getEmployeeId(), "2024-03-02")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MOBILE_NUMBER_NOT_IDLE"));

        mockMvc.perform(post("/mobilenumbers/{phone}/unassign", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reclaimDate": "2024-02-01"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RECLAIM_DATE_BEFORE_ASSIGNMENT"));

        mockMvc.perform(post("/mobilenumbers/{phone}/unassign", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reclaimDate": "2024-04-30"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("idle"))
                .andExpect(jsonPath("$.currentEmployeeId").doesNotExist());

        mockMvc.perform(get("/mobilenumbers/{phone}", PHONE).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.usageHistory", hasSize(1)))
                .andExpect(jsonPath("$.usageHistory[0].employeeId").value(holder.getEmployeeId()))
                .andExpect(jsonPath("$.usageHistory[0].startDate").value("2024-03-01"))
                .andExpect(jsonPath("$.usageHistory[0].endDate").value("2024-04-30"));

        mockMvc.perform(post("/mobilenumbers/{phone}/unassign", PHONE).header("Authorization", bearer))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MOBILE_NUMBER_NOT_IN_USE"));

        List<String> actions = auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("MOBILE_NUMBER", PHONE)
                .stream()
                .map(AuditLog::getActionType)
                .toList();
        assertThat(actions).containsExactly("MOBILE_NUMBER_CREATE", "MOBILE_NUMBER_ASSIGN", "MOBILE_NUMBER_UNASSIGN");
    }

    @Test
    void statusColumnHoldsTheSameTokenTheApiReturns() throws Exception {
        createNumber(PHONE, applicant.getEmployeeId()).andExpect(status().isCreated());
        assign(PHONE, holder.getEmployeeId(), "2024-03-01").andExpect(status().isOk());

        String stored = jdbcTemplate.queryForObject(
                "select status from mobile_number where phone_number = ?", String.class, PHONE);
        assertThat(stored).isEqualTo("in_use");

        mockMvc.perform(get("/mobilenumbers").param("status", "in_use").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].phoneNumber").value(PHONE));
    }

    @Test
    void duplicateAndMalformedNumbersAreRejected() throws Exception {
        createNumber(PHONE, applicant.getEmployeeId()).andExpect(status().isCreated());

        createNumber(PHONE, applicant.getEmployeeId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MOBILE_NUMBER_ALREADY_EXISTS"));

        createNumber("2380013800", applicant.getEmployeeId())
                .andExpect(status().isBadRequest());

        createNumber("13900139000", "EMP9999999")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("APPLICANT_NOT_FOUND"));
    }

    @Test
    void statusPatchCannotBypassAssignment() throws Exception {
        createNumber(PHONE, applicant.getEmployeeId()).andExpect(status().isCreated());

        mockMvc.perform(patch("/mobilenumbers/{phone}", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "in_use"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STATUS_REQUIRES_ASSIGN"));

        mockMvc.perform(patch("/mobilenumbers/{phone}", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "deactivated", "remarks": "contract ended"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deactivated"))
                .andExpect(jsonPath("$.cancellationDate").isNotEmpty())
                .andExpect(jsonPath("$.remarks").value("contract ended"));
    }

    @Test
    void applicantDepartureFlagsNumbersAndRiskHandlingResolvesThem() throws Exception {
        String idlePhone = "13700137000";
        createNumber(PHONE, applicant.getEmployeeId()).andExpect(status().isCreated());
        createNumber(idlePhone, applicant.getEmployeeId()).andExpect(status().isCreated());
        assign(PHONE, holder.getEmployeeId(), "2024-03-01").andExpect(status().isOk());

        depart(applicant).andExpect(status().isOk());

        mockMvc.perform(get("/mobilenumbers/{phone}", PHONE).header("Authorization", bearer))
                .andExpect(jsonPath("$.number.status").value("risk_pending"))
                .andExpect(jsonPath("$.number.currentEmployeeId").value(holder.getEmployeeId()));

        mockMvc.perform(get("/mobilenumbers").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(0));
        mockMvc.perform(get("/mobilenumbers/risk-pending").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(2));

        mockMvc.perform(post("/mobilenumbers/{phone}/handle-risk", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action": "change_applicant"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NEW_APPLICANT_REQUIRED"));

        mockMvc.perform(post("/mobilenumbers/{phone}/handle-risk", PHONE)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action": "change_applicant", "newApplicantEmployeeId": "%s", "remarks": "handover"}
                                """.formatted(holder.getEmployeeId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_use"))
                .andExpect(jsonPath("$.applicantEmployeeId").value(holder.getEmployeeId()));

        mockMvc.perform(get("/mobilenumbers/{phone}", PHONE).header("Authorization", bearer))
                .andExpect(jsonPath("$.applicantHistory", hasSize(1)))
                .andExpect(jsonPath("$.applicantHistory[0].previousApplicantEmployeeId").value(applicant.getEmployeeId()))
                .andExpect(jsonPath("$.applicantHistory[0].operatorEmployeeId").value(operator.getEmployeeId()));

        mockMvc.perform(post("/mobilenumbers/{phone}/handle-risk", idlePhone)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action": "deactivate"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deactivated"));

        mockMvc.perform(post("/mobilenumbers/{phone}/handle-risk", idlePhone)
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action": "reclaim"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MOBILE_NUMBER_NOT_RISK_PENDING"));
    }

    @Test
    void departureIsBlockedWhileTheEmployeeStillHoldsANumber() throws Exception {
        createNumber(PHONE, applicant.getEmployeeId()).andExpect(status().isCreated());
        assign(PHONE, holder.getEmployeeId(), "2024-03-01").andExpect(status().isOk());

        depart(holder)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMPLOYEE_HAS_ACTIVE_NUMBERS"));

        mockMvc.perform(get("/employees/{id}", holder.getEmployeeId()).header("Authorization", bearer))
                .andExpect(jsonPath("$.employmentStatus").value("Active"));
    }

    private ResultActions createNumber(String phone, String applicantId) throws Exception {
        return mockMvc.perform(post("/mobilenumbers")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "phoneNumber": "%s",
                          "applicantEmployeeId": "%s",
                          "applicationDate": "2024-01-15",
                          "purpose": "field sales",
                          "vendor": "CarrierCo"
                        }
                        """.formatted(phone, applicantId)));
    }

    private ResultActions assign(String phone, String employeeId, String date) throws Exception {
        return mockMvc.perform(post("/mobilenumbers/{phone}/assign", phone)
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"employeeId": "%s", "assignmentDate": "%s"}
                        """.formatted(employeeId, date)));
    }

    private ResultActions depart(Employee employee) throws Exception {
        return mockMvc.perform(patch("/employees/{id}", employee.getEmployeeId())
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"employmentStatus": "Departed"}
                        """));
    }
}
