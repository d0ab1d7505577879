package com.eyelevel.lotprocessor.controller;

import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.exception.JobStateConflictException;
import com.eyelevel.lotprocessor.service.job.BatchOrchestrationService;
import com.eyelevel.lotprocessor.service.job.LotSubmission;
import com.eyelevel.lotprocessor.service.monitoring.WebhookMonitoringService;
import com.eyelevel.lotprocessor.service.signature.SignatureService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class BatchJobControllerTest {

    private static final String LOTS = "[{\"lot_id\":\"L-1\",\"additional_info\":\"Blue hatchback, état moyen\","
                                       + "\"images\":[{\"url\":\"https://img/1.jpg\"},{\"url\":\"https://img/2.jpg\"}]},"
                                       + "{\"images\":[],\"lot_id\":\"L-2\",\"webhook_url\":\"https://other/hook\"}]";

    @MockBean
    private BatchOrchestrationService orchestrationService;
    @MockBean
    private WebhookMonitoringService monitoringService;

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private SignatureService signatureService;
    @Autowired
    private ObjectMapper objectMapper;

    private String body(String version, String signature) {
        return "{\"version\":\"" + version + "\",\"signature\":\"" + signature + "\","
               + "\"languages\":[\"en\",\"fr\"],\"webhook_url\":\"https://client/hook\",\"lots\":" + LOTS + "}";
    }

    private String validSignature() throws Exception {
        return signatureService.sign(objectMapper.readTree(LOTS));
    }

    @Test
    @SuppressWarnings("unchecked")
    void acceptsSignedRequest() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrationService.createJob(anyList(), anyList(), any())).thenReturn(jobId);

        mockMvc.perform(post("/api/v1/generate-descriptions").contentType(MediaType.APPLICATION_JSON)
                                                            .content(body("1.0.0", validSignature())))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.response.job_id").value(jobId.toString()))
               .andExpect(jsonPath("$.response.status").value("accepted"))
               .andExpect(jsonPath("$.statusCode").value(201));

        ArgumentCaptor<List<LotSubmission>> lots = ArgumentCaptor.forClass(List.class);
        verify(orchestrationService).createJob(lots.capture(), eq(List.of("en", "fr")), eq("https://client/hook"));
        assertThat(lots.getValue()).containsExactly(
                new LotSubmission("L-1", "Blue hatchback, état moyen", List.of("https://img/1.jpg", "https://img/2.jpg"),
                                  null),
                new LotSubmission("L-2", null, List.of(), "https://other/hook"));
    }

    @Test
    void rejectsTamperedSignature() throws Exception {
        String signature = validSignature();
        String tampered = body("1.0.0", signature).replace("https://img/2.jpg", "https://img/3.jpg");

        mockMvc.perform(post("/api/v1/generate-descriptions").contentType(MediaType.APPLICATION_JSON)
                                                            .content(tampered))
               .andExpect(status().isForbidden())
               .andExpect(jsonPath("$.displayMessage").value("Invalid signature"));
        verify(orchestrationService, never()).createJob(anyList(), anyList(), any());
    }

    @Test
    void rejectsUnsupportedVersion() throws Exception {
        mockMvc.perform(post("/api/v1/generate-descriptions").contentType(MediaType.APPLICATION_JSON)
                                                            .content(body("2.0.0", validSignature())))
               .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsLotWithoutId() throws Exception {
        String lots = "[{\"images\":[]}]";
        String request = "{\"version\":\"1.0.0\",\"signature\":\"" + signatureService.sign(objectMapper.readTree(lots))
                         + "\",\"languages\":[\"en\"],\"lots\":" + lots + "}";

        mockMvc.perform(post("/api/v1/generate-descriptions").contentType(MediaType.APPLICATION_JSON)
                                                            .content(request))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.response").value(org.hamcrest.Matchers.containsString("lot_id is required")));
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/generate-descriptions").contentType(MediaType.APPLICATION_JSON)
                                                            .content("{\"version\":"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("Malformed request body."))
               .andExpect(jsonPath("$.response").value("The request body is missing or could not be parsed."))
               .andExpect(jsonPath("$.showMessage").value(true));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrationService.getStatus(jobId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/jobs/{jobId}/status", jobId))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.displayMessage").value("Job not found: " + jobId));
    }

    @Test
    void malformedJobIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/jobs/{jobId}", "not-a-uuid")).andExpect(status().isBadRequest());
    }

    @Test
    void cancellingFinishedJobConflicts() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrationService.cancelJob(jobId, null)).thenReturn(false);

        mockMvc.perform(post("/api/v1/jobs/{jobId}/cancel", jobId)).andExpect(status().isConflict());
    }

    @Test
    void retryOfUnknownOrActiveDeliveryIsRejected() throws Exception {
        doThrow(new JobNotFoundException("Webhook delivery not found: 7")).when(monitoringService).retryDelivery(7L);
        doThrow(new JobStateConflictException("Webhook delivery 8 is not in a failed state"))
                .when(monitoringService).retryDelivery(8L);

        mockMvc.perform(post("/api/v1/webhook-deliveries/{id}/retry", 7L)).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/webhook-deliveries/{id}/retry", 8L)).andExpect(status().isConflict());
        mockMvc.perform(post("/api/v1/webhook-deliveries/{id}/retry", 9L)).andExpect(status().isOk());
    }

    @Test
    void metricsWindowIsValidated() throws Exception {
        mockMvc.perform(get("/api/v1/webhook-metrics").param("hours", "0")).andExpect(status().isBadRequest());
    }
}
