package io.github.drompincen.payverify.gateway.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import io.github.drompincen.payverify.protocol.api.VerificationStatusResponse;
import io.github.drompincen.payverify.protocol.event.ProgressEvent;
import io.github.drompincen.payverify.protocol.event.ProgressStep;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    void progressEventUsesSnakeCaseAndOmitsEmptyPayload() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                ProgressEvent.of(3, ProgressStep.EXTRACTING)));

        assertThat(json.get("progress_percent").asInt()).isEqualTo(40);
        assertThat(json.get("step").asText()).isEqualTo("extracting");
        assertThat(json.has("payload")).isFalse();
    }

    @Test
    void datesAreIsoStrings() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                new VerificationStatusResponse("verified", "Verification verified", Instant.parse("2024-04-01T10:00:00Z"))));

        assertThat(json.get("last_updated").asText()).isEqualTo("2024-04-01T10:00:00Z");
    }

    @Test
    void extractedRecordKeepsOnlyKnownFields() throws Exception {
        String json = mapper.writeValueAsString(ExtractedRecord.builder().employeeName("Maria Garcia").build());

        assertThat(json).isEqualTo("{\"employee_name\":\"Maria Garcia\"}");
    }
}
