package com.techStack.geoVault.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void success_shouldWrapPayloadInOrder() {
        JsonNode json = objectMapper.valueToTree(ApiResponse.success("Policy updated", Map.of("radiusMeters", 500)));

        List<String> names = new ArrayList<>();
        json.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("success", "message", "data", "timestamp");
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("data").get("radiusMeters").asInt()).isEqualTo(500);
    }

    @Test
    void success_shouldUseDefaultMessage_forPayloadOnly() {
        ApiResponse<List<String>> response = ApiResponse.success(List.of("a.txt"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getMessage()).isEqualTo("Operation successful");
        assertThat(response.getTimestamp()).isNotNull();
    }

    @Test
    void success_shouldOmitData_forAcknowledgement() {
        JsonNode json = objectMapper.valueToTree(ApiResponse.success("Logged out successfully"));

        assertThat(json.has("data")).isFalse();
        assertThat(json.get("message").asText()).isEqualTo("Logged out successfully");
    }
}
