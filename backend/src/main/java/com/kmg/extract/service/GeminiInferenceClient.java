package com.kmg.extract.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kmg.extract.config.ExtractorProperties;
import com.kmg.extract.model.CredentialHandle;
import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class GeminiInferenceClient implements InferenceClient {
    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestClient restClient;
    private final String model;

    public GeminiInferenceClient(RestClient.Builder restClientBuilder, ExtractorProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.getInference().getBaseUrl())
                .build();
        this.model = properties.getInference().getModel();
    }

    @Override
    public String infer(String prompt, CredentialHandle credential) {
        Map<String, Object> body = Map.of(
                "contents", List.of(
                        Map.of("parts", List.of(Map.of("text", prompt)))
                )
        );

        GenerateContentResponse response;
        try {
            response = restClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .header(API_KEY_HEADER, credential.secret())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(GenerateContentResponse.class);
        } catch (RestClientResponseException e) {
            throw classify(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Inference service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Inference call failed: " + e.getMessage(), e);
        }

        return extractText(response);
    }

    static ExtractionException classify(int status, String responseBody) {
        String body = responseBody == null ? "" : responseBody;
        String lower = body.toLowerCase(Locale.ROOT);
        String message = "Inference service returned HTTP " + status + summarize(body);

        if (status == 429) {
            if (isDailyQuotaMessage(lower)) {
                return new ExtractionException(ErrorKind.QUOTA_EXHAUSTED, message);
            }
            return new ExtractionException(ErrorKind.RATE_LIMITED, message);
        }
        if (status == 401 || status == 403) {
            return new ExtractionException(ErrorKind.INVALID_CREDENTIAL, message);
        }
        if (status == 400 && (lower.contains("api_key_invalid") || lower.contains("api key not valid"))) {
            return new ExtractionException(ErrorKind.INVALID_CREDENTIAL, message);
        }
        if (status == 408 || status >= 500) {
            return new ExtractionException(ErrorKind.TRANSIENT_FAILURE, message);
        }
        return new ExtractionException(ErrorKind.PERMANENT_FAILURE, message);
    }

    private static boolean isDailyQuotaMessage(String lower) {
        return lower.contains("perday") || lower.contains("per day") || lower.contains("daily");
    }

    private static String summarize(String body) {
        String compact = body.replaceAll("\\s+", " ").strip();
        if (compact.isEmpty()) {
            return "";
        }
        return ": " + (compact.length() > 300 ? compact.substring(0, 300) + "..." : compact);
    }

    private String extractText(GenerateContentResponse response) {
        if (response == null) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Empty response from inference service");
        }
        if (response.promptFeedback() != null && response.promptFeedback().blockReason() != null) {
            throw new ExtractionException(ErrorKind.PERMANENT_FAILURE,
                    "Prompt blocked: " + response.promptFeedback().blockReason());
        }
        if (response.candidates() == null || response.candidates().isEmpty()) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Response has no candidates");
        }

        Content content = response.candidates().get(0).content();
        if (content == null || content.parts() == null) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Response candidate has no content");
        }
        StringBuilder sb = new StringBuilder();
        for (Part part : content.parts()) {
            if (part.text() != null) {
                sb.append(part.text());
            }
        }
        if (sb.isEmpty()) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "Response candidate has no text");
        }
        return sb.toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PromptFeedback(String blockReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates, PromptFeedback promptFeedback) {
    }
}
