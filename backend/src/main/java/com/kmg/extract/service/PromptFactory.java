package com.kmg.extract.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.extract.model.InsurerProfile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class PromptFactory {
    private final Map<InsurerProfile, String> rulesByProfile = new EnumMap<>(InsurerProfile.class);
    private final String schemaJson;

    public PromptFactory(ObjectMapper objectMapper) {
        for (InsurerProfile profile : InsurerProfile.values()) {
            rulesByProfile.put(profile, loadRules(profile));
        }

        Map<String, String> schema = new LinkedHashMap<>();
        ExtractionSchema.FIELDS.forEach(field -> schema.put(field, ""));
        try {
            this.schemaJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render extraction schema", e);
        }
    }

    public String create(String documentText, InsurerProfile profile) {
        return """
                You are an expert at extracting structured data from insurance policy documents.

                %s

                TASK:
                Extract all fields from the PDF text below and return ONLY a valid JSON object with the exact structure shown.
                Do NOT include any explanations, markdown formatting, or additional text - ONLY the JSON object.

                REQUIRED OUTPUT FORMAT:
                %s

                PDF TEXT TO EXTRACT FROM:
                %s

                Return ONLY the JSON object with all extracted fields. Ensure all string values are properly quoted and escaped.
                """.formatted(rulesByProfile.get(profile), schemaJson, documentText);
    }

    private String loadRules(InsurerProfile profile) {
        ClassPathResource resource = new ClassPathResource("prompts/" + profile.marker() + ".txt");
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Missing extraction rules for " + profile, e);
        }
    }
}
