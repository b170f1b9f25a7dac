package com.kmg.extract.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import com.kmg.extract.model.InsurerProfile;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pulls the JSON object out of a model response and normalizes its fields.
 * Unparseable responses are transient: asking again usually yields valid JSON.
 */
@Service
public class ResponseParser {
    private static final Set<String> NULL_LIKE = Set.of("none", "null", "n/a", "na");

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, String> parse(String rawResponse, InsurerProfile profile) {
        String text = rawResponse == null ? "" : rawResponse.strip();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE, "No JSON object found in response");
        }

        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(text.substring(start, end + 1), new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ErrorKind.TRANSIENT_FAILURE,
                    "Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
        return clean(raw, profile);
    }

    Map<String, String> clean(Map<String, Object> raw, InsurerProfile profile) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        for (String field : ExtractionSchema.FIELDS) {
            cleaned.put(field, cleanValue(raw.get(field)));
        }
        raw.forEach((key, value) -> cleaned.putIfAbsent(key, cleanValue(value)));

        String company = cleaned.get(ExtractionSchema.COMPANY_FIELD);
        if (!company.toLowerCase(Locale.ROOT).contains(profile.marker())) {
            cleaned.put(ExtractionSchema.COMPANY_FIELD, profile.companyName());
        }
        return cleaned;
    }

    private String cleanValue(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof String s ? s : value.toString();
        String collapsed = String.join(" ", text.strip().split("\\s+"));
        if (NULL_LIKE.contains(collapsed.toLowerCase(Locale.ROOT))) {
            return "";
        }
        return collapsed;
    }
}
