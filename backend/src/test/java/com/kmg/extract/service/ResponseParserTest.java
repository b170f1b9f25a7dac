package com.kmg.extract.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ExtractionException;
import com.kmg.extract.model.InsurerProfile;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {
    private final ResponseParser parser = new ResponseParser(new ObjectMapper());

    @Test
    void extractsJsonFromFencedResponse() {
        String raw = """
                Here is the result:
                ```json
                {"POLICY_NO": "  9200/123  ", "CUSTOMER_NAME": "RAVI\\n KUMAR", "INSURANCE_COMPANY_NAME": "Shriram General"}
                ```
                """;

        Map<String, String> fields = parser.parse(raw, InsurerProfile.SHRIRAM);

        assertThat(fields).containsEntry("POLICY_NO", "9200/123");
        assertThat(fields).containsEntry("CUSTOMER_NAME", "RAVI KUMAR");
        assertThat(fields).containsEntry("INSURANCE_COMPANY_NAME", "Shriram General");
    }

    @Test
    void everySchemaFieldIsPresentInSchemaOrder() {
        Map<String, String> fields = parser.parse("{\"NCB\": 20}", InsurerProfile.RELIANCE);

        assertThat(fields.keySet()).startsWith(ExtractionSchema.FIELDS.toArray(new String[0]));
        assertThat(fields).containsEntry("NCB", "20");
        assertThat(fields).containsEntry("GVW", "");
    }

    @Test
    void nullLikeValuesBecomeEmpty() {
        Map<String, String> fields = parser.parse(
                "{\"FINANCIER_NAME\": \"N/A\", \"NOMINEE_NAME\": null, \"GVW\": \"None\"}", InsurerProfile.RELIANCE);

        assertThat(fields).containsEntry("FINANCIER_NAME", "").containsEntry("NOMINEE_NAME", "").containsEntry("GVW", "");
    }

    @Test
    void companyNameIsCorrectedWhenItDoesNotMatchTheProfile() {
        Map<String, String> fields = parser.parse("{\"INSURANCE_COMPANY_NAME\": \"Some Broker Ltd\"}", InsurerProfile.RELIANCE);

        assertThat(fields).containsEntry("INSURANCE_COMPANY_NAME", "Reliance General Insurance");
    }

    @Test
    void extraKeysAreKept() {
        Map<String, String> fields = parser.parse("{\"REMARKS\": \"renewal\"}", InsurerProfile.RELIANCE);

        assertThat(fields).containsEntry("REMARKS", "renewal");
    }

    @Test
    void responseWithoutJsonIsTransient() {
        assertThatThrownBy(() -> parser.parse("Sorry, I cannot help.", InsurerProfile.RELIANCE))
                .isInstanceOf(ExtractionException.class)
                .extracting(e -> ((ExtractionException) e).kind())
                .isEqualTo(ErrorKind.TRANSIENT_FAILURE);
    }

    @Test
    void malformedJsonIsTransient() {
        assertThatThrownBy(() -> parser.parse("{\"POLICY_NO\": \"x\",, }", InsurerProfile.RELIANCE))
                .isInstanceOf(ExtractionException.class)
                .extracting(e -> ((ExtractionException) e).kind())
                .isEqualTo(ErrorKind.TRANSIENT_FAILURE);
    }
}
