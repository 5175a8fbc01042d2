package com.example.bugretention.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HardDeleteHttpRequestTest {

    private static final String ID = "7f1f7d34-2f59-4a3b-9c55-0c1b9a0f6e01";

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void initValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        if (factory != null) {
            factory.close();
        }
    }

    private static Set<String> violatedFields(Object request) {
        Set<String> fields = new java.util.TreeSet<>();
        for (ConstraintViolation<Object> v : validator.validate(request)) {
            fields.add(v.getPropertyPath().toString());
        }
        return fields;
    }

    @Test
    @DisplayName("confirmed request with UUID ids is valid and defaults to a certificate")
    void valid() throws Exception {
        HardDeleteHttpRequest request = new ObjectMapper().readValue(
                "{\"reportIds\":[\"" + ID + "\"],\"confirm\":true}", HardDeleteHttpRequest.class);

        assertTrue(violatedFields(request).isEmpty());
        assertTrue(request.certificateRequested());
    }

    @Test
    @DisplayName("confirm false or missing is rejected")
    void confirmMustBeTrue() {
        assertEquals(Set.of("confirm"), violatedFields(new HardDeleteHttpRequest(List.of(ID), false, null)));
        assertEquals(Set.of("confirm"), violatedFields(new HardDeleteHttpRequest(List.of(ID), null, null)));
    }

    @Test
    @DisplayName("ids must be UUIDs, non-empty and at most 100")
    void reportIdConstraints() {
        assertFalse(violatedFields(new HardDeleteHttpRequest(List.of("not-a-uuid"), true, false)).isEmpty());
        assertEquals(Set.of("reportIds"), violatedFields(new HardDeleteHttpRequest(List.of(), true, false)));

        List<String> tooMany = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            tooMany.add(UUID.randomUUID().toString());
        }
        assertEquals(Set.of("reportIds"), violatedFields(new HardDeleteHttpRequest(tooMany, true, false)));
    }

    @Test
    @DisplayName("explicit generateCertificate=false is honoured")
    void certificateOptOut() {
        assertFalse(new HardDeleteHttpRequest(List.of(ID), true, false).certificateRequested());
    }
}
