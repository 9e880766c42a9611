package com.ryuqq.conductor.core.model;

import com.ryuqq.conductor.core.json.JsonSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Domain 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DomainTest {

    @Test
    void of_KnownIdentifier_ReturnsDomain() {
        assertEquals(Domain.UX_UI, Domain.of("ux-ui"));
        assertEquals(Domain.BACKEND_INFRA, Domain.of("backend-infra"));
    }

    @Test
    void of_UnknownIdentifier_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Domain.of("payroll")
        );
        assertTrue(exception.getMessage().contains("payroll"));
    }

    @Test
    void of_EnumNameInsteadOfIdentifier_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Domain.of("UX_UI"));
    }

    @Test
    void find_Null_ReturnsEmpty() {
        assertTrue(Domain.find(null).isEmpty());
    }

    @Test
    void values_ExactlyEightDomains() {
        assertEquals(8, Domain.values().length);
    }

    @Test
    void json_UsesWireIdentifier() throws Exception {
        // When
        String json = JsonSupport.mapper().writeValueAsString(Domain.BFF_API);
        Domain parsed = JsonSupport.mapper().readValue("\"devex\"", Domain.class);

        // Then
        assertEquals("\"bff-api\"", json);
        assertEquals(Domain.DEVEX, parsed);
    }
}
