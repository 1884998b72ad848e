package com.ryuqq.smokestack.core.error;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SmokestackException 테스트.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class SmokestackExceptionTest {

    @Test
    void notFound_CarriesEntityAndId() {
        // When
        SmokestackException exception = SmokestackException.notFound(EntityKind.COMPONENT, "db");

        // Then
        assertEquals(ErrorKind.NOT_FOUND, exception.kind());
        assertEquals("component db not found", exception.getMessage());
        assertEquals(Map.of("entity", "component", "id", "db"), exception.details());
        assertEquals(404, exception.kind().statusCode());
    }

    @Test
    void missingItem_UsesOriginalWording() {
        SmokestackException exception = SmokestackException.missingItem("operator");

        assertEquals("at least one operator is required", exception.getMessage());
        assertEquals("operator", exception.detail("kind"));
    }

    @Test
    void statusCodes_MatchTransportMapping() {
        assertEquals(401, ErrorKind.MISSING_TOKEN.statusCode());
        assertEquals(400, ErrorKind.INVALID_TOKEN.statusCode());
        assertEquals(424, ErrorKind.UNMET_DEPENDENCY.statusCode());
        assertEquals(423, ErrorKind.LOCK_FAILED.statusCode());
        assertEquals(500, ErrorKind.INTERNAL.statusCode());
        assertFalse(ErrorKind.INTERNAL.isClientError());
        assertTrue(ErrorKind.SUBSCRIBING_MULTIPLE_ENTITIES.isClientError());
    }

    @Test
    void internal_KeepsCause() {
        // Given
        IllegalStateException cause = new IllegalStateException("boom");

        // When
        SmokestackException exception = SmokestackException.internal(cause);

        // Then
        assertEquals(ErrorKind.INTERNAL, exception.kind());
        assertSame(cause, exception.getCause());
        assertTrue(exception.details().isEmpty());
        assertNull(exception.detail("missing"));
    }

    @Test
    void details_AreImmutable() {
        SmokestackException exception = SmokestackException.lockFailed("db");

        assertThrows(UnsupportedOperationException.class, () -> exception.details().put("x", "y"));
    }
}
