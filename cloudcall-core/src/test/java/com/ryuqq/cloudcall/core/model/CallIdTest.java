package com.ryuqq.cloudcall.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallId 테스트.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
class CallIdTest {

    @Test
    void of_음수이면_예외() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CallId.of(-1)
        );
        assertTrue(exception.getMessage().contains("non-negative"));
    }

    @Test
    void next_단조_증가() {
        // given
        CallId first = CallId.of(0);

        // when
        CallId second = first.next();

        // then
        assertEquals(1L, second.getValue());
        assertTrue(second.compareTo(first) > 0);
    }

    @Test
    void equals_같은_값이면_동등() {
        assertEquals(CallId.of(7), CallId.of(7));
        assertEquals(CallId.of(7).hashCode(), CallId.of(7).hashCode());
        assertNotEquals(CallId.of(7), CallId.of(8));
        assertEquals("CallId{7}", CallId.of(7).toString());
    }
}
