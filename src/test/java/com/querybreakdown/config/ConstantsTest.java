package com.querybreakdown.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(10_000L, Constants.DEFAULT_TIME_LIMIT_MILLIS);
        assertEquals(3, Constants.DEFAULT_REPLACEMENT_LIMIT);
        assertEquals(64, Constants.DEFAULT_MAX_DEPTH);
        assertEquals("BIG_QUERY", Constants.DEFAULT_LEX);
        assertEquals("Encountered \"<EOF>\"", Constants.EOF_MARKER);
        assertEquals("Encountered: <EOF>", Constants.EOF_LEXICAL_MARKER);
        assertTrue(Constants.MAX_REPLACEMENT_LIMIT >= Constants.DEFAULT_REPLACEMENT_LIMIT);
        assertTrue(Constants.MAX_TIME_LIMIT_MILLIS >= Constants.DEFAULT_TIME_LIMIT_MILLIS);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
