package com.github.stormino.medialib.service.credential;

import com.github.stormino.medialib.exception.InvalidCredentialException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CookieJarValidator")
class CookieJarValidatorTest {

    private static final String JAR = "# Netscape HTTP Cookie File\n"
            + ".youtube.com\tTRUE\t/\tTRUE\t0\tSID\tabc\n";

    private final CookieJarValidator validator = new CookieJarValidator();

    @Nested
    @DisplayName("isValid")
    class IsValidTests {

        @Test
        @DisplayName("should accept both known headers")
        void shouldAcceptHeaders() {
            assertTrue(validator.isValid(JAR));
            assertTrue(validator.isValid("# HTTP Cookie File\n"));
        }

        @Test
        @DisplayName("should ignore surrounding blank space")
        void shouldIgnoreBlankSpace() {
            assertTrue(validator.isValid("\n\n   " + JAR));
        }

        @Test
        @DisplayName("should reject anything else")
        void shouldRejectOthers() {
            assertFalse(validator.isValid(null));
            assertFalse(validator.isValid(""));
            assertFalse(validator.isValid("SID=abc; HSID=def"));
            assertFalse(validator.isValid("{\"cookies\": []}"));
        }
    }

    @Nested
    @DisplayName("requireValid")
    class RequireValidTests {

        @Test
        @DisplayName("should normalize to one trailing newline")
        void shouldNormalize() {
            assertEquals(JAR, validator.requireValid("  \n" + JAR + "\n\n"));
        }

        @Test
        @DisplayName("should throw with a hint about the format")
        void shouldThrow() {
            InvalidCredentialException exception = assertThrows(InvalidCredentialException.class,
                    () -> validator.requireValid("not cookies"));
            assertTrue(exception.getMessage().contains("Netscape"));
        }
    }
}
