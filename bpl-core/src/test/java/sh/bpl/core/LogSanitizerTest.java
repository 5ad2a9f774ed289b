// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsJsonSecrets() {
        String out = LogSanitizer.sanitize("{\"secret\":\"s1\",\"privateKey\":\"abcd\",\"fee\":1}");
        assertEquals("{\"secret\":\"***[REDACTED]***\",\"privateKey\":\"***[REDACTED]***\",\"fee\":1}", out);
    }

    @Test
    void redactsInlineSecrets() {
        assertEquals("Signer[passphrase=***[REDACTED]***, key=02ab]",
                LogSanitizer.sanitize("Signer[passphrase=hunter2, key=02ab]"));
    }

    @Test
    void truncatesLongLines() {
        String out = LogSanitizer.sanitize("a".repeat(5000));
        assertEquals(2000, out.length());
        assertTrue(out.endsWith("...(truncated)"));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void shortensLongHexInFormatter() {
        assertEquals("abcdef...6789", LogFormatter.shortenHash("abcdef0123456789abcdef0123456789"));
        assertEquals("short", LogFormatter.shortenHash("short"));
    }
}
