package com.deepagent.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BoundedOutputTest {

    @Test
    @DisplayName("output under the limit is kept whole")
    void underLimit() {
        var out = new BoundedOutput(16);
        byte[] bytes = "héllo".getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);

        assertFalse(out.overflowed());
        assertEquals("héllo", out.text());
    }

    @Test
    @DisplayName("a cut inside a multi-byte character drops the partial character")
    void streamCutInsideCharacter() {
        var out = new BoundedOutput(4);
        byte[] bytes = "ab€".getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);

        assertTrue(out.overflowed());
        assertEquals("ab", out.text());
        assertFalse(out.text().contains("\uFFFD"));
    }

    @Test
    @DisplayName("capped text never exceeds the byte budget")
    void capStaysWithinBudget() {
        String output = "a" + "😀".repeat(10);
        for (int max = 1; max < 12; max++) {
            ExecuteResult result = BoundedOutput.cap(output, 0, max);
            String head = result.output().substring(0,
                    result.output().length() - ExecuteResult.TRUNCATION_MARKER.length());

            assertTrue(result.truncated());
            assertFalse(head.contains("\uFFFD"), "max=" + max);
            assertTrue(head.getBytes(StandardCharsets.UTF_8).length <= max, "max=" + max);
        }
    }

    @Test
    @DisplayName("a cut on a character boundary keeps every byte")
    void cutOnBoundary() {
        ExecuteResult result = BoundedOutput.cap("aé€rest", 0, 6);
        assertEquals("aé€" + ExecuteResult.TRUNCATION_MARKER, result.output());
    }
}
