package com.uid2.sqspoller.codec;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class BrotliCompressionTest {

    private static final String PLAIN = "{\"i\": 1}";
    private static final String COMPRESSED = "iwOAeyJpIjogMX0D";

    @Test
    void testCompressKnownValue() throws IOException {
        assertEquals(COMPRESSED, BrotliCompression.compress(PLAIN));
    }

    @Test
    void testDecompressKnownValue() throws IOException {
        assertEquals(PLAIN, BrotliCompression.decompress(COMPRESSED));
    }

    @Test
    void testRoundTripUnicodeAndLargeText() throws IOException {
        String text = "größe ✓ ".repeat(5000);

        String compressed = BrotliCompression.compress(text);

        assertTrue(compressed.length() < text.length());
        assertEquals(text, BrotliCompression.decompress(compressed));
    }

    @Test
    void testDecompressRejectsNonBase64() {
        assertThrows(IOException.class, () -> BrotliCompression.decompress("not base64 at all!"));
    }

    @Test
    void testDecompressRejectsCorruptStream() {
        assertThrows(IOException.class, () -> BrotliCompression.decompress("AAAAAAAA"));
    }
}
