package com.uid2.sqspoller.codec;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.Decoder;
import com.aayushatharva.brotli4j.decoder.DecoderJNI;
import com.aayushatharva.brotli4j.decoder.DirectDecompress;
import com.aayushatharva.brotli4j.encoder.Encoder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Brotli body compression. Compressed bodies travel as Base64 text.
 */
public class BrotliCompression {

    static {
        Brotli4jLoader.ensureAvailability();
    }

    public static String compress(String body) throws IOException {
        byte[] compressed = Encoder.compress(body.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(compressed);
    }

    /**
     * @throws IOException if the text is not Base64 or not a complete brotli stream
     */
    public static String decompress(String encoded) throws IOException {
        byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IOException("compressed body is not base64", e);
        }
        DirectDecompress result = Decoder.decompress(compressed);
        if (result.getResultStatus() != DecoderJNI.Status.DONE) {
            throw new IOException("brotli decompression failed: " + result.getResultStatus());
        }
        return new String(result.getDecompressedData(), StandardCharsets.UTF_8);
    }
}
