package com.williamcallahan.notepreview.service.markdown.transform;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;

/**
 * Encodes PlantUML source the way PlantUML servers expect it in URLs:
 * raw deflate followed by PlantUML's own base64 alphabet ({@code 0-9A-Za-z-_}).
 */
public final class PlantUmlEncoder {

    private static final int BUFFER_SIZE = 1024;

    private PlantUmlEncoder() {}

    public static String encode(String source) {
        byte[] compressed = deflate(source == null ? new byte[0] : source.getBytes(StandardCharsets.UTF_8));
        return encode64(compressed);
    }

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION, true);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream output = new ByteArrayOutputStream(Math.max(16, input.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int written = deflater.deflate(buffer);
                output.write(buffer, 0, written);
            }
            return output.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static String encode64(byte[] data) {
        StringBuilder encoded = new StringBuilder((data.length + 2) / 3 * 4);
        for (int index = 0; index < data.length; index += 3) {
            int first = data[index] & 0xFF;
            int second = index + 1 < data.length ? data[index + 1] & 0xFF : 0;
            int third = index + 2 < data.length ? data[index + 2] & 0xFF : 0;
            encoded.append(encode6bit(first >> 2));
            encoded.append(encode6bit(((first & 0x3) << 4) | (second >> 4)));
            encoded.append(encode6bit(((second & 0xF) << 2) | (third >> 6)));
            encoded.append(encode6bit(third & 0x3F));
        }
        return encoded.toString();
    }

    private static char encode6bit(int value) {
        if (value < 10) {
            return (char) ('0' + value);
        }
        value -= 10;
        if (value < 26) {
            return (char) ('A' + value);
        }
        value -= 26;
        if (value < 26) {
            return (char) ('a' + value);
        }
        value -= 26;
        return value == 0 ? '-' : '_';
    }
}
