package com.linerelay.internal.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reads \n-delimited UTF-8 lines from a raw stream.
 *
 * Unlike {@link java.io.BufferedReader#readLine()} a lone \r is not a line
 * break; only a \r directly before the \n is stripped. Malformed UTF-8 and
 * lines above the size limit are reported as {@link IOException}s so the caller
 * treats them like any other read failure.
 */
public class LineReader {
    private static final int BUFFER_SIZE = 8192;

    private final InputStream in;
    private final int maxLineBytes;
    private final byte[] chunk = new byte[BUFFER_SIZE];
    private int chunkPos = 0;
    private int chunkLen = 0;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);

    public LineReader(InputStream in, int maxLineBytes) {
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive: " + maxLineBytes);
        }
        this.in = in;
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * @return the next line without its terminator, or {@code null} once the
     *         stream is exhausted. A final line without a trailing \n is still
     *         returned.
     */
    public String readLine() throws IOException {
        // a timeout from the stream leaves the partial line in place for the next call
        while (true) {
            if (chunkPos == chunkLen) {
                int n = in.read(chunk, 0, chunk.length);
                if (n == -1) {
                    return line.size() == 0 ? null : decode(takeLine());
                }
                chunkLen = n;
                chunkPos = 0;
            }
            int start = chunkPos;
            while (chunkPos < chunkLen && chunk[chunkPos] != RelayProtocol.LINE_DELIMITER) {
                chunkPos++;
            }
            append(start, chunkPos - start);
            if (chunkPos < chunkLen) {
                chunkPos++; // consume \n
                byte[] bytes = takeLine();
                int len = bytes.length;
                if (len > 0 && bytes[len - 1] == '\r') {
                    len--;
                }
                return decode(bytes, len);
            }
        }
    }

    private byte[] takeLine() {
        byte[] bytes = line.toByteArray();
        line.reset();
        return bytes;
    }

    private void append(int offset, int count) throws IOException {
        if ((long) line.size() + count > maxLineBytes) {
            throw new IOException("Line exceeds " + maxLineBytes + " bytes");
        }
        line.write(chunk, offset, count);
    }

    private static String decode(byte[] bytes) throws IOException {
        return decode(bytes, bytes.length);
    }

    private static String decode(byte[] bytes, int len) throws IOException {
        CharsetDecoder dec = StandardCharsets.UTF_8.newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return dec.decode(ByteBuffer.wrap(bytes, 0, len)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Invalid UTF-8 in line", e);
        }
    }
}
