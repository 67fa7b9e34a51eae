package com.patina.orchestrator.sandbox;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads newline-terminated lines, refusing any line longer than a fixed bound.
 */
class BoundedLineReader {

    static class LineTooLongException extends IOException {
        LineTooLongException(int limit) {
            super("line exceeds " + limit + " characters");
        }
    }

    private final Reader in;
    private final int    maxChars;
    private final char[] buffer = new char[8192];
    private int pos;
    private int len;

    BoundedLineReader(Reader in, int maxChars) {
        this.in       = in;
        this.maxChars = maxChars;
    }

    /** The next line without its terminator, or null at end of stream. */
    String readLine() throws IOException {
        StringBuilder line = null;
        while (true) {
            if (pos >= len) {
                len = in.read(buffer, 0, buffer.length);
                pos = 0;
                if (len <= 0) {
                    len = 0;
                    return line == null ? null : line.toString();
                }
            }
            if (line == null) {
                line = new StringBuilder();
            }
            while (pos < len) {
                char c = buffer[pos++];
                if (c == '\n') {
                    int end = line.length();
                    if (end > 0 && line.charAt(end - 1) == '\r') {
                        line.setLength(end - 1);
                    }
                    return line.toString();
                }
                if (line.length() >= maxChars) {
                    throw new LineTooLongException(maxChars);
                }
                line.append(c);
            }
        }
    }
}
