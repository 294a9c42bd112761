package com.viffx.Gnf.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Provides a two-character buffered reader for lexers, allowing single-character
 * lookahead and controlled advancement through a text stream.
 *
 * <p>Subclasses hook into {@link #onNextChar()} to keep their own position bookkeeping.
 *
 * <p>EOF (end-of-file) is detected when the current character slot in the buffer
 * contains {@code -1}.
 */
public class LexicalCharacterBuffer implements AutoCloseable {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Reader supplying characters from the source.
     */
    private final BufferedReader reader;

    /**
     * Holds the current and next character codes from the input stream.
     * <ul>
     *     <li>{@code buffer[0]} - current character</li>
     *     <li>{@code buffer[1]} - next lookahead character</li>
     * </ul>
     */
    private final int[] buffer = new int[2];

    private boolean eof;

    // ====== CONSTRUCTORS ====== //
    /**
     * Wraps {@code source} and fills the two-character buffer.
     *
     * @param source the characters being lexed
     * @throws IOException if an I/O error occurs while reading the first characters
     */
    public LexicalCharacterBuffer(Reader source) throws IOException {
        Objects.requireNonNull(source, "source cannot be null");
        reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        buffer[0] = reader.read();
        buffer[1] = reader.read();

        eof = buffer[0] == -1;
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Returns {@code true} if the end of the input has been reached.
     */
    public final boolean eof() {
        return eof;
    }

    /**
     * Returns the current character in the buffer.
     */
    public final char crntChar() {
        return (char) buffer[0];
    }

    /**
     * Returns the next character in the buffer without advancing, or {@code -1} cast to a char
     * when there is none. Use {@link #hasPeek()} to tell the two apart.
     */
    public final char peekChar() {
        return (char) buffer[1];
    }

    public final boolean hasPeek() {
        return buffer[1] != -1;
    }

    /**
     * Advances the buffer by one character, shifting the lookahead character into the current
     * slot and reading a new lookahead from the underlying reader.
     *
     * <p>Before the shift, this method calls {@link #onNextChar()}.
     *
     * @return the newly current character after advancing
     * @throws IOException if the end of the input has already been reached
     */
    public final char nextChar() throws IOException {
        if (eof) throw new IOException("Reached the end of the file.");

        onNextChar();

        buffer[0] = buffer[1];
        buffer[1] = reader.read();

        eof = buffer[0] == -1;

        return crntChar();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    // ====== API HOOKS ====== //
    /**
     * Called immediately before advancing the buffer to the next character, while
     * {@link #crntChar()} still returns the character being left behind.
     */
    public void onNextChar() {}

    // ====== DEBUG INFO ====== //
    /**
     * Returns a human-readable representation of the current buffer contents.
     *
     * @return a string showing the current and next characters in the buffer
     */
    public String buffer() {
        String[] chars = new String[2];
        for (int i = 0; i < 2; i++) {
            if (buffer[i] == -1) {
                chars[i] = "EOF";
                continue;
            }
            char c = (char) buffer[i];
            chars[i] = switch (c) {
                case '\b' -> "\\b";
                case '\t' -> "\\t";
                case '\n' -> "\\n";
                case '\f' -> "\\f";
                case '\r' -> "\\r";
                default -> String.valueOf(c);
            };
        }
        return String.format("['%s','%s']", chars[0], chars[1]);
    }
}
