package com.viffx.Gnf.Utils;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexicalCharacterBufferTest {

    @Test
    void shouldAdvanceWithOneCharacterLookahead() throws IOException {
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer(new StringReader("ab"));

        assertThat(buffer.crntChar()).isEqualTo('a');
        assertThat(buffer.peekChar()).isEqualTo('b');
        assertThat(buffer.hasPeek()).isTrue();

        assertThat(buffer.nextChar()).isEqualTo('b');
        assertThat(buffer.hasPeek()).isFalse();
        assertThat(buffer.eof()).isFalse();

        buffer.nextChar();
        assertThat(buffer.eof()).isTrue();
        assertThatThrownBy(buffer::nextChar).isInstanceOf(IOException.class);
    }

    @Test
    void shouldStartAtEndForEmptyInput() throws IOException {
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer(new StringReader(""));

        assertThat(buffer.eof()).isTrue();
        assertThat(buffer.buffer()).isEqualTo("['EOF','EOF']");
    }

    @Test
    void shouldCallHookWithCharacterBeingLeft() throws IOException {
        StringBuilder seen = new StringBuilder();
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer(new StringReader("x\ny")) {
            @Override
            public void onNextChar() {
                seen.append(crntChar());
            }
        };

        assertThat(buffer.buffer()).isEqualTo("['x','\\n']");
        buffer.nextChar();
        buffer.nextChar();
        buffer.nextChar();

        assertThat(seen.toString()).isEqualTo("x\ny");
    }
}
