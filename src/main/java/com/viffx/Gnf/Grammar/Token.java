package com.viffx.Gnf.Grammar;

public record Token(TokenType type, String value) {
    public static final Token EOF = new Token(TokenType.EOF, null);

    public boolean is(TokenType type, String value) {
        return this.type == type && (value == null || value.equals(this.value));
    }

    @Override
    public String toString() {
        return type + "(" + (value == null ? "" : value) + ")";
    }
}
