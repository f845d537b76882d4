package io.penguin.metrics.config;

public enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    DURATION,
    BOOLEAN,
    LBRACE,
    RBRACE,
    SEMICOLON,
    INCLUDE,
    EOF
}
