package com.tale.script.parser;

public enum TokenType {
    // single-character
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, DOT, SEMICOLON,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // one or two characters
    DOUBLE_STAR, DOUBLE_SLASH, ARROW,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR, NOT_IN,

    // literals
    IDENTIFIER, STRING, INTEGER, DECIMAL,

    // keywords
    IF, ELIF, ELSE, WHILE, FOR, IN, FUNCTION, CLASS, TRY, CATCH, FINALLY,
    RETURN, BREAK, CONTINUE, PASS, RAISE, IMPORT, FROM, AS, GLOBAL,
    TRUE, FALSE, NULL, FN,

    EOF
}
