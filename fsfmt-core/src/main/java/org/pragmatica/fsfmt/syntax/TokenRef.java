package org.pragmatica.fsfmt.syntax;

/**
 * Position of a keyword or punctuation token kept by a syntax node so that trivia
 * attached to the token can be printed next to it.
 */
public record TokenRef(TokenKind kind, SourceRange range) {}
