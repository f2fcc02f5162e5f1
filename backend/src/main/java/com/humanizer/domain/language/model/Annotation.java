package com.humanizer.domain.language.model;

import java.util.List;
import java.util.Optional;

/**
 * Linguistic annotation of one sentence.
 */
public record Annotation(
        String sentence,
        List<Token> tokens,
        List<EntitySpan> entities
) {

    public Optional<Token> root() {
        return tokens.stream().filter(t -> t.depRole() == DependencyRole.ROOT).findFirst();
    }

    public Optional<Token> subject() {
        return tokens.stream().filter(t -> t.depRole() == DependencyRole.NSUBJ).findFirst();
    }

    public List<Token> words() {
        return tokens.stream().filter(Token::isWord).toList();
    }

    public int wordCount() {
        return words().size();
    }

    public Optional<Token> firstWord() {
        return tokens.stream().filter(Token::isWord).findFirst();
    }

    public Token previous(Token token) {
        return token.index() > 0 ? tokens.get(token.index() - 1) : null;
    }

    public Token next(Token token) {
        return token.index() + 1 < tokens.size() ? tokens.get(token.index() + 1) : null;
    }
}
