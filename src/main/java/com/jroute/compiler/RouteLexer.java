package com.jroute.compiler;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;
import java.util.regex.Pattern;

public class RouteLexer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ImmutableList<Token> tokenize(String input) {
        if (input == null || input.isBlank()) {
            return Lists.immutable.empty();
        }

        MutableList<Token> tokens = Lists.mutable.empty();
        for (String word : WHITESPACE.split(input.trim())) {
            if (!word.isEmpty()) {
                tokens.add(new Token(word.toUpperCase(Locale.ROOT), word, tokens.size()));
            }
        }
        return tokens.toImmutable();
    }
}
