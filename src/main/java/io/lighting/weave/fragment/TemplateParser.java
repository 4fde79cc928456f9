package io.lighting.weave.fragment;

import java.util.ArrayList;
import java.util.List;

final class TemplateParser {
    private final String input;
    private int index;
    private int positionalCount;

    TemplateParser(String input) {
        this.input = input;
    }

    private List<TemplateToken> parseTokens() {
        List<TemplateToken> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == '{') {
                if (peekNext() == '{') {
                    text.append('{');
                    index += 2;
                    continue;
                }
                flushText(text, tokens);
                tokens.add(parseMarker());
                continue;
            }
            if (ch == '}') {
                if (peekNext() == '}') {
                    text.append('}');
                    index += 2;
                    continue;
                }
                throw new TemplateSyntaxException("Single '}' encountered in template", index);
            }
            text.append(ch);
            index++;
        }
        flushText(text, tokens);
        return tokens;
    }

    List<TemplateToken> parse(int positionalArguments) {
        List<TemplateToken> tokens = parseTokens();
        if (positionalCount != positionalArguments) {
            throw new ArityMismatchException(
                "Positional argument count does not match '{}' markers",
                positionalCount,
                positionalArguments
            );
        }
        return tokens;
    }

    private TemplateToken parseMarker() {
        int start = index;
        expect('{');
        if (peek() == '}') {
            index++;
            return new PositionalToken(positionalCount++);
        }
        if (isAtEnd()) {
            throw new TemplateSyntaxException("Expected '}' before end of template", start);
        }
        String name = parseIdentifier();
        if (isAtEnd()) {
            throw new TemplateSyntaxException("Expected '}' before end of template", start);
        }
        if (peek() != '}') {
            throw new TemplateSyntaxException("Invalid reference name in marker", start);
        }
        index++;
        return new NamedToken(name);
    }

    private String parseIdentifier() {
        if (!isIdentifierStart(peek())) {
            throw new TemplateSyntaxException("Invalid reference name in marker", index - 1);
        }
        int start = index;
        index++;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            index++;
        }
        return input.substring(start, index);
    }

    private void flushText(StringBuilder text, List<TemplateToken> tokens) {
        if (text.length() > 0) {
            tokens.add(new TextToken(text.toString()));
            text.setLength(0);
        }
    }

    private void expect(char ch) {
        if (peek() != ch) {
            throw new TemplateSyntaxException("Expected '" + ch + "'", index);
        }
        index++;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return input.charAt(index);
    }

    private char peekNext() {
        if (index + 1 >= input.length()) {
            return '\0';
        }
        return input.charAt(index + 1);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }

    static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || !isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIdentifierStart(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || (ch >= '0' && ch <= '9');
    }
}
