package com.stitchwork.core.validation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Cheap structural check: (), [] and {} must be balanced and properly nested.
 * Delimiters inside single- or double-quoted string literals are ignored.
 */
public class BalancedDelimiterValidator implements StructuralValidator {

    @Override
    public ValidationResult validate(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        Deque<int[]> open = new ArrayDeque<>();
        var diagnostics = new ArrayList<String>();
        char quote = 0;
        int line = 1;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
            }
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> open.push(new int[]{c, line});
                case ')', ']', '}' -> {
                    if (open.isEmpty()) {
                        diagnostics.add("line " + line + ": unexpected '" + c + "'");
                    } else {
                        int[] top = open.pop();
                        if (top[0] != opening(c)) {
                            diagnostics.add("line " + line + ": '" + c + "' closes '" + (char) top[0]
                                    + "' opened on line " + top[1]);
                        }
                    }
                }
                default -> { }
            }
        }
        while (!open.isEmpty()) {
            int[] top = open.pop();
            diagnostics.add("line " + top[1] + ": unclosed '" + (char) top[0] + "'");
        }
        return diagnostics.isEmpty() ? ValidationResult.ok() : new ValidationResult(false, diagnostics);
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }
}
