package com.openapi.simpleSDK.generator.parsing;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns arbitrary OpenAPI names into valid Python identifiers for generated classes, modules,
 * methods and enum members.
 */
public final class NameSanitizer {
    private static final Set<String> PYTHON_KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_TO_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_+");

    private NameSanitizer() {
    }

    /** {@code "user profile-data"} becomes {@code UserProfileData}. */
    public static String sanitizeClassName(String raw) {
        if (raw == null || raw.isBlank()) {
            return "UnnamedSchema";
        }
        StringBuilder builder = new StringBuilder();
        for (String part : NON_ALPHANUMERIC.split(raw)) {
            if (!part.isEmpty()) {
                builder.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        if (builder.length() == 0) {
            return "UnnamedSchema";
        }
        if (Character.isDigit(builder.charAt(0))) {
            builder.insert(0, '_');
        }
        String name = builder.toString();
        return PYTHON_KEYWORDS.contains(name) ? name + "_" : name;
    }

    /** {@code HTTPResponseData} becomes {@code http_response_data}. */
    public static String sanitizeModuleName(String raw) {
        String snake = toSnakeCase(raw);
        if (snake.isEmpty()) {
            return "unnamed";
        }
        if (Character.isDigit(snake.charAt(0))) {
            snake = "_" + snake;
        }
        return PYTHON_KEYWORDS.contains(snake) ? snake + "_" : snake;
    }

    /** {@code GET_/pets/{petId}} becomes {@code get_pets_pet_id}. */
    public static String sanitizeMethodName(String raw) {
        String snake = toSnakeCase(raw);
        if (snake.isEmpty()) {
            return "operation";
        }
        if (Character.isDigit(snake.charAt(0))) {
            snake = "op_" + snake;
        }
        return PYTHON_KEYWORDS.contains(snake) ? snake + "_" : snake;
    }

    /** {@code "in-progress"} becomes {@code IN_PROGRESS}; null becomes {@code NONE}. */
    public static String sanitizeEnumMemberName(Object value) {
        if (value == null) {
            return "NONE";
        }
        String snake = toSnakeCase(String.valueOf(value)).toUpperCase(Locale.ROOT);
        if (snake.isEmpty()) {
            return "EMPTY";
        }
        if (Character.isDigit(snake.charAt(0))) {
            return "VALUE_" + snake;
        }
        return snake;
    }

    /** Upper-cases the first character only. */
    public static String capitalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        return Character.toUpperCase(raw.charAt(0)) + raw.substring(1);
    }

    static String toSnakeCase(String raw) {
        if (raw == null) {
            return "";
        }
        String spaced = ACRONYM_TO_WORD.matcher(raw).replaceAll("$1_$2");
        spaced = LOWER_TO_UPPER.matcher(spaced).replaceAll("$1_$2");
        String snake = NON_ALPHANUMERIC.matcher(spaced).replaceAll("_");
        snake = REPEATED_UNDERSCORE.matcher(snake).replaceAll("_");
        int start = 0;
        int end = snake.length();
        while (start < end && snake.charAt(start) == '_') {
            start++;
        }
        while (end > start && snake.charAt(end - 1) == '_') {
            end--;
        }
        return snake.substring(start, end).toLowerCase(Locale.ROOT);
    }
}
