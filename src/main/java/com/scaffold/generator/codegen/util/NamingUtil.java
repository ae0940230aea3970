package com.scaffold.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case conversions between snake_case, PascalCase and kebab-case, plus
 * identifier validation for entity and field names.
 */
public class NamingUtil {

    private static final Pattern SEPARATORS = Pattern.compile("[\\-\\s]+");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z\\d])([A-Z])");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts PascalCase, camelCase, kebab-case or space separated text to snake_case.
     * "HTTPServer" becomes "http_server", "UserProfile" becomes "user_profile".
     */
    public static String toSnakeCase(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = SEPARATORS.matcher(text).replaceAll("_");
        result = ACRONYM_BOUNDARY.matcher(result).replaceAll("$1_$2");
        result = WORD_BOUNDARY.matcher(result).replaceAll("$1_$2");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Converts any supported input to PascalCase. Word boundaries are taken
     * from the snake_case form, so "userProfile" and "user-profile" both give
     * "UserProfile" and "HTTP server" gives "HttpServer".
     */
    public static String toPascalCase(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return Arrays.stream(toSnakeCase(text).split("_+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts any supported input to kebab-case.
     */
    public static String toKebabCase(String text) {
        String snake = toSnakeCase(text);
        return snake == null ? null : snake.replace('_', '-');
    }

    /**
     * True when the name starts with an ASCII letter followed only by letters,
     * digits or underscores.
     */
    public static boolean validateIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
