package com.vnaddress.utils;

import org.apache.commons.text.WordUtils;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class Utils {

    // Unicode separators too, OCR output often carries non-breaking spaces
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}");

    // Vietnamese letters that survive NFD decomposition, or appear precomposed in OCR output
    private static final Map<String, String> VIETNAMESE_BASE_LETTERS = Map.ofEntries(
        Map.entry("a", "àáạảãâầấậẩẫăằắặẳẵ"),
        Map.entry("A", "ÀÁẠẢÃĂẰẮẶẲẴÂẦẤẬẨẪ"),
        Map.entry("e", "èéẹẻẽêềếệểễ"),
        Map.entry("E", "ÈÉẸẺẼÊỀẾỆỂỄ"),
        Map.entry("o", "òóọỏõôồốộổỗơờớợởỡ"),
        Map.entry("O", "ÒÓỌỎÕÔỒỐỘỔỖƠỜỚỢỞỠ"),
        Map.entry("i", "ìíịỉĩ"),
        Map.entry("I", "ÌÍỊỈĨ"),
        Map.entry("u", "ùúụủũưừứựửữ"),
        Map.entry("U", "ƯỪỨỰỬỮÙÚỤỦŨ"),
        Map.entry("y", "ỳýỵỷỹ"),
        Map.entry("Y", "ỲÝỴỶỸ"),
        Map.entry("d", "đ"),
        Map.entry("D", "Đ")
    );

    private static final Map<Character, Character> ACCENTED_TO_BASE = invert(VIETNAMESE_BASE_LETTERS);

    private static Map<Character, Character> invert(Map<String, String> baseToAccented) {
        Map<Character, Character> result = new HashMap<>();
        for (Map.Entry<String, String> entry : baseToAccented.entrySet()) {
            char base = entry.getKey().charAt(0);
            for (char accented : entry.getValue().toCharArray()) {
                result.put(accented, base);
            }
        }
        return Map.copyOf(result);
    }

    /**
     * Capitalizes every whitespace-delimited token: first letter upper case, the rest lower case.
     * Tokens are re-joined with a single space, so leading, trailing and repeated whitespace is dropped.
     *
     * @param text input text, may be empty
     * @return the title-cased text
     */
    public static String initCapWords(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return Arrays.stream(WHITESPACE.split(text))
                .filter(token -> !token.isEmpty())
                .map(WordUtils::capitalizeFully)
                .collect(Collectors.joining(" "));
    }

    /**
     * Upper-cases the first character and lower-cases the rest, keeping any whitespace as is.
     */
    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase() + text.substring(1).toLowerCase();
    }

    /**
     * Removes Vietnamese diacritics. Combining marks are dropped after Unicode decomposition,
     * then letters without a decomposition (đ, Đ) and any remaining precomposed vowels
     * are mapped to their base Latin letter.
     *
     * @param text input text with diacritics
     * @return text with only base letters left
     */
    public static String removeAccent(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String decomposed = normalizeString(text);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (char c : decomposed.toCharArray()) {
            sb.append(ACCENTED_TO_BASE.getOrDefault(c, c));
        }
        return sb.toString();
    }

    /**
     * Normalizes a string by removing diacritical marks using Unicode normalization.
     */
    private static String normalizeString(String input) {
        String normalized = Normalizer.normalize(input, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(normalized).replaceAll("");
    }

    /**
     * Trims the text and collapses every run of whitespace into one space.
     */
    public static String removeSpareSpace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Same whitespace test as the token splitting above, so non-breaking spaces count.
     */
    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * Start index of the last match of {@code pattern} in {@code text}, or -1.
     * Matches are scanned left to right without overlap, so this is the start of the final
     * non-overlapping match rather than the greatest index the pattern could match at.
     */
    public static int lastIndexOf(Pattern pattern, String text) {
        if (pattern == null || text == null) {
            return -1;
        }
        Matcher matcher = pattern.matcher(text);
        int last = -1;
        while (matcher.find()) {
            last = matcher.start();
        }
        return last;
    }

    /**
     * Replaces only the last occurrence of {@code substr} in {@code target}.
     *
     * @return the updated string, or {@code target} unchanged when {@code substr} is empty or absent
     */
    public static String replaceLastOccurrence(String target, String substr, String replacement) {
        if (substr == null || substr.isEmpty()) {
            return target;
        }
        int lastIndex = target.lastIndexOf(substr);
        if (lastIndex == -1) {
            return target;
        }
        return target.substring(0, lastIndex) + replacement + target.substring(lastIndex + substr.length());
    }

    /**
     * Regex fragment matching any one of the given characters literally.
     */
    public static String characterClassOf(Iterable<String> characters) {
        StringBuilder sb = new StringBuilder("[");
        for (String character : characters) {
            for (char c : character.toCharArray()) {
                if (!Character.isLetterOrDigit(c)) {
                    sb.append('\\');
                }
                sb.append(c);
            }
        }
        return sb.append(']').toString();
    }
}
