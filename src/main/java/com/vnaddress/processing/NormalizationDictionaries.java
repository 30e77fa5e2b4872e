package com.vnaddress.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vnaddress.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable lookup tables used by {@link AddressNormalizer}: abbreviation variants,
 * merged-city synonyms and the punctuation set. All patterns are compiled once here.
 */
public class NormalizationDictionaries {

    private static final Logger logger = LoggerFactory.getLogger(NormalizationDictionaries.class);

    public static final String DEFAULT_RESOURCE = "/normalization-dictionaries.json";

    // Whole-word guards that also work when a variant starts or ends with punctuation
    private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}])";

    /**
     * A compiled dictionary entry: every match of {@code pattern} is replaced by {@code replacement}.
     */
    public record Replacement(Pattern pattern, String replacement) {

        String apply(String text) {
            return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
        }
    }

    private final Map<String, List<String>> abbreviations;
    private final Map<String, List<String>> citySynonyms;
    private final List<String> punctuations;

    private final List<Replacement> abbreviationReplacements;
    private final List<Replacement> cityReplacements;
    private final Pattern punctuationPattern;

    private NormalizationDictionaries(Map<String, List<String>> abbreviations,
                                      Map<String, List<String>> citySynonyms,
                                      List<String> punctuations) {
        this.abbreviations = copyOf(abbreviations, "abbreviations");
        this.citySynonyms = copyOf(citySynonyms, "citySynonyms");
        this.punctuations = List.copyOf(punctuations);

        this.abbreviationReplacements = this.abbreviations.entrySet().stream()
                .map(e -> new Replacement(
                        Pattern.compile(WORD_START + alternation(e.getValue()),
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                        Utils.capitalize(e.getKey())))
                .collect(Collectors.toUnmodifiableList());

        this.cityReplacements = this.citySynonyms.entrySet().stream()
                .map(e -> new Replacement(
                        Pattern.compile(WORD_START + alternation(e.getValue()) + WORD_END,
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                        e.getKey()))
                .collect(Collectors.toUnmodifiableList());

        this.punctuationPattern = this.punctuations.isEmpty()
                ? null
                : Pattern.compile(Utils.characterClassOf(this.punctuations));
    }

    public static NormalizationDictionaries of(Map<String, List<String>> abbreviations,
                                               Map<String, List<String>> citySynonyms,
                                               List<String> punctuations) {
        if (abbreviations == null || citySynonyms == null || punctuations == null) {
            throw new IllegalArgumentException("Normalization dictionaries must not be null");
        }
        for (String punctuation : punctuations) {
            if (punctuation == null || punctuation.isEmpty()) {
                throw new IllegalArgumentException("Punctuation entries must not be empty");
            }
        }
        return new NormalizationDictionaries(abbreviations, citySynonyms, punctuations);
    }

    /**
     * Loads the dictionaries bundled with the library from {@value #DEFAULT_RESOURCE}.
     */
    public static NormalizationDictionaries loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads dictionaries from a JSON classpath resource with the keys
     * {@code abbreviations}, {@code citySynonyms} and {@code punctuations}.
     */
    public static NormalizationDictionaries load(String resourcePath) {
        ObjectMapper objectMapper = new ObjectMapper();

        try (InputStream is = NormalizationDictionaries.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Normalization dictionaries not found: " + resourcePath);
            }
            JsonNode rootNode = objectMapper.readTree(is);

            Map<String, List<String>> abbreviations = readSynonymTable(rootNode, "abbreviations");
            Map<String, List<String>> citySynonyms = readSynonymTable(rootNode, "citySynonyms");
            List<String> punctuations = new ArrayList<>();
            JsonNode punctuationNode = rootNode.path("punctuations");
            for (JsonNode node : punctuationNode) {
                punctuations.add(node.asText());
            }

            logger.info("Loaded {} abbreviations, {} city synonym groups and {} punctuation marks from {}",
                    abbreviations.size(), citySynonyms.size(), punctuations.size(), resourcePath);

            return of(abbreviations, citySynonyms, punctuations);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load normalization dictionaries from " + resourcePath, e);
        }
    }

    private static Map<String, List<String>> readSynonymTable(JsonNode rootNode, String field) {
        JsonNode tableNode = rootNode.get(field);
        if (tableNode == null || !tableNode.isObject()) {
            throw new IllegalArgumentException("Missing or malformed '" + field + "' table");
        }
        Map<String, List<String>> table = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tableNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isArray()) {
                throw new IllegalArgumentException("Variants of '" + entry.getKey() + "' in '" + field + "' must be an array");
            }
            List<String> variants = new ArrayList<>();
            for (JsonNode variant : entry.getValue()) {
                variants.add(variant.asText());
            }
            table.put(entry.getKey(), variants);
        }
        return table;
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> table, String name) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Blank canonical form in '" + name + "'");
            }
            List<String> variants = entry.getValue();
            if (variants == null || variants.isEmpty()) {
                throw new IllegalArgumentException("No variants for '" + entry.getKey() + "' in '" + name + "'");
            }
            for (String variant : variants) {
                if (variant == null || variant.isBlank()) {
                    throw new IllegalArgumentException("Blank variant for '" + entry.getKey() + "' in '" + name + "'");
                }
            }
            copy.put(entry.getKey(), List.copyOf(variants));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static String alternation(List<String> variants) {
        return variants.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|", "(?:", ")"));
    }

    public Map<String, List<String>> getAbbreviations() {
        return abbreviations;
    }

    public Map<String, List<String>> getCitySynonyms() {
        return citySynonyms;
    }

    public List<String> getPunctuations() {
        return punctuations;
    }

    List<Replacement> abbreviationReplacements() {
        return abbreviationReplacements;
    }

    List<Replacement> cityReplacements() {
        return cityReplacements;
    }

    /**
     * Pattern matching a single punctuation mark, or {@code null} when the set is empty.
     */
    Pattern punctuationPattern() {
        return punctuationPattern;
    }
}
