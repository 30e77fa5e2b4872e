package com.vnaddress.processing;

import com.vnaddress.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Canonicalizes free-text Vietnamese addresses so that gazetteer aliases can be found by
 * literal and regex matching.
 *
 * <p>The steps run in a fixed order and each one sees the output of the previous one.
 * Punctuation removal can join tokens that the city synonym, district and ward number rules
 * did not see the first time, so those rules run again at the end.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class AddressNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(AddressNormalizer.class);

    private static final Pattern DISTRICT_NUMBER = Pattern.compile("\\b(q|quan)\\s*(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISTRICT_LEADING_ZEROS = Pattern.compile("\\bQ0+(\\d+)\\b");

    private static final Pattern WARD_NUMBER = Pattern.compile("\\b(p|phuong)\\s*(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    // "F" is a colloquial spelling of "P" in ward numbers (F1 = P1)
    private static final Pattern WARD_F_NUMBER = Pattern.compile("\\b[Ff](\\d+)\\b");
    private static final Pattern WARD_LEADING_ZEROS = Pattern.compile("\\bP0+(\\d+)\\b");

    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern INNER_SEPARATORS = Pattern.compile("[._-]");

    private final NormalizationDictionaries dictionaries;

    public AddressNormalizer() {
        this(NormalizationDictionaries.loadDefault());
    }

    public AddressNormalizer(NormalizationDictionaries dictionaries) {
        if (dictionaries == null) {
            throw new IllegalArgumentException("Normalization dictionaries must not be null");
        }
        this.dictionaries = dictionaries;
    }

    /**
     * Runs the full cleanup pipeline.
     *
     * @param address raw address text
     * @return the canonical form, empty for blank input
     * @throws InvalidAddressInputException if {@code address} is null
     */
    public String normalize(String address) {
        if (address == null) {
            throw new InvalidAddressInputException("The address must be a string");
        }

        String text = Utils.initCapWords(address);
        text = Utils.removeAccent(text);
        text = cleanAbbreviations(text);
        text = Utils.removeSpareSpace(text);
        text = cleanDistrictNumber(text);
        text = cleanWardNumber(text);
        text = cleanCityDash(text);
        text = removePunctuation(text);
        text = addSpaceSeparator(text);

        // punctuation removal can join "Br-Vt" into the synonym "Brvt"
        text = cleanCityDash(text);
        text = removePunctuation(text);
        text = addSpaceSeparator(text);
        text = cleanDistrictNumber(text);
        text = cleanWardNumber(text);

        logger.trace("Normalized '{}' -> '{}'", address, text);
        return text;
    }

    /**
     * Replaces abbreviated qualifiers ("Tp.", "Q:") with their canonical spelling, then
     * collapses whitespace.
     */
    String cleanAbbreviations(String text) {
        for (NormalizationDictionaries.Replacement replacement : dictionaries.abbreviationReplacements()) {
            text = replacement.apply(text);
        }
        return Utils.removeSpareSpace(text);
    }

    /**
     * "q 1", "Quan 01" become "Q1"; "Q002" becomes "Q2".
     */
    static String cleanDistrictNumber(String text) {
        text = DISTRICT_NUMBER.matcher(text).replaceAll("Q$2");
        return DISTRICT_LEADING_ZEROS.matcher(text).replaceAll("Q$1");
    }

    /**
     * "p 1", "Phuong 01" and "F1" become "P1"; "P002" becomes "P2".
     */
    static String cleanWardNumber(String text) {
        text = WARD_NUMBER.matcher(text).replaceAll("P$2");
        text = WARD_F_NUMBER.matcher(text).replaceAll("P$1");
        return WARD_LEADING_ZEROS.matcher(text).replaceAll("P$1");
    }

    /**
     * Maps merged-city spellings ("Brvt", "Ba Ria-Vung Tau") onto one dash-joined form.
     */
    String cleanCityDash(String text) {
        for (NormalizationDictionaries.Replacement replacement : dictionaries.cityReplacements()) {
            text = replacement.apply(text);
        }
        return text;
    }

    String removePunctuation(String text) {
        Pattern punctuation = dictionaries.punctuationPattern();
        if (punctuation != null) {
            text = punctuation.matcher(text).replaceAll("");
        }
        return Utils.removeSpareSpace(text);
    }

    /**
     * One space after each comma and none before it; dots, dashes and underscores become spaces.
     */
    static String addSpaceSeparator(String text) {
        text = COMMA.matcher(text).replaceAll(", ");
        text = INNER_SEPARATORS.matcher(text).replaceAll(" ");
        text = Utils.removeSpareSpace(text);
        return Utils.initCapWords(text);
    }
}
