package com.vnaddress.matching;

import com.vnaddress.gazetteer.AdministrativeUnit;
import com.vnaddress.utils.Utils;

import java.util.regex.Pattern;

/**
 * One alias word of a unit with its search patterns compiled up front.
 */
record AliasPattern(AdministrativeUnit unit, String alias, Pattern plain, Pattern anchored) {

    static AliasPattern compile(AdministrativeUnit unit, String alias, String specialEnding) {
        String quoted = Pattern.quote(alias);
        return new AliasPattern(unit, alias, Pattern.compile(quoted), Pattern.compile(quoted + specialEnding));
    }

    /**
     * Start of the last occurrence of the alias in {@code address} under the given mode, or -1.
     */
    int lastIndexIn(String address, MatchMode mode) {
        switch (mode) {
            case SUBSTRING:
                return address.lastIndexOf(alias);
            case PLAIN:
                return Utils.lastIndexOf(plain, address);
            default:
                return Utils.lastIndexOf(anchored, address);
        }
    }

    /**
     * How an alias is looked up in the address at a given stage.
     */
    enum MatchMode {
        /** literal substring, greatest start index */
        SUBSTRING,
        /** last non-overlapping regex match of the alias */
        PLAIN,
        /** like PLAIN, but the alias must be followed by the special-ending class */
        ANCHORED
    }
}
