package com.vnaddress.matching;

import com.vnaddress.gazetteer.AdministrativeUnit;

/**
 * The winning alias of one resolution stage.
 *
 * @param unit  the matched unit
 * @param alias the alias word that was found
 * @param index start of its last occurrence in the address
 */
public record LevelMatch(AdministrativeUnit unit, String alias, int index) {

    /**
     * Rightmost occurrence wins; at the same position the longer alias wins.
     * Anything else keeps the incumbent, so the first candidate scanned wins a full tie.
     */
    boolean beats(LevelMatch incumbent) {
        if (incumbent == null) {
            return true;
        }
        if (index != incumbent.index) {
            return index > incumbent.index;
        }
        return alias.length() > incumbent.alias.length();
    }
}
