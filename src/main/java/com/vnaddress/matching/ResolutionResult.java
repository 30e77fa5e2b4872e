package com.vnaddress.matching;

import com.vnaddress.gazetteer.AdministrativeLevel;
import com.vnaddress.gazetteer.AdministrativeUnit;
import com.vnaddress.utils.Utils;

import java.util.regex.Pattern;

/**
 * Outcome of resolving one address. Names are canonical gazetteer names, or empty strings
 * for levels that could not be resolved; ids are {@code null} in that case.
 *
 * @param remainder  address text left over once the matched aliases are removed
 * @param province   canonical province name
 * @param district   canonical district name
 * @param ward       canonical ward name
 * @param provinceId id of the resolved province
 * @param districtId id of the resolved district
 * @param wardId     id of the resolved ward
 */
public record ResolutionResult(String remainder,
                               String province,
                               String district,
                               String ward,
                               String provinceId,
                               String districtId,
                               String wardId) {

    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("\\s+,");
    private static final Pattern REPEATED_COMMAS = Pattern.compile(",(\\s*,)+");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s,]+|[\\s,]+$");

    /**
     * Builds the result from the resolver's leftover text, which still carries the sentinel.
     */
    static ResolutionResult assemble(String leftover, String sentinel,
                                     AdministrativeUnit province,
                                     AdministrativeUnit district,
                                     AdministrativeUnit ward) {
        return new ResolutionResult(cleanRemainder(leftover, sentinel),
                nameOf(province), nameOf(district), nameOf(ward),
                idOf(province), idOf(district), idOf(ward));
    }

    static String cleanRemainder(String leftover, String sentinel) {
        String text = leftover.endsWith(sentinel)
                ? leftover.substring(0, leftover.length() - sentinel.length())
                : leftover;
        text = Utils.removeSpareSpace(text);
        text = SPACE_BEFORE_COMMA.matcher(text).replaceAll(",");
        text = REPEATED_COMMAS.matcher(text).replaceAll(",");
        return EDGE_SEPARATORS.matcher(text).replaceAll("");
    }

    private static String nameOf(AdministrativeUnit unit) {
        return unit == null ? "" : unit.name();
    }

    private static String idOf(AdministrativeUnit unit) {
        return unit == null ? null : unit.id();
    }

    public boolean isResolved(AdministrativeLevel level) {
        switch (level) {
            case PROVINCE:
                return provinceId != null;
            case DISTRICT:
                return districtId != null;
            default:
                return wardId != null;
        }
    }

    /**
     * {@code <remainder> <ward>, <district>, <province>}. Unresolved levels leave their segment
     * blank; the separators are always present.
     */
    public String format() {
        return remainder + " " + ward + ", " + district + ", " + province;
    }
}
