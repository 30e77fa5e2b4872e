package com.vnaddress.matching;

import com.vnaddress.gazetteer.AdministrativeUnit;
import com.vnaddress.gazetteer.Gazetteer;
import com.vnaddress.matching.AliasPattern.MatchMode;
import com.vnaddress.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the province, district and ward named in a normalized address.
 *
 * <p>Each stage looks for the candidate alias whose last occurrence starts furthest to the
 * right, preferring the longer alias at equal positions; a full tie goes to the unit declared
 * first in the gazetteer. The winning occurrence is cut out of the address before the next
 * stage runs.</p>
 * <ul>
 *     <li>Province: every province, literal substring search.</li>
 *     <li>District: the resolved province's districts with the special-ending anchor; without a
 *     province, every district without the anchor, and the province is taken from the match.</li>
 *     <li>Ward: the resolved district's wards with the anchor; skipped without a district.</li>
 * </ul>
 * A stage that finds nothing leaves its level empty. Earlier decisions are never revisited.
 */
public class HierarchicalResolver {

    private static final Logger logger = LoggerFactory.getLogger(HierarchicalResolver.class);

    private final Gazetteer gazetteer;
    private final ResolverSettings settings;

    // unit id -> compiled aliases, one map per level since ids are only unique within a level
    private final Map<String, List<AliasPattern>> provinceAliases;
    private final Map<String, List<AliasPattern>> districtAliases;
    private final Map<String, List<AliasPattern>> wardAliases;

    public HierarchicalResolver(Gazetteer gazetteer) {
        this(gazetteer, ResolverSettings.defaults());
    }

    public HierarchicalResolver(Gazetteer gazetteer, ResolverSettings settings) {
        if (gazetteer == null || settings == null) {
            throw new IllegalArgumentException("Gazetteer and resolver settings are required");
        }
        this.gazetteer = gazetteer;
        this.settings = settings;
        this.provinceAliases = compile(gazetteer.provinces());
        this.districtAliases = compile(gazetteer.districts());
        this.wardAliases = compile(gazetteer.wards());
        logger.debug("Compiled alias patterns for {}", gazetteer.getStatistics());
    }

    private Map<String, List<AliasPattern>> compile(List<AdministrativeUnit> units) {
        Map<String, List<AliasPattern>> compiled = new HashMap<>();
        for (AdministrativeUnit unit : units) {
            List<AliasPattern> patterns = new ArrayList<>(unit.aliasWords().size());
            for (String alias : unit.aliasWords()) {
                patterns.add(AliasPattern.compile(unit, alias, settings.specialEnding()));
            }
            compiled.put(unit.id(), List.copyOf(patterns));
        }
        return Collections.unmodifiableMap(compiled);
    }

    /**
     * Resolves an address that has already been through
     * {@link com.vnaddress.processing.AddressNormalizer}.
     *
     * @param normalizedAddress canonical address text
     * @return the resolved levels and the leftover text; never null
     */
    public ResolutionResult resolve(String normalizedAddress) {
        String address = (normalizedAddress == null ? "" : normalizedAddress) + settings.sentinel();

        LevelMatch provinceMatch = findBest(gazetteer.provinces(), provinceAliases, address, MatchMode.SUBSTRING);
        AdministrativeUnit province = null;
        if (provinceMatch != null) {
            province = provinceMatch.unit();
            address = Utils.replaceLastOccurrence(address, provinceMatch.alias(), "");
            logger.debug("Province '{}' matched alias '{}' at {}", province.name(), provinceMatch.alias(), provinceMatch.index());
        }
        address = stripDanglingQualifier(address);

        LevelMatch districtMatch;
        if (province != null) {
            districtMatch = findBest(gazetteer.districtsOf(province.id()), districtAliases, address, MatchMode.ANCHORED);
        } else {
            districtMatch = findBest(gazetteer.districts(), districtAliases, address, MatchMode.PLAIN);
        }

        AdministrativeUnit district = null;
        if (districtMatch != null) {
            district = districtMatch.unit();
            // removes the last plain occurrence of the alias, which may differ from the anchored match
            address = Utils.replaceLastOccurrence(address, districtMatch.alias(), "");
            logger.debug("District '{}' matched alias '{}' at {}", district.name(), districtMatch.alias(), districtMatch.index());
            if (province == null) {
                province = gazetteer.province(district.parentId()).orElse(null);
                logger.debug("Province '{}' inferred from district '{}'",
                        province == null ? "" : province.name(), district.name());
            }
        }

        AdministrativeUnit ward = null;
        if (district != null) {
            LevelMatch wardMatch = findBest(gazetteer.wardsOf(district.id()), wardAliases, address, MatchMode.ANCHORED);
            if (wardMatch != null) {
                ward = wardMatch.unit();
                address = Utils.replaceLastOccurrence(address, wardMatch.alias(), "");
                logger.debug("Ward '{}' matched alias '{}' at {}", ward.name(), wardMatch.alias(), wardMatch.index());
            }
        }

        return ResolutionResult.assemble(address, settings.sentinel(), province, district, ward);
    }

    /**
     * Applies the rightmost-then-longest rule over all aliases of the candidates.
     *
     * @return the winning alias, or {@code null} when no alias occurs in the address
     */
    LevelMatch findBest(List<AdministrativeUnit> candidates,
                        Map<String, List<AliasPattern>> aliases,
                        String address,
                        MatchMode mode) {
        LevelMatch best = null;
        for (AdministrativeUnit candidate : candidates) {
            for (AliasPattern alias : aliases.getOrDefault(candidate.id(), List.of())) {
                int index = alias.lastIndexIn(address, mode);
                if (index < 0) {
                    continue;
                }
                LevelMatch match = new LevelMatch(candidate, alias.alias(), index);
                if (match.beats(best)) {
                    best = match;
                }
            }
        }
        return best;
    }

    /**
     * Removes a generic city qualifier ("Thanh Pho") that the province match left at the very end,
     * keeping the sentinel in place.
     */
    String stripDanglingQualifier(String address) {
        String sentinel = settings.sentinel();
        for (String qualifier : settings.danglingQualifiers()) {
            String fragment = qualifier + " " + sentinel;
            if (!address.endsWith(fragment)) {
                continue;
            }
            int start = address.length() - fragment.length();
            if (start == 0 || Utils.isWhitespace(address.charAt(start - 1))) {
                logger.trace("Stripped dangling qualifier '{}'", qualifier);
                return address.substring(0, start) + sentinel;
            }
        }
        return address;
    }
}
