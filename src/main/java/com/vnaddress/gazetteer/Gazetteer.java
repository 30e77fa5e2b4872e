package com.vnaddress.gazetteer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable three-level reference data: provinces, their districts and the districts' wards.
 *
 * <p>Units keep the order in which they were added. That order is the scan order used by the
 * resolver and therefore decides full ties between equally good alias matches.</p>
 *
 * <p>All structural checks run in {@link Builder#build()}; lookups never throw.</p>
 */
public final class Gazetteer {

    private static final Logger logger = LoggerFactory.getLogger(Gazetteer.class);

    private final Map<String, AdministrativeUnit> provinces;
    private final Map<String, AdministrativeUnit> districts;
    private final Map<String, AdministrativeUnit> wards;

    private final Map<String, List<AdministrativeUnit>> districtsByProvince;
    private final Map<String, List<AdministrativeUnit>> wardsByDistrict;

    private Gazetteer(Map<String, AdministrativeUnit> provinces,
                      Map<String, AdministrativeUnit> districts,
                      Map<String, AdministrativeUnit> wards) {
        this.provinces = Collections.unmodifiableMap(provinces);
        this.districts = Collections.unmodifiableMap(districts);
        this.wards = Collections.unmodifiableMap(wards);
        this.districtsByProvince = groupByParent(provinces, districts);
        this.wardsByDistrict = groupByParent(districts, wards);
    }

    private static Map<String, List<AdministrativeUnit>> groupByParent(Map<String, AdministrativeUnit> parents,
                                                                      Map<String, AdministrativeUnit> children) {
        Map<String, List<AdministrativeUnit>> grouped = new LinkedHashMap<>();
        for (String parentId : parents.keySet()) {
            grouped.put(parentId, new ArrayList<>());
        }
        for (AdministrativeUnit child : children.values()) {
            grouped.get(child.parentId()).add(child);
        }
        grouped.replaceAll((id, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(grouped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AdministrativeUnit> province(String id) {
        return Optional.ofNullable(id == null ? null : provinces.get(id));
    }

    public Optional<AdministrativeUnit> district(String id) {
        return Optional.ofNullable(id == null ? null : districts.get(id));
    }

    public Optional<AdministrativeUnit> ward(String id) {
        return Optional.ofNullable(id == null ? null : wards.get(id));
    }

    public Optional<AdministrativeUnit> unit(AdministrativeLevel level, String id) {
        switch (level) {
            case PROVINCE:
                return province(id);
            case DISTRICT:
                return district(id);
            default:
                return ward(id);
        }
    }

    public List<AdministrativeUnit> provinces() {
        return List.copyOf(provinces.values());
    }

    public List<AdministrativeUnit> districts() {
        return List.copyOf(districts.values());
    }

    public List<AdministrativeUnit> wards() {
        return List.copyOf(wards.values());
    }

    /**
     * Districts owned by the province, in declaration order; empty for an unknown province.
     */
    public List<AdministrativeUnit> districtsOf(String provinceId) {
        return provinceId == null ? List.of() : districtsByProvince.getOrDefault(provinceId, List.of());
    }

    /**
     * Wards owned by the district, in declaration order; empty for an unknown district.
     */
    public List<AdministrativeUnit> wardsOf(String districtId) {
        return districtId == null ? List.of() : wardsByDistrict.getOrDefault(districtId, List.of());
    }

    public int provinceCount() {
        return provinces.size();
    }

    public int districtCount() {
        return districts.size();
    }

    public int wardCount() {
        return wards.size();
    }

    public String getStatistics() {
        return String.format("Gazetteer Statistics: %d provinces, %d districts, %d wards",
                provinces.size(), districts.size(), wards.size());
    }

    /**
     * Collects units in any order and validates the tree once everything is known.
     * Not thread-safe; the built {@link Gazetteer} is.
     */
    public static final class Builder {

        private final Map<String, AdministrativeUnit> provinces = new LinkedHashMap<>();
        private final Map<String, AdministrativeUnit> districts = new LinkedHashMap<>();
        private final Map<String, AdministrativeUnit> wards = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder province(String id, String name, List<String> aliasWords) {
            return add(AdministrativeUnit.province(id, name, aliasWords));
        }

        public Builder district(String id, String name, String provinceId, List<String> aliasWords) {
            return add(AdministrativeUnit.district(id, name, provinceId, aliasWords));
        }

        public Builder ward(String id, String name, String districtId, List<String> aliasWords) {
            return add(AdministrativeUnit.ward(id, name, districtId, aliasWords));
        }

        public Builder add(AdministrativeUnit unit) {
            if (unit == null) {
                throw new GazetteerException("Administrative unit must not be null");
            }
            if (unit.id() == null || unit.id().isBlank()) {
                throw new GazetteerException("Blank id for " + unit.level() + " '" + unit.name() + "'");
            }
            if (unit.name() == null || unit.name().isBlank()) {
                throw new GazetteerException("Blank name for " + unit.level() + " " + unit.id());
            }
            Map<String, AdministrativeUnit> target = unitsOf(unit.level());
            if (target.containsKey(unit.id())) {
                throw new GazetteerException("Duplicate " + unit.level() + " id " + unit.id());
            }
            target.put(unit.id(), unit);
            return this;
        }

        private Map<String, AdministrativeUnit> unitsOf(AdministrativeLevel level) {
            switch (level) {
                case PROVINCE:
                    return provinces;
                case DISTRICT:
                    return districts;
                default:
                    return wards;
            }
        }

        /**
         * @throws GazetteerException if a province has a parent, or a district or ward points at a
         *                            parent that does not exist
         */
        public Gazetteer build() {
            for (AdministrativeUnit province : provinces.values()) {
                if (province.parentId() != null) {
                    throw new GazetteerException("Province " + province.id() + " must not have a parent");
                }
            }
            checkParents(districts, provinces);
            checkParents(wards, districts);

            warnUnmatchable(provinces);
            warnUnmatchable(districts);
            warnUnmatchable(wards);

            Gazetteer gazetteer = new Gazetteer(new LinkedHashMap<>(provinces),
                    new LinkedHashMap<>(districts), new LinkedHashMap<>(wards));
            logger.info("Built gazetteer with {} provinces, {} districts and {} wards",
                    gazetteer.provinceCount(), gazetteer.districtCount(), gazetteer.wardCount());
            return gazetteer;
        }

        private static void checkParents(Map<String, AdministrativeUnit> children,
                                         Map<String, AdministrativeUnit> parents) {
            for (AdministrativeUnit child : children.values()) {
                if (child.parentId() == null || !parents.containsKey(child.parentId())) {
                    throw new GazetteerException(child.level() + " " + child.id() + " refers to unknown "
                            + child.level().parentLevel() + " " + child.parentId());
                }
            }
        }

        private static void warnUnmatchable(Map<String, AdministrativeUnit> units) {
            for (AdministrativeUnit unit : units.values()) {
                if (!unit.isMatchable()) {
                    logger.warn("{} {} ({}) has no alias words and can never be matched",
                            unit.level(), unit.id(), unit.name());
                }
            }
        }
    }
}
