package com.vnaddress.gazetteer;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * A province, district or ward of the gazetteer.
 *
 * @param id         identifier, unique within its level
 * @param level      which of the three levels this unit belongs to
 * @param name       canonical display name
 * @param aliasWords surface forms that identify the unit in normalized address text, in declared order
 * @param parentId   owning province id for districts, owning district id for wards, {@code null} for provinces
 */
public record AdministrativeUnit(String id,
                                 AdministrativeLevel level,
                                 String name,
                                 List<String> aliasWords,
                                 String parentId) {

    public AdministrativeUnit {
        if (level == null) {
            throw new GazetteerException("Administrative level is required for unit " + id);
        }
        if (aliasWords == null) {
            aliasWords = List.of();
        }
        for (String aliasWord : aliasWords) {
            if (aliasWord == null || aliasWord.isBlank()) {
                throw new GazetteerException("Blank alias word for " + level + " " + id);
            }
        }
        // duplicates dropped, first declaration keeps its position
        aliasWords = List.copyOf(new LinkedHashSet<>(aliasWords));
    }

    public static AdministrativeUnit province(String id, String name, List<String> aliasWords) {
        return new AdministrativeUnit(id, AdministrativeLevel.PROVINCE, name, aliasWords, null);
    }

    public static AdministrativeUnit district(String id, String name, String provinceId, List<String> aliasWords) {
        return new AdministrativeUnit(id, AdministrativeLevel.DISTRICT, name, aliasWords, provinceId);
    }

    public static AdministrativeUnit ward(String id, String name, String districtId, List<String> aliasWords) {
        return new AdministrativeUnit(id, AdministrativeLevel.WARD, name, aliasWords, districtId);
    }

    public boolean isMatchable() {
        return !aliasWords.isEmpty();
    }

    @Override
    public String toString() {
        return level + "[" + id + "] " + name + " " + aliasWords;
    }
}
