package com.vnaddress.gazetteer;

/**
 * The three levels of the Vietnamese administrative hierarchy, from the most general.
 */
public enum AdministrativeLevel {
    PROVINCE,
    DISTRICT,
    WARD;

    /**
     * The level a unit of this level hangs under, or {@code null} for provinces.
     */
    public AdministrativeLevel parentLevel() {
        switch (this) {
            case DISTRICT:
                return PROVINCE;
            case WARD:
                return DISTRICT;
            default:
                return null;
        }
    }
}
