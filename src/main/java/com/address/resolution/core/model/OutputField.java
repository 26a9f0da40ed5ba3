package com.address.resolution.core.model;

import java.util.List;

/**
 * Schema of the flat output record: one entry per extracted column, giving the
 * premises address it is read from and the key path inside it. Every field
 * defaults to the empty string when its path is absent.
 */
public enum OutputField {
    CHI_REGION("CHI_Region", Language.CHINESE, "Region"),
    CHI_DISTRICT("chi_district", Language.CHINESE, "ChiDistrict", "DcDistrict"),
    CHI_ESTATE("chi_estate", Language.CHINESE, "ChiEstate", "EstateName"),
    CHI_BUILDING_NAME("OGCIO_CHI_BuildingName", Language.CHINESE, "BuildingName"),
    CHI_STREET_NAME("OGCIO_CHI_StreetName", Language.CHINESE, "ChiStreet", "StreetName"),
    CHI_BUILDING_NO("OGCIO_CHI_BuildingNo", Language.CHINESE, "ChiStreet", "BuildingNoFrom"),
    CHI_BLOCK("OGCIO_CHI_Block", Language.CHINESE, "ChiBlock", "BlockNo"),
    ENG_REGION("OGCIO_ENG_Region", Language.ENGLISH, "Region"),
    ENG_DISTRICT("OGCIO_ENG_District", Language.ENGLISH, "EngDistrict", "DcDistrict"),
    ENG_ESTATE("OGCIO_ENG_Estate", Language.ENGLISH, "EngEstate", "EstateName"),
    ENG_BUILDING_NAME("OGCIO_ENG_BuildingName", Language.ENGLISH, "BuildingName"),
    ENG_STREET_NAME("OGCIO_ENG_StreetName", Language.ENGLISH, "EngStreet", "StreetName"),
    ENG_BUILDING_NO("OGCIO_ENG_BuildingNo", Language.ENGLISH, "EngStreet", "BuildingNoFrom"),
    ENG_BLOCK("OGCIO_ENG_Block", Language.ENGLISH, "EngBlock", "BlockNo");

    public static final String DEFAULT_VALUE = "";

    private final String column;
    private final Language language;
    private final List<String> path;

    OutputField(String column, Language language, String... path) {
        this.column = column;
        this.language = language;
        this.path = List.of(path);
    }

    public String column() {
        return column;
    }

    public Language language() {
        return language;
    }

    public List<String> path() {
        return path;
    }
}
