package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Regional context of a simulated query. The search hint is appended to the query text
 * so grounded engines favour results from that market; {@link #GLOBAL} adds nothing.
 */
public enum Region {
    GLOBAL("global", "Global", ""),
    US("us", "United States", "in the United States"),
    UK("uk", "United Kingdom", "in the United Kingdom"),
    AE("ae", "UAE", "in UAE Dubai"),
    SA("sa", "Saudi Arabia", "in Saudi Arabia"),
    DE("de", "Germany", "in Germany"),
    FR("fr", "France", "in France"),
    IN("in", "India", "in India"),
    AU("au", "Australia", "in Australia"),
    CA("ca", "Canada", "in Canada"),
    JP("jp", "Japan", "in Japan"),
    SG("sg", "Singapore", "in Singapore"),
    BR("br", "Brazil", "in Brazil"),
    MX("mx", "Mexico", "in Mexico"),
    NL("nl", "Netherlands", "in Netherlands"),
    ES("es", "Spain", "in Spain"),
    IT("it", "Italy", "in Italy"),
    EG("eg", "Egypt", "in Egypt"),
    KW("kw", "Kuwait", "in Kuwait"),
    QA("qa", "Qatar", "in Qatar"),
    BH("bh", "Bahrain", "in Bahrain");

    private final String id;
    private final String label;
    private final String searchHint;

    Region(String id, String label, String searchHint) {
        this.id = id;
        this.label = label;
        this.searchHint = searchHint;
    }

    @JsonValue
    public String id() { return id; }

    public String label() { return label; }

    public String searchHint() { return searchHint; }

    @JsonCreator
    public static Region fromId(String raw) {
        if (raw == null || raw.isBlank()) return GLOBAL;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Region r : values()) {
            if (r.id.equals(key)) return r;
        }
        throw new IllegalArgumentException("Unsupported region: " + raw);
    }
}
