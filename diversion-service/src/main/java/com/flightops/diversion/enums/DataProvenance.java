package com.flightops.diversion.enums;

/**
 * Origin of a data feed value. MIXED marks an aggregate built from differing sources.
 */
public enum DataProvenance {
    AUTHORITATIVE,
    SYNTHETIC,
    MIXED;

    public static DataProvenance combine(DataProvenance... sources) {
        DataProvenance combined = null;
        for (DataProvenance source : sources) {
            if (source == null) {
                continue;
            }
            if (combined == null) {
                combined = source;
            } else if (combined != source) {
                return MIXED;
            }
        }
        return combined;
    }
}
