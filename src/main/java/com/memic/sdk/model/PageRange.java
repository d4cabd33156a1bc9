package com.memic.sdk.model;

import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inclusive page-number range used in search filters. Either bound may be left open.
 *
 * @param gte lowest page number, at least 1
 * @param lte highest page number, at least 1
 */
public record PageRange(@Nullable Integer gte, @Nullable Integer lte) {

    public PageRange {
        requirePageNumber("gte", gte);
        requirePageNumber("lte", lte);
    }

    public static PageRange between(int gte, int lte) {
        return new PageRange(gte, lte);
    }

    public static PageRange from(int gte) {
        return new PageRange(gte, null);
    }

    public static PageRange upTo(int lte) {
        return new PageRange(null, lte);
    }

    /**
     * @return the bounds that are set, keyed {@code gte} and {@code lte}
     */
    public Map<String, Object> toApiFormat() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (gte != null) {
            result.put("gte", gte);
        }
        if (lte != null) {
            result.put("lte", lte);
        }
        return result;
    }

    static void requirePageNumber(String field, @Nullable Integer value) {
        if (value != null && value < 1) {
            throw new IllegalArgumentException(field + " must be greater than or equal to 1, got " + value);
        }
    }
}
