package com.memic.sdk.model;

import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata filters applied to a search. List-valued filters match any of their values.
 *
 * <pre>{@code
 * MetadataFilters filters = MetadataFilters.builder()
 *         .referenceId("TG_G1_Math")
 *         .pageRange(PageRange.between(1, 50))
 *         .build();
 * }</pre>
 */
@Builder
public record MetadataFilters(@Nullable String referenceId,
                              @Nullable List<String> referenceIds,
                              @Nullable Integer pageNumber,
                              @Nullable List<Integer> pageNumbers,
                              @Nullable PageRange pageRange,
                              @Nullable String category,
                              @Nullable String documentType) {

    public MetadataFilters {
        PageRange.requirePageNumber("page_number", pageNumber);
        referenceIds = referenceIds == null ? List.of() : List.copyOf(referenceIds);
        pageNumbers = pageNumbers == null ? List.of() : List.copyOf(pageNumbers);
        pageNumbers.forEach(page -> PageRange.requirePageNumber("page_numbers", page));
    }

    /**
     * Converts the filters to the request format, leaving out every filter that is not set.
     *
     * @return a sparse, ordered map keyed by the API's snake_case filter names
     */
    public Map<String, Object> toApiFormat() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (StringUtils.hasText(referenceId)) {
            result.put("reference_id", referenceId);
        }
        if (!CollectionUtils.isEmpty(referenceIds)) {
            result.put("reference_ids", referenceIds);
        }
        if (pageNumber != null) {
            result.put("page_number", pageNumber);
        }
        if (!CollectionUtils.isEmpty(pageNumbers)) {
            result.put("page_numbers", pageNumbers);
        }
        if (pageRange != null) {
            result.put("page_range", pageRange.toApiFormat());
        }
        if (StringUtils.hasText(category)) {
            result.put("category", category);
        }
        if (StringUtils.hasText(documentType)) {
            result.put("document_type", documentType);
        }

        return result;
    }

    public boolean isEmpty() {
        return toApiFormat().isEmpty();
    }
}
