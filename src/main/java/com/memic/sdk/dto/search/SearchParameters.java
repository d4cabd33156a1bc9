package com.memic.sdk.dto.search;

import com.memic.sdk.model.MetadataFilters;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Parameters of a search. Only {@code query} is required.
 */
@Getter
@Builder
@ToString
public class SearchParameters {

    public static final int DEFAULT_TOP_K = 10;
    public static final double DEFAULT_MIN_SCORE = 0.7;

    @NonNull
    private final String query;

    @Nullable
    private final String projectId;

    @Singular
    private final List<String> fileIds;

    @Builder.Default
    private final int topK = DEFAULT_TOP_K;

    @Builder.Default
    private final double minScore = DEFAULT_MIN_SCORE;

    @Nullable
    private final MetadataFilters filters;

    public static SearchParameters of(String query) {
        return builder().query(query).build();
    }
}
