package com.localization.resources.model;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by all entries of a resource entity.
 */
@Value
@Builder(toBuilder = true)
public class ResourceTableConfig {

    public static final String DEFAULT_INVARIANT_MARKER = "@Invariant";
    public static final String DEFAULT_FORMAT_PARAMETER_MISMATCH_ERROR = "String format parameter mismatch";

    /**
     * Comment token marking an entry as not requiring translation. Matched case-insensitively.
     */
    @Builder.Default
    String invariantMarker = DEFAULT_INVARIANT_MARKER;

    /**
     * Error text reported for a culture whose format parameters differ from the neutral value.
     */
    @Builder.Default
    String formatParameterMismatchError = DEFAULT_FORMAT_PARAMETER_MISMATCH_ERROR;

    public static ResourceTableConfig defaults() {
        return ResourceTableConfig.builder().build();
    }
}
