package com.localization.resources.model;

import lombok.Builder;
import lombok.Value;

/**
 * A place in source code that refers to a resource key.
 */
@Value
@Builder
public class CodeReference {
    String fileName;
    int lineNumber;
    String line;
}
