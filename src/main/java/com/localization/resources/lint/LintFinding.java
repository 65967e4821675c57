package com.localization.resources.lint;

import com.localization.resources.model.CultureKey;
import lombok.Builder;
import lombok.Value;

/**
 * A quality issue of one resource value.
 */
@Value
@Builder
public class LintFinding {
    String baseName;
    String key;
    CultureKey culture;
    String message;

    @Override
    public String toString() {
        return baseName + ":" + key + " [" + culture + "] " + message;
    }
}
