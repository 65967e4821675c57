package com.localization.resources.cli.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by the lint option validation with every problem it found, so a user can fix
 * all of them in one go.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    private static String describe(List<String> errors) {
        StringBuilder message = new StringBuilder("Invalid lint options (")
                .append(errors.size())
                .append(errors.size() == 1 ? " problem)" : " problems)");
        for (String error : errors) {
            message.append(System.lineSeparator()).append("  - ").append(error);
        }
        return message.toString();
    }
}
