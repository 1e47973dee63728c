package com.deepansh.research.analysis;

public record ValidationResult(boolean valid, String reason) {

    public static ValidationResult accepted(String reason) {
        return new ValidationResult(true, reason);
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }
}
