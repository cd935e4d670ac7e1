package com.substrate.cognition;

public record RegistrationResult(boolean registered, ErrorKind error, String message) {

    public static RegistrationResult ok() {
        return new RegistrationResult(true, null, null);
    }

    public static RegistrationResult invalid(String message) {
        return new RegistrationResult(false, ErrorKind.INVALID_CONFIGURATION, message);
    }
}
