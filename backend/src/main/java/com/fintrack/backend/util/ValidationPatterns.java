package com.fintrack.backend.util;

/**
 * Regular expressions and messages shared by request validation.
 */
public final class ValidationPatterns {

    /**
     * At least one lowercase letter, one uppercase letter, one digit and one of {@code @$!%*?&}.
     * Printable ASCII only, so a length limit in characters is also one in bytes.
     */
    public static final String STRONG_PASSWORD =
            "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[\\x20-\\x7E]*$";

    public static final String EMAIL = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$";

    /**
     * Letters (Turkish letters included), inner spaces, hyphens and apostrophes.
     * Must start and end with a letter.
     */
    public static final String PERSON_NAME =
            "^[a-zA-ZÇçĞğIıİiÖöŞşÜü]+([a-zA-ZÇçĞğIıİiÖöŞşÜü\\s'-]*[a-zA-ZÇçĞğIıİiÖöŞşÜü])?$";

    public static final String STRONG_PASSWORD_MESSAGE =
            "Password must contain at least one uppercase letter, one lowercase letter, one number, "
                    + "and one special character (@$!%*?&), using printable ASCII characters only";
    public static final String EMAIL_MESSAGE = "Please provide a valid email address";
    public static final String PERSON_NAME_MESSAGE =
            "Name can only contain letters, spaces, hyphens, and apostrophes";
    public static final String NAME_LENGTH_MESSAGE = "Name must be between 2 and 50 characters long";

    private ValidationPatterns() {
    }
}
