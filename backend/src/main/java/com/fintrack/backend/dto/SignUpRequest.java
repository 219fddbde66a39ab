package com.fintrack.backend.dto;

import com.fintrack.backend.util.ValidationPatterns;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignUpRequest {

    @NotBlank
    @Email(regexp = ValidationPatterns.EMAIL, message = ValidationPatterns.EMAIL_MESSAGE)
    @Schema(example = "john.doe@example.com")
    private String email;

    // bcrypt only reads the first 72 bytes
    @NotBlank
    @Size(min = 12, max = 72, message = "Password must be between 12 and 72 characters long")
    @Pattern(regexp = ValidationPatterns.STRONG_PASSWORD, message = ValidationPatterns.STRONG_PASSWORD_MESSAGE)
    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY, example = "SecurePass123!")
    private String password;

    @NotBlank
    @Size(min = 2, max = 50, message = ValidationPatterns.NAME_LENGTH_MESSAGE)
    @Pattern(regexp = ValidationPatterns.PERSON_NAME, message = ValidationPatterns.PERSON_NAME_MESSAGE)
    @Schema(example = "John")
    private String firstName;

    @NotBlank
    @Size(min = 2, max = 50, message = ValidationPatterns.NAME_LENGTH_MESSAGE)
    @Pattern(regexp = ValidationPatterns.PERSON_NAME, message = ValidationPatterns.PERSON_NAME_MESSAGE)
    @Schema(example = "Doe")
    private String lastName;
}
