package com.fintrack.backend.dto;

import com.fintrack.backend.model.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Public profile of an authenticated user. Never carries the password hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthUserDTO {
    private UUID id;
    private String email;
    private String firstName;
    private String lastName;

    public static AuthUserDTO from(UserAccount user) {
        return AuthUserDTO.builder()
                .id(user.getId())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }
}
