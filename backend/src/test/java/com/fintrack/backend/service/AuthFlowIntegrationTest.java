package com.fintrack.backend.service;

import com.fintrack.backend.dto.AuthResponse;
import com.fintrack.backend.dto.RefreshResponse;
import com.fintrack.backend.dto.SignInRequest;
import com.fintrack.backend.dto.SignUpRequest;
import com.fintrack.backend.exception.AuthErrorCode;
import com.fintrack.backend.exception.AuthException;
import com.fintrack.backend.model.UserAccount;
import com.fintrack.backend.repository.RefreshTokenRepository;
import com.fintrack.backend.repository.UserRepository;
import com.fintrack.backend.security.AccessTokenClaims;
import com.fintrack.backend.security.JwtTokenProvider;
import com.fintrack.backend.security.UserPrincipal;
import com.fintrack.backend.util.TestUsers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthFlowIntegrationTest {

    private static final String PASSWORD = "Str0ng!Passw0rd";

    @Autowired
    private AuthService authService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Test
    void signUpAndWrongPasswordSignInForConcreteAccount() {
        AuthResponse response = authService.signUp(signUp("a@b.com", "A", "B"));

        assertThat(response.getUser().getEmail()).isEqualTo("a@b.com");
        assertThat(response.getUser().getFirstName()).isEqualTo("A");
        assertThat(response.getAccessToken()).isNotBlank();
        assertThat(response.getRefreshToken()).isNotBlank();
        assertThat(response.getAccessToken()).isNotEqualTo(response.getRefreshToken());

        AuthException ex = catchThrowableOfType(
                () -> authService.signIn(new SignInRequest("a@b.com", "Wr0ng!Passw0rd")), AuthException.class);
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    void signUpTokenCarriesSubmittedProfileAndPasswordIsHashed() {
        String email = TestUsers.uniqueEmail();

        AuthResponse response = authService.signUp(signUp(email, "Grace", "Hopper"));

        AccessTokenClaims claims = jwtTokenProvider.parseAccessToken(response.getAccessToken());
        assertThat(claims.email()).isEqualTo(email);
        assertThat(claims.firstName()).isEqualTo("Grace");
        assertThat(claims.lastName()).isEqualTo("Hopper");
        assertThat(claims.userId()).isEqualTo(response.getUser().getId());

        List<UserAccount> rows = rowsWithEmail(email);
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getPasswordHash()).isNotEqualTo(PASSWORD);
        assertThat(rows.get(0).getEmailVerified()).isFalse();
        assertThat(refreshTokenRepository.findByUserId(claims.userId())).isPresent();
    }

    @Test
    void secondSignUpWithSameEmailIsRejected() {
        String email = TestUsers.uniqueEmail();
        authService.signUp(signUp(email, "Grace", "Hopper"));

        AuthException ex = catchThrowableOfType(
                () -> authService.signUp(signUp(email, "Other", "Person")), AuthException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.DUPLICATE_EMAIL);
        assertThat(rowsWithEmail(email)).hasSize(1);
    }

    @Test
    void emailsAreCaseSensitive() {
        String email = TestUsers.uniqueEmail();
        authService.signUp(signUp(email, "Grace", "Hopper"));

        AuthException ex = catchThrowableOfType(
                () -> authService.signIn(new SignInRequest(email.toUpperCase(), PASSWORD)), AuthException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    void signInFailuresLookTheSame() {
        String email = TestUsers.uniqueEmail();
        authService.signUp(signUp(email, "Grace", "Hopper"));

        AuthException wrongPassword = catchThrowableOfType(
                () -> authService.signIn(new SignInRequest(email, "Wr0ng!Passw0rd")), AuthException.class);
        AuthException unknownEmail = catchThrowableOfType(
                () -> authService.signIn(new SignInRequest(TestUsers.uniqueEmail(), PASSWORD)), AuthException.class);

        assertThat(wrongPassword.getCode()).isEqualTo(unknownEmail.getCode());
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
    }

    @Test
    void signInReturnsFreshTokenPair() {
        String email = TestUsers.uniqueEmail();
        AuthResponse signedUp = authService.signUp(signUp(email, "Grace", "Hopper"));

        AuthResponse signedIn = authService.signIn(new SignInRequest(email, PASSWORD));

        assertThat(signedIn.getUser().getId()).isEqualTo(signedUp.getUser().getId());
        assertThat(signedIn.getRefreshToken()).isNotEqualTo(signedUp.getRefreshToken());
        // signin replaces the signup session
        assertThat(catchThrowableOfType(() -> authService.refresh(signedUp.getRefreshToken()), AuthException.class)
                .getCode()).isEqualTo(AuthErrorCode.INVALID_REFRESH_TOKEN);
    }

    @Test
    void refreshRotatesTheToken() {
        AuthResponse session = authService.signUp(signUp(TestUsers.uniqueEmail(), "Grace", "Hopper"));
        String original = session.getRefreshToken();

        RefreshResponse rotated = authService.refresh(original);

        assertThat(rotated.access()).isNotBlank();
        assertThat(rotated.refreshToken()).isNotEqualTo(original);

        AuthException replay = catchThrowableOfType(() -> authService.refresh(original), AuthException.class);
        assertThat(replay.getCode()).isEqualTo(AuthErrorCode.INVALID_REFRESH_TOKEN);

        RefreshResponse next = authService.refresh(rotated.refreshToken());
        assertThat(next.refreshToken()).isNotEqualTo(rotated.refreshToken());
    }

    @Test
    void logoutThenRefreshFails() {
        AuthResponse session = authService.signUp(signUp(TestUsers.uniqueEmail(), "Grace", "Hopper"));

        authService.logout(session.getRefreshToken());

        assertThat(refreshTokenRepository.findByUserId(session.getUser().getId())).isEmpty();
        AuthException ex = catchThrowableOfType(
                () -> authService.refresh(session.getRefreshToken()), AuthException.class);
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.INVALID_REFRESH_TOKEN);
    }

    @Test
    void logoutIsIdempotentForWellFormedTokens() {
        AuthResponse session = authService.signUp(signUp(TestUsers.uniqueEmail(), "Grace", "Hopper"));

        authService.logout(session.getRefreshToken());
        authService.logout(session.getRefreshToken());

        assertThat(refreshTokenRepository.findByUserId(session.getUser().getId())).isEmpty();
    }

    @Test
    void logoutWithRotatedTokenKeepsCurrentSession() {
        AuthResponse session = authService.signUp(signUp(TestUsers.uniqueEmail(), "Grace", "Hopper"));
        RefreshResponse rotated = authService.refresh(session.getRefreshToken());

        authService.logout(session.getRefreshToken());

        assertThat(authService.refresh(rotated.refreshToken()).access()).isNotBlank();
    }

    @Test
    void logoutWithUndecodableTokenFails() {
        AuthException ex = catchThrowableOfType(() -> authService.logout("garbage"), AuthException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.LOGOUT_FAILED);
    }

    @Test
    void accessTokenResolvesToStoredIdentity() {
        String email = TestUsers.uniqueEmail();
        AuthResponse session = authService.signUp(signUp(email, "Grace", "Hopper"));

        UserPrincipal principal = authService.validateAccessToken(session.getAccessToken());

        assertThat(principal.getUserId()).isEqualTo(session.getUser().getId());
        assertThat(principal.getEmail()).isEqualTo(email);
    }

    @Test
    void accessTokenOfDeletedUserIsRejected() {
        AuthResponse session = authService.signUp(signUp(TestUsers.uniqueEmail(), "Grace", "Hopper"));
        refreshTokenRepository.findByUserId(session.getUser().getId()).ifPresent(refreshTokenRepository::delete);
        userRepository.deleteById(session.getUser().getId());

        AuthException ex = catchThrowableOfType(
                () -> authService.validateAccessToken(session.getAccessToken()), AuthException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.UNAUTHENTICATED);
    }

    private SignUpRequest signUp(String email, String firstName, String lastName) {
        return SignUpRequest.builder()
                .email(email)
                .password(PASSWORD)
                .firstName(firstName)
                .lastName(lastName)
                .build();
    }

    private List<UserAccount> rowsWithEmail(String email) {
        return userRepository.findAll().stream()
                .filter(user -> email.equals(user.getEmail()))
                .toList();
    }
}
