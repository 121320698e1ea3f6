package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.dto.SignUpRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.entity.Account;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;
import com.millennicare.identity.model.AuthError;
import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import com.millennicare.identity.repository.AccountRepository;
import com.millennicare.identity.repository.UserRepository;
import com.millennicare.identity.service.EmailSender;
import com.millennicare.identity.service.PasswordHasher;
import com.millennicare.identity.service.RoleService;
import com.millennicare.identity.service.VerificationCodeService;
import com.millennicare.identity.service.VerificationCodeService.IssuedCode;
import com.millennicare.identity.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceImplTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private RoleService roleService;
    @Mock
    private VerificationCodeService codeService;
    @Mock
    private PasswordHasher passwordHasher;
    @Mock
    private EmailSender emailSender;

    private RegistrationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new RegistrationServiceImpl(userRepository, accountRepository, roleService, codeService,
                passwordHasher, emailSender, TestFixtures.authProperties(), TestFixtures.fixedClock());
    }

    @Test
    void freshSignUpCreatesUnverifiedUserAndEmailsCode() {
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(false);
        when(passwordHasher.hash("Password1!")).thenReturn("$argon2id$hash");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(UUID.randomUUID());
            return u;
        });
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));
        when(roleService.assign(any(User.class), eq("careseeker"))).thenReturn(true);
        when(codeService.issue(any(User.class), eq(VerificationPurpose.VERIFY_EMAIL)))
                .thenReturn(new IssuedCode("123456", "link-token", TestFixtures.NOW.plus(Duration.ofMinutes(15))));
        when(roleService.roleNamesOf(any())).thenReturn(List.of("careseeker"));

        UserSummary summary = service.signUp(request("  Ada@Example.com ")).orElseThrow();

        assertThat(summary.getEmail()).isEqualTo("ada@example.com");
        assertThat(summary.isEmailVerified()).isFalse();
        assertThat(summary.getRoles()).containsExactly("careseeker");

        ArgumentCaptor<Account> account = ArgumentCaptor.forClass(Account.class);
        verify(accountRepository).save(account.capture());
        assertThat(account.getValue().isCredentials()).isTrue();
        assertThat(account.getValue().getPasswordHash()).isEqualTo("$argon2id$hash");
        assertThat(account.getValue().getProviderAccountId()).isEqualTo(summary.getId());

        verify(emailSender).sendVerificationEmail(eq("ada@example.com"), eq("123456"),
                eq("https://app.millennicare.test/verify-email?token=link-token"));
    }

    @Test
    void duplicateSignUpIsConflictWithoutWrites() {
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(true);

        AuthResult<UserSummary> result = service.signUp(request("ada@example.com"));

        assertThat(result.error()).contains(new AuthError(AuthErrorKind.CONFLICT, RegistrationServiceImpl.EMAIL_TAKEN));
        verify(userRepository, never()).save(any());
        verifyNoInteractions(accountRepository, passwordHasher, codeService, emailSender);
    }

    @Test
    void lostEmailRaceIsConflict() {
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(false);
        when(passwordHasher.hash(anyString())).thenReturn("$argon2id$hash");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(UUID.randomUUID());
            return u;
        });
        when(roleService.assign(any(User.class), anyString())).thenReturn(true);
        doThrow(new DataIntegrityViolationException("uk_users_email")).when(userRepository).flush();

        AuthResult<UserSummary> result = service.signUp(request("ada@example.com"));

        assertThat(result.error().map(AuthError::kind)).contains(AuthErrorKind.CONFLICT);
        verifyNoInteractions(codeService, emailSender);
    }

    @Test
    void weakPasswordIsRejectedBeforeAnyLookup() {
        SignUpRequest weak = request("ada@example.com");
        weak.setPassword("weakpass");

        AuthResult<UserSummary> result = service.signUp(weak);

        assertThat(result.error().map(AuthError::kind)).contains(AuthErrorKind.BAD_REQUEST);
        verifyNoInteractions(userRepository);
    }

    @Test
    void verifyEmailMarksUserVerifiedAndConsumesCode() {
        User user = TestFixtures.user("ada@example.com", false);
        VerificationCode code = code(user, VerificationPurpose.VERIFY_EMAIL, TestFixtures.NOW.plusSeconds(60));
        when(codeService.findByToken("tok")).thenReturn(Optional.of(code));
        when(codeService.matchesCode(code, "123456")).thenReturn(true);
        when(codeService.consume(code)).thenReturn(true);

        AuthResult<Void> result = service.verifyEmail("tok", "123456");

        assertThat(result.isSuccess()).isTrue();
        assertThat(user.isEmailVerified()).isTrue();
    }

    @Test
    void consumedCodeIsNotFound() {
        when(codeService.findByToken("tok")).thenReturn(Optional.empty());

        assertThat(service.verifyEmail("tok", "123456").error().map(AuthError::kind))
                .contains(AuthErrorKind.NOT_FOUND);
    }

    @Test
    void resetCodeCannotVerifyEmail() {
        User user = TestFixtures.user("ada@example.com", false);
        VerificationCode code = code(user, VerificationPurpose.FORGOT_PASSWORD, TestFixtures.NOW.plusSeconds(60));
        when(codeService.findByToken("tok")).thenReturn(Optional.of(code));

        assertThat(service.verifyEmail("tok", null).error().map(AuthError::kind))
                .contains(AuthErrorKind.BAD_REQUEST);
        assertThat(user.isEmailVerified()).isFalse();
    }

    @Test
    void wrongCodeIsUnauthorized() {
        User user = TestFixtures.user("ada@example.com", false);
        VerificationCode code = code(user, VerificationPurpose.VERIFY_EMAIL, TestFixtures.NOW.plusSeconds(60));
        when(codeService.findByToken("tok")).thenReturn(Optional.of(code));
        when(codeService.matchesCode(code, "000000")).thenReturn(false);

        assertThat(service.verifyEmail("tok", "000000").error().map(AuthError::kind))
                .contains(AuthErrorKind.UNAUTHORIZED);
        verify(codeService, never()).consume(any());
    }

    @Test
    void expiredCodeIsUnauthorized() {
        User user = TestFixtures.user("ada@example.com", false);
        VerificationCode code = code(user, VerificationPurpose.VERIFY_EMAIL, TestFixtures.NOW.minusSeconds(1));
        when(codeService.findByToken("tok")).thenReturn(Optional.of(code));

        assertThat(service.verifyEmail("tok", null).error())
                .contains(new AuthError(AuthErrorKind.UNAUTHORIZED, RegistrationServiceImpl.CODE_EXPIRED));
    }

    @Test
    void concurrentConsumerThatLosesGetsNotFound() {
        User user = TestFixtures.user("ada@example.com", false);
        VerificationCode code = code(user, VerificationPurpose.VERIFY_EMAIL, TestFixtures.NOW.plusSeconds(60));
        when(codeService.findByToken("tok")).thenReturn(Optional.of(code));
        when(codeService.consume(code)).thenReturn(false);

        assertThat(service.verifyEmail("tok", null).error().map(AuthError::kind))
                .contains(AuthErrorKind.NOT_FOUND);
    }

    @Test
    void resendIsSilentForUnknownOrVerifiedUsers() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmail("done@example.com"))
                .thenReturn(Optional.of(TestFixtures.user("done@example.com", true)));

        service.resendVerification("ghost@example.com");
        service.resendVerification("done@example.com");

        verifyNoInteractions(codeService, emailSender);
    }

    @Test
    void resendIssuesFreshCodeForUnverifiedUser() {
        User user = TestFixtures.user("ada@example.com", false);
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));
        when(codeService.issue(user, VerificationPurpose.VERIFY_EMAIL))
                .thenReturn(new IssuedCode("654321", "tok2", TestFixtures.NOW.plus(Duration.ofMinutes(15))));

        service.resendVerification("ADA@example.com");

        verify(emailSender).sendVerificationEmail("ada@example.com", "654321",
                "https://app.millennicare.test/verify-email?token=tok2");
    }

    private static SignUpRequest request(String email) {
        return SignUpRequest.builder()
                .email(email)
                .password("Password1!")
                .name("Ada Lovelace")
                .firstName("Ada")
                .lastName("Lovelace")
                .roles(Set.of("careseeker"))
                .build();
    }

    private static VerificationCode code(User user, VerificationPurpose purpose, Instant expiresAt) {
        return VerificationCode.builder()
                .id(UUID.randomUUID())
                .user(user)
                .purpose(purpose)
                .codeHash("x")
                .tokenHash("y")
                .expiresAt(expiresAt)
                .build();
    }
}
