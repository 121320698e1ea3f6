package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;
import com.millennicare.identity.repository.VerificationCodeRepository;
import com.millennicare.identity.service.VerificationCodeService;
import com.millennicare.identity.utils.SecureTokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Single-use codes. The 6-digit code is stored as SHA-512 and the link token as SHA-256;
 * neither is recoverable from the row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationCodeServiceImpl implements VerificationCodeService {

    static final int CODE_DIGITS = 6;

    private final VerificationCodeRepository codeRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final AuthProperties authProperties;
    private final Clock clock;

    @Override
    @Transactional
    public IssuedCode issue(User user, VerificationPurpose purpose) {
        int superseded = codeRepository.deleteByUserAndPurpose(user.getId(), purpose);
        if (superseded > 0) {
            log.debug("Superseded {} {} code(s) for user {}", superseded, purpose, user.getId());
        }

        String code = tokenGenerator.newNumericCode(CODE_DIGITS);
        String token = tokenGenerator.newUrlToken();
        Instant expiresAt = clock.instant().plus(authProperties.verificationCodeTtl());

        codeRepository.save(VerificationCode.builder()
                .user(user)
                .purpose(purpose)
                .codeHash(SecureTokenGenerator.sha512Hex(code))
                .tokenHash(SecureTokenGenerator.sha256Hex(token))
                .expiresAt(expiresAt)
                .build());

        return new IssuedCode(code, token, expiresAt);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<VerificationCode> findByToken(String token) {
        if (!StringUtils.hasText(token)) return Optional.empty();
        return codeRepository.findByTokenHash(SecureTokenGenerator.sha256Hex(token.trim()));
    }

    @Override
    public boolean matchesCode(VerificationCode stored, String code) {
        if (!StringUtils.hasText(code)) return false;
        return SecureTokenGenerator.digestEquals(SecureTokenGenerator.sha512Hex(code.trim()), stored.getCodeHash());
    }

    @Override
    @Transactional
    public boolean consume(VerificationCode stored) {
        return codeRepository.consume(stored.getId()) == 1;
    }

    @Override
    @Transactional
    public int purgeExpired() {
        return codeRepository.deleteAllExpired(clock.instant());
    }
}
