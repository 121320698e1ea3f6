package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.entity.Session;
import com.millennicare.identity.entity.User;
import com.millennicare.identity.repository.SessionRepository;
import com.millennicare.identity.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Session rows back every issued token pair. Deleting a row is what revokes its tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private final SessionRepository sessionRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    @Override
    @Transactional
    public Session create(User user) {
        Session session = Session.builder()
                .user(user)
                .expiresAt(clock.instant().plus(authProperties.sessionTtl()))
                .build();
        return sessionRepository.save(session);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isActive(UUID sessionId, UUID userId) {
        Instant now = clock.instant();
        return sessionRepository.findById(sessionId)
                .filter(s -> s.getUser().getId().equals(userId))
                .filter(s -> !s.isExpired(now))
                .isPresent();
    }

    @Override
    @Transactional
    public Optional<Session> extend(UUID sessionId) {
        Instant now = clock.instant();
        Optional<Session> found = sessionRepository.findById(sessionId);
        if (found.isEmpty() || found.get().isExpired(now)) {
            return Optional.empty();
        }
        Session session = found.get();
        session.setExpiresAt(now.plus(authProperties.sessionTtl()));
        return Optional.of(session);
    }

    @Override
    @Transactional
    public void delete(UUID sessionId) {
        int removed = sessionRepository.deleteSessionById(sessionId);
        log.debug("Deleted session {} (rows={})", sessionId, removed);
    }

    @Override
    @Transactional
    public int purgeExpired() {
        return sessionRepository.deleteAllExpired(clock.instant());
    }
}
