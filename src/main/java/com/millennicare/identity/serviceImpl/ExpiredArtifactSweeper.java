package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.service.SessionService;
import com.millennicare.identity.service.VerificationCodeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Deletes expired sessions and verification codes. Expired rows are already unusable. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredArtifactSweeper {

    private final SessionService sessionService;
    private final VerificationCodeService codeService;

    @Scheduled(fixedDelayString = "${app.auth.sweep-interval:PT15M}", initialDelayString = "${app.auth.sweep-initial-delay:PT1M}")
    public void sweep() {
        int sessions = sessionService.purgeExpired();
        int codes = codeService.purgeExpired();
        if (sessions > 0 || codes > 0) {
            log.info("Purged {} expired sessions and {} expired verification codes", sessions, codes);
        }
    }
}
