package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.service.SessionService;
import com.millennicare.identity.service.VerificationCodeService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpiredArtifactSweeperTest {

    @Mock
    private SessionService sessionService;

    @Mock
    private VerificationCodeService codeService;

    @InjectMocks
    private ExpiredArtifactSweeper sweeper;

    @Test
    void sweepPurgesSessionsAndCodes() {
        when(sessionService.purgeExpired()).thenReturn(2);
        when(codeService.purgeExpired()).thenReturn(0);

        sweeper.sweep();

        verify(sessionService).purgeExpired();
        verify(codeService).purgeExpired();
    }
}
