package com.aegis.rulegov.service.governance;

import com.aegis.rulegov.api.exceptions.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpirySweeperTest {

    @Mock
    GovernanceService governanceService;

    @Test
    @DisplayName("Should report the number of expired suggestions")
    void shouldDelegateToGovernanceService() {
        // Given
        ExpirySweeper sweeper = new ExpirySweeper();
        sweeper.governanceService = governanceService;
        when(governanceService.expireDue()).thenReturn(3);

        // When / Then
        assertThat(sweeper.sweep()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should survive a failing pass so the schedule keeps running")
    void shouldSurviveFailure() {
        // Given
        ExpirySweeper sweeper = new ExpirySweeper();
        sweeper.governanceService = governanceService;
        when(governanceService.expireDue())
                .thenThrow(new PersistenceException("Failed to load overdue suggestions", new SQLException("down")));

        // When / Then
        assertThat(sweeper.sweep()).isZero();
    }
}
