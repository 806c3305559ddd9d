package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;
import com.aegis.rulegov.service.governance.GovernanceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aegis.rulegov.service.Fixtures.pending;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuggestionResourceTest {

    @Test
    @DisplayName("Should parse the status query parameter case-insensitively")
    void shouldParseStatus() {
        assertThat(SuggestionResource.parseStatus("pending")).isEqualTo(SuggestionStatus.PENDING);
        assertThat(SuggestionResource.parseStatus(" Approved ")).isEqualTo(SuggestionStatus.APPROVED);
        assertThat(SuggestionResource.parseStatus(null)).isNull();
        assertThat(SuggestionResource.parseStatus("")).isNull();
        assertThatThrownBy(() -> SuggestionResource.parseStatus("live"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("live");
    }

    @Test
    @DisplayName("Should pass the review body through to the governance service")
    void shouldDelegateApproval() {
        // Given
        GovernanceService governance = mock(GovernanceService.class);
        Suggestion approved = pending("s-1", "analyst-a");
        when(governance.approveSuggestion("s-1", "lead-b", "Checked the sample", true, null)).thenReturn(approved);
        SuggestionResource resource = new SuggestionResource();
        resource.governance = governance;

        // When
        Suggestion result = resource.approve("s-1",
                new SuggestionRequests.Approve("lead-b", "Checked the sample", true, null));

        // Then
        assertThat(result).isSameAs(approved);
        verify(governance).approveSuggestion("s-1", "lead-b", "Checked the sample", true, null);
    }

    @Test
    @DisplayName("Should refuse a missing request body")
    void shouldRefuseMissingBody() {
        SuggestionResource resource = new SuggestionResource();

        assertThatThrownBy(() -> resource.reject("s-1", null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> resource.approve("s-1", null)).isInstanceOf(InvalidRequestException.class);
    }
}
