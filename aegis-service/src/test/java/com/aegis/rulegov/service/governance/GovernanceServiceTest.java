package com.aegis.rulegov.service.governance;

import com.aegis.rulegov.api.exceptions.GovernanceViolationException;
import com.aegis.rulegov.api.exceptions.GovernanceViolationException.Reason;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.exceptions.SuggestionNotFoundException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.api.model.AuditEntry.Action;
import com.aegis.rulegov.api.model.RuleVersion;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;
import com.aegis.rulegov.api.model.ValidationResult;
import com.aegis.rulegov.governance.GovernanceSettings;
import com.aegis.rulegov.governance.SuggestionTransitions;
import com.aegis.rulegov.service.repository.InMemoryActiveRuleRegistry;
import com.aegis.rulegov.service.repository.InMemoryAuditLog;
import com.aegis.rulegov.service.repository.InMemorySuggestionRepository;
import com.aegis.rulegov.support.ContentHash;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.aegis.rulegov.service.Fixtures.CLOCK;
import static com.aegis.rulegov.service.Fixtures.LARGE_MOBILE;
import static com.aegis.rulegov.service.Fixtures.NOW;
import static com.aegis.rulegov.service.Fixtures.audit;
import static com.aegis.rulegov.service.Fixtures.pending;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GovernanceServiceTest {

    private static final String APPROVAL_NOTES = "Checked the examples, fraud pattern confirmed";

    private GovernanceService service;
    private InMemorySuggestionRepository repository;
    private InMemoryActiveRuleRegistry registry;
    private InMemoryAuditLog auditLog;

    @BeforeEach
    void setUp() {
        registry = new InMemoryActiveRuleRegistry();
        auditLog = new InMemoryAuditLog();
        repository = new InMemorySuggestionRepository(registry, auditLog);

        service = new GovernanceService();
        service.tracer = OpenTelemetry.noop().getTracer("test");
        service.repository = repository;
        service.auditLog = auditLog;
        service.transitions = new SuggestionTransitions(GovernanceSettings.DEFAULTS);
        service.clock = CLOCK;
    }

    private static Suggestion withExpiry(String id, String author, Instant expiresAt) {
        Suggestion base = pending(id, author);
        return Suggestion.pending(base.id(), base.instruction(), base.rule(), base.validation(), base.violations(),
                base.impact(), null, base.overlaps(), base.generation(), author, base.createdAt(), expiresAt);
    }

    @Nested
    class Approve {

        @Test
        @DisplayName("Should approve, promote the rule and append version 1")
        void shouldApproveAndPromote() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When
            Suggestion approved = service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true,
                    "About a quarter of mobile volume goes to review");

            // Then
            assertThat(approved.status()).isEqualTo(SuggestionStatus.APPROVED);
            assertThat(approved.reviewer()).isEqualTo("lead-b");
            assertThat(approved.reviewedAt()).isEqualTo(NOW);
            assertThat(repository.findById("s1")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.APPROVED);

            List<ActiveRule> active = registry.findEnabled();
            assertThat(active).hasSize(1);
            ActiveRule rule = active.get(0);
            assertThat(rule.rule()).isEqualTo(LARGE_MOBILE);
            assertThat(rule.version()).isEqualTo(1);
            assertThat(rule.author()).isEqualTo("analyst-a");
            assertThat(rule.approvedBy()).isEqualTo("lead-b");

            List<RuleVersion> versions = registry.findVersions(rule.id());
            assertThat(versions).hasSize(1);
            assertThat(versions.get(0).changeType()).isEqualTo(RuleVersion.ChangeType.CREATED);
            assertThat(versions.get(0).fingerprint()).isEqualTo(ContentHash.fingerprint(LARGE_MOBILE));
            assertThat(versions.get(0).suggestionId()).isEqualTo("s1");
            assertThat(versions.get(0).impact()).isEqualTo(approved.impact());

            List<AuditEntry> trail = service.auditTrail("s1");
            assertThat(trail).extracting(AuditEntry::action).containsExactly(Action.APPLY_RULE);
            assertThat(trail.get(0).payload()).containsEntry("rule_id", rule.id()).containsEntry("version", 1);
        }

        @Test
        @DisplayName("Should refuse self-approval and audit it as a two-person violation")
        void shouldRefuseSelfApproval() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "analyst-a", APPROVAL_NOTES, true))
                    .isInstanceOf(GovernanceViolationException.class)
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.SELF_APPROVAL);

            assertThat(repository.findById("s1")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.PENDING);
            assertThat(registry.size()).isZero();
            List<AuditEntry> trail = service.auditTrail("s1");
            assertThat(trail).extracting(AuditEntry::action).containsExactly(Action.APPLY_RULE_REJECTED_TWO_PERSON);
            assertThat(trail.get(0).success()).isFalse();
            assertThat(trail.get(0).actor()).isEqualTo("analyst-a");
        }

        @Test
        @DisplayName("Should treat an approver id that differs only by whitespace as the author")
        void shouldRefuseSelfApprovalWithPaddedId() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "analyst-a ", APPROVAL_NOTES, true))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.SELF_APPROVAL);
            assertThat(registry.size()).isZero();
            assertThat(service.auditTrail("s1").get(0).actor()).isEqualTo("analyst-a");
        }

        @Test
        @DisplayName("Should store the trimmed approver id on the suggestion and the active rule")
        void shouldTrimApproverId() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When
            Suggestion approved = service.approveSuggestion("s1", "  lead-b ", APPROVAL_NOTES, true);

            // Then
            assertThat(approved.reviewer()).isEqualTo("lead-b");
            assertThat(registry.findEnabled()).singleElement()
                    .extracting(ActiveRule::approvedBy).isEqualTo("lead-b");
            assertThat(service.auditTrail("s1")).singleElement()
                    .extracting(AuditEntry::actor).isEqualTo("lead-b");
        }

        @Test
        @DisplayName("Should keep the suggestion pending when the approval cannot be audited")
        void shouldNotApproveWithoutAudit() {
            // Given
            repository.insert(pending("s1", "analyst-a"));
            auditLog.failAppends(true);

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true))
                    .isInstanceOf(PersistenceException.class);
            assertThat(repository.findById("s1")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.PENDING);
            assertThat(registry.size()).isZero();

            // the approval can be retried once the audit log recovers
            auditLog.failAppends(false);
            assertThat(service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true).status())
                    .isEqualTo(SuggestionStatus.APPROVED);
            assertThat(registry.size()).isEqualTo(1);
            assertThat(auditLog.actions()).containsExactly(Action.APPLY_RULE);
        }

        @Test
        @DisplayName("Should refuse short notes and a missing acknowledgement")
        void shouldRefuseMissingEvidence() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-b", "ok", true))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.NOTES_TOO_SHORT);
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, false))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.IMPACT_NOT_ACKNOWLEDGED);

            assertThat(auditLog.actions()).containsExactly(Action.APPLY_RULE_REJECTED, Action.APPLY_RULE_REJECTED);
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("Should refuse a suggestion whose impact could not be computed")
        void shouldRefuseWithoutImpact() {
            // Given
            Suggestion base = pending("s1", "analyst-a");
            repository.insert(Suggestion.pending("s1", base.instruction(), base.rule(), ValidationResult.ok(),
                    List.of(), null, "Impact could not be computed: sample is empty", List.of(), null,
                    "analyst-a", base.createdAt(), base.expiresAt()));

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.IMPACT_NOT_COMPUTED);
        }

        @Test
        @DisplayName("Should refuse a second transition of a terminal suggestion")
        void shouldRefuseSecondApproval() {
            // Given
            repository.insert(pending("s1", "analyst-a"));
            service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true);

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-c", APPROVAL_NOTES, true))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.ALREADY_TERMINAL);
            assertThatThrownBy(() -> service.rejectSuggestion("s1", "lead-c", "Changed my mind on this"))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.ALREADY_TERMINAL);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should refuse approval after the suggestion expired")
        void shouldRefuseExpired() {
            // Given
            repository.insert(withExpiry("s1", "analyst-a", NOW.minusSeconds(1)));

            // When / Then
            assertThatThrownBy(() -> service.approveSuggestion("s1", "lead-b", APPROVAL_NOTES, true))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.EXPIRED);
        }

        @Test
        @DisplayName("Should fail for an unknown suggestion")
        void shouldFailForUnknownSuggestion() {
            assertThatThrownBy(() -> service.approveSuggestion("missing", "lead-b", APPROVAL_NOTES, true))
                    .isInstanceOf(SuggestionNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Should let exactly one of many concurrent approvals win")
        void shouldAdmitSingleWinnerUnderConcurrency() throws Exception {
            // Given
            repository.insert(pending("s1", "analyst-a"));
            int approvers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(approvers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            // When
            for (int i = 0; i < approvers; i++) {
                String approver = "lead-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        service.approveSuggestion("s1", approver, APPROVAL_NOTES, true);
                        return true;
                    } catch (GovernanceViolationException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            pool.shutdown();

            // Then
            assertThat(winners).isEqualTo(1);
            assertThat(registry.size()).isEqualTo(1);
            assertThat(auditLog.actions()).filteredOn(a -> a == Action.APPLY_RULE).hasSize(1);
            assertThat(auditLog.actions()).filteredOn(a -> a == Action.APPLY_RULE_REJECTED).hasSize(approvers - 1);
        }
    }

    @Nested
    class Reject {

        @Test
        @DisplayName("Should reject with notes and never promote the rule")
        void shouldReject() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When
            Suggestion rejected = service.rejectSuggestion("s1", "lead-b", "Too broad for the weekend traffic");

            // Then
            assertThat(rejected.status()).isEqualTo(SuggestionStatus.REJECTED);
            assertThat(rejected.reviewNotes()).isEqualTo("Too broad for the weekend traffic");
            assertThat(registry.size()).isZero();
            assertThat(service.auditTrail("s1")).extracting(AuditEntry::action).containsExactly(Action.REJECT_RULE);
        }

        @Test
        @DisplayName("Should let the author withdraw their own suggestion")
        void shouldAllowAuthorToWithdraw() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When
            Suggestion rejected = service.rejectSuggestion("s1", "analyst-a", "Withdrawn, wrong threshold");

            // Then
            assertThat(rejected.status()).isEqualTo(SuggestionStatus.REJECTED);
        }

        @Test
        @DisplayName("Should keep the suggestion pending when the rejection cannot be audited")
        void shouldNotRejectWithoutAudit() {
            // Given
            repository.insert(pending("s1", "analyst-a"));
            auditLog.failAppends(true);

            // When / Then
            assertThatThrownBy(() -> service.rejectSuggestion("s1", "lead-b", "Too broad for the weekend traffic"))
                    .isInstanceOf(PersistenceException.class);
            assertThat(repository.findById("s1")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.PENDING);
            assertThat(auditLog.all()).isEmpty();
        }

        @Test
        @DisplayName("Should audit a refused rejection")
        void shouldAuditRefusedRejection() {
            // Given
            repository.insert(pending("s1", "analyst-a"));

            // When / Then
            assertThatThrownBy(() -> service.rejectSuggestion("s1", "", "Too broad for the weekend traffic"))
                    .extracting(e -> ((GovernanceViolationException) e).reason())
                    .isEqualTo(Reason.MISSING_REVIEWER);
            assertThat(service.auditTrail("s1")).extracting(AuditEntry::action)
                    .containsExactly(Action.REJECT_RULE_FAILED);
            assertThat(service.auditTrail("s1").get(0).actor()).isEqualTo("unknown");
        }
    }

    @Nested
    class Expire {

        @Test
        @DisplayName("Should expire only overdue pending suggestions")
        void shouldExpireOverdueOnly() {
            // Given
            repository.insert(withExpiry("old", "analyst-a", NOW.minus(Duration.ofMinutes(5))));
            repository.insert(withExpiry("fresh", "analyst-a", NOW.plus(Duration.ofDays(2))));
            repository.insert(withExpiry("done", "analyst-a", NOW.minus(Duration.ofDays(1))));
            repository.reject(repository.findById("done").orElseThrow()
                    .rejected("lead-b", "Rejected before it expired", NOW.minus(Duration.ofDays(2))),
                    audit(Action.REJECT_RULE, "lead-b", "done"));

            // When
            int expired = service.expireDue();

            // Then
            assertThat(expired).isEqualTo(1);
            assertThat(repository.findById("old")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.EXPIRED);
            assertThat(repository.findById("fresh")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.PENDING);
            assertThat(repository.findById("done")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.REJECTED);

            List<AuditEntry> trail = service.auditTrail("old");
            assertThat(trail).extracting(AuditEntry::action).containsExactly(Action.EXPIRE_SUGGESTION);
            assertThat(trail.get(0).actor()).isEqualTo("system");
            assertThat(service.expireDue()).isZero();
        }

        @Test
        @DisplayName("Should leave an overdue suggestion pending when its expiry cannot be audited")
        void shouldNotExpireWithoutAudit() {
            // Given
            repository.insert(withExpiry("old", "analyst-a", NOW.minus(Duration.ofMinutes(5))));
            auditLog.failAppends(true);

            // When / Then
            assertThatThrownBy(() -> service.expireDue()).isInstanceOf(PersistenceException.class);
            assertThat(repository.findById("old")).get().extracting(Suggestion::status)
                    .isEqualTo(SuggestionStatus.PENDING);

            auditLog.failAppends(false);
            assertThat(service.expireDue()).isEqualTo(1);
            assertThat(auditLog.actions()).containsExactly(Action.EXPIRE_SUGGESTION);
        }
    }

    @Test
    @DisplayName("Should list suggestions by status and author and validate paging")
    void shouldListSuggestions() {
        // Given
        repository.insert(pending("s1", "analyst-a"));
        repository.insert(pending("s2", "analyst-b"));
        service.rejectSuggestion("s2", "lead-c", "Duplicate of an existing rule");

        // When / Then
        assertThat(service.listSuggestions(SuggestionStatus.PENDING, null, 10, 0))
                .extracting(Suggestion::id).containsExactly("s1");
        assertThat(service.listSuggestions(null, "analyst-b", 10, 0))
                .extracting(Suggestion::id).containsExactly("s2");
        assertThatThrownBy(() -> service.listSuggestions(null, null, 0, 0))
                .isInstanceOf(InvalidRequestException.class);
    }
}
