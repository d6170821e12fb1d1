package com.baton.coordinator.service;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.engine.TransitionAction;
import com.baton.coordinator.event.IssueResponse;
import com.baton.coordinator.event.IssueResponses;
import com.baton.coordinator.event.RejectionVerdict;
import com.baton.coordinator.event.ResponseStatus;
import com.baton.coordinator.event.ReviewVerdicts;
import com.baton.coordinator.event.ScopeChange;
import com.baton.coordinator.event.Severity;
import com.baton.coordinator.ledger.IssueDraft;
import com.baton.coordinator.ledger.IssueRecord;
import com.baton.coordinator.ledger.ResolutionStatus;
import com.baton.coordinator.model.*;
import com.baton.coordinator.progress.EscalationLevel;
import com.baton.coordinator.store.CoordinationStore;
import com.baton.coordinator.store.EventQuery;
import com.baton.coordinator.store.TaskGroupUpdate;
import com.baton.coordinator.validator.MissingItem;
import com.baton.coordinator.validator.ValidationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end coordination scenarios against the real Spring context and an
 * in-memory H2 store. Every test works in its own session.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class CoordinationScenarioTest {

    @Autowired CoordinationService  service;
    @Autowired CoordinationCommands commands;
    @Autowired CoordinationStore    store;
    @Autowired MeterRegistry        meterRegistry;

    String sessionId;

    @BeforeEach
    void setUp() {
        sessionId = "run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void session(TestingMode testingMode, String... scopeIds) {
        List<ScopeItem> scope = new ArrayList<>();
        for (String id : scopeIds) {
            scope.add(new ScopeItem(id, "deliver " + id));
        }
        service.createSession(sessionId, scope, ExecutionMode.MULTI_TRACK, testingMode);
    }

    private void group(String groupId, String name, String... scopeIds) {
        service.upsertTaskGroup(sessionId, TaskGroupUpdate.create(groupId, name, List.of(scopeIds)));
    }

    private TransitionOutcome report(String groupId, Role role, String status, String... capabilities) {
        return service.reportStatus(new StatusReport(sessionId, groupId, role, status, Set.of(capabilities), null));
    }

    private ReviewOutcome review(String groupId, Role role, int iteration, IssueDraft... issues) {
        return service.recordReview(sessionId, groupId, role, iteration, List.of(issues));
    }

    private static IssueDraft blocking(String title) {
        return new IssueDraft(title, null, Severity.HIGH, true, "src/Main.java");
    }

    private static IssueDraft nit(String title) {
        return new IssueDraft(title, null, Severity.LOW, false, "src/Main.java");
    }

    private static IssueDraft[] blockingIssues(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> blocking("problem " + i)).toArray(IssueDraft[]::new);
    }

    private TaskGroup group(String groupId) {
        return service.getTaskGroup(sessionId, groupId);
    }

    /** Walks a group from start through QA to the reviewer. */
    private void deliverToReview(String groupId) {
        report(groupId, Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");
        report(groupId, Role.QUALITY_CHECKER, "PASS", "test_results");
    }

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void zeroIssues_groupApprovedAndSessionAccepted() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");

        List<TransitionOutcome> started = service.startPendingGroups(sessionId, 2);
        assertThat(started).hasSize(1);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.IN_PROGRESS);
        assertThat(group("G1").getAssignedRole()).isEqualTo(Role.IMPLEMENTER);

        TransitionOutcome qa = report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");
        assertThat(qa.decision().nextRole()).isEqualTo(Role.QUALITY_CHECKER);
        assertThat(qa.decision().includeContext()).contains("change_summary");

        TransitionOutcome passed = report("G1", Role.QUALITY_CHECKER, "PASS", "test_results");
        assertThat(passed.decision().nextRole()).isEqualTo(Role.REVIEWER);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.UNDER_REVIEW);

        ReviewOutcome approved = review("G1", Role.REVIEWER, 1);
        assertThat(approved.decision().groupStatus()).isEqualTo(GroupStatus.APPROVED);
        assertThat(approved.decision().nextRole()).isEqualTo(Role.MANAGER);

        ValidationReport report = service.declareCompletion(sessionId, "search shipped");
        assertThat(report.accepted()).isTrue();
        assertThat(service.getSession(sessionId).isClosed()).isTrue();
    }

    @Test
    void blockingIssueFixed_secondReviewApproves() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        deliverToReview("G1");

        ReviewOutcome first = review("G1", Role.REVIEWER, 1, blocking("Missing null check"));
        assertThat(first.decision().groupStatus()).isEqualTo(GroupStatus.CHANGES_REQUIRED);
        assertThat(first.decision().action()).isEqualTo(TransitionAction.RESPAWN);
        assertThat(first.decision().nextRole()).isEqualTo(Role.IMPLEMENTER);
        assertThat(group("G1").getBlockingIssuesCount()).isEqualTo(1);

        List<IssueRecord> answered = service.recordResponses(sessionId, "G1", new IssueResponses(1,
                List.of(new IssueResponse("G1-1-1", ResponseStatus.FIXED, null))));
        assertThat(answered).singleElement()
                .extracting(IssueRecord::resolution).isEqualTo(ResolutionStatus.FIXED);
        assertThat(service.unresolvedBlocking(sessionId, "G1")).isEmpty();

        deliverToReview("G1");
        ReviewOutcome second = review("G1", Role.REVIEWER, 2);
        assertThat(second.progress().progressed()).isTrue();
        assertThat(second.decision().groupStatus()).isEqualTo(GroupStatus.APPROVED);

        assertThat(service.declareCompletion(sessionId, "done").accepted()).isTrue();
    }

    @Test
    void acceptedRejection_signsOffWithoutAnotherReview() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        deliverToReview("G1");
        review("G1", Role.REVIEWER, 1, blocking("Use a builder"));

        service.recordResponses(sessionId, "G1", new IssueResponses(1,
                List.of(new IssueResponse("G1-1-1", ResponseStatus.REJECTED, "constructor has two arguments"))));
        assertThat(service.unresolvedBlocking(sessionId, "G1")).hasSize(1);

        VerdictOutcome verdict = service.recordVerdicts(sessionId, "G1", Role.REVIEWER, new ReviewVerdicts(1,
                List.of(new RejectionVerdict("G1-1-1", true, "fair enough"))));

        assertThat(verdict.accepted()).containsExactly("G1-1-1");
        assertThat(verdict.decision()).isNotNull();
        assertThat(verdict.decision().groupStatus()).isEqualTo(GroupStatus.APPROVED);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.APPROVED);
        assertThat(service.issues(sessionId, "G1")).singleElement()
                .extracting(IssueRecord::resolution).isEqualTo(ResolutionStatus.REJECTED_AND_ACCEPTED);
        assertThat(service.declareCompletion(sessionId, "done").accepted()).isTrue();
    }

    @Test
    void overruledRejection_staysOpen() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        deliverToReview("G1");
        review("G1", Role.REVIEWER, 1, blocking("Use a builder"));
        service.recordResponses(sessionId, "G1", new IssueResponses(1,
                List.of(new IssueResponse("G1-1-1", ResponseStatus.REJECTED, "not needed"))));

        VerdictOutcome verdict = service.recordVerdicts(sessionId, "G1", Role.REVIEWER, new ReviewVerdicts(1,
                List.of(new RejectionVerdict("G1-1-1", false, "it is needed"))));

        assertThat(verdict.accepted()).isEmpty();
        assertThat(verdict.decision()).isNull();
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.CHANGES_REQUIRED);
        assertThat(service.unresolvedBlocking(sessionId, null)).extracting(IssueRecord::id).containsExactly("G1-1-1");
    }

    // ------------------------------------------------------------------
    // Escalation
    // ------------------------------------------------------------------

    @Test
    void flatBlockingCount_escalatesToLeadReviewerOnFourthReview() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        List<EscalationLevel> levels = new ArrayList<>();
        ReviewOutcome last = null;
        for (int iteration = 1; iteration <= 4; iteration++) {
            last = review("G1", Role.REVIEWER, iteration, blocking("problem 1"), blocking("problem 2"));
            levels.add(last.progress().level());
        }

        assertThat(levels).containsExactly(EscalationLevel.NONE, EscalationLevel.NONE,
                EscalationLevel.WARNING, EscalationLevel.ESCALATE);
        assertThat(last.decision().escalated()).isTrue();
        assertThat(last.decision().nextRole()).isEqualTo(Role.LEAD_REVIEWER);

        TaskGroup escalated = group("G1");
        assertThat(escalated.getStatus()).isEqualTo(GroupStatus.ESCALATED);
        assertThat(escalated.getAssignedRole()).isEqualTo(Role.LEAD_REVIEWER);
        assertThat(escalated.getNoProgressCount()).isZero();
    }

    @Test
    void fixingOneTrivialIssuePerPass_stillEscalates() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        // Each pass a different issue is fixed, but a new one of equal weight appears.
        review("G1", Role.REVIEWER, 1, blocking("a"), blocking("b"), blocking("c"));
        review("G1", Role.REVIEWER, 2, blocking("b"), blocking("c"), blocking("d"));
        review("G1", Role.REVIEWER, 3, blocking("c"), blocking("d"), blocking("e"));
        ReviewOutcome fourth = review("G1", Role.REVIEWER, 4, blocking("d"), blocking("e"), blocking("f"));

        assertThat(fourth.progress().streak()).isEqualTo(3);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.ESCALATED);
    }

    @Test
    void adversarialReviewer_isStoppedByHardCap() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        for (int iteration = 1; iteration <= 4; iteration++) {
            review("G1", Role.REVIEWER, iteration, blockingIssues(iteration));
        }
        assertThat(group("G1").getAssignedRole()).isEqualTo(Role.LEAD_REVIEWER);

        for (int iteration = 5; iteration <= 7; iteration++) {
            review("G1", Role.LEAD_REVIEWER, iteration, blockingIssues(iteration));
        }
        // A lead reviewer that keeps sending work back is escalated past, to the manager.
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.ESCALATED);
        assertThat(group("G1").getAssignedRole()).isEqualTo(Role.MANAGER);

        report("G1", Role.MANAGER, "CONTINUE");
        ReviewOutcome capped = review("G1", Role.LEAD_REVIEWER, 8, blockingIssues(8));

        assertThat(capped.progress().level()).isEqualTo(EscalationLevel.HARD_CAP);
        assertThat(capped.decision().action()).isEqualTo(TransitionAction.TERMINATE);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.REJECTED);

        ReviewOutcome late = review("G1", Role.LEAD_REVIEWER, 9, blockingIssues(9));
        assertThat(late.decision().stale()).isTrue();
        assertThat(group("G1").getReviewIteration()).isEqualTo(8);
    }

    @Test
    void repeatedQualityFailures_hitTheHardCap() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        RoutingDecision decision = null;
        for (int i = 0; i < 9; i++) {
            report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");
            decision = report("G1", Role.QUALITY_CHECKER, "FAIL", "test_results").decision();
            if (group("G1").getStatus().isTerminal()) {
                break;
            }
        }

        assertThat(decision.action()).isEqualTo(TransitionAction.TERMINATE);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.REJECTED);
    }

    // ------------------------------------------------------------------
    // Routing rules applied by the service
    // ------------------------------------------------------------------

    @Test
    void securityGroup_cannotSkipQualityCheck() {
        session(TestingMode.DISABLED, "S1");
        group("G1", "Auth token refresh", "S1");
        service.startPendingGroups(sessionId, 1);

        TransitionOutcome outcome = report("G1", Role.IMPLEMENTER, "READY_FOR_REVIEW", "change_summary");

        assertThat(outcome.decision().nextRole()).isEqualTo(Role.QUALITY_CHECKER);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.READY_FOR_REVIEW);
    }

    @Test
    void minimalTesting_skipsQualityCheck() {
        session(TestingMode.MINIMAL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        TransitionOutcome outcome = report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");

        assertThat(outcome.decision().nextRole()).isEqualTo(Role.REVIEWER);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.UNDER_REVIEW);
    }

    @Test
    void missingCapability_failsClosedAndRecordsViolation() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        TransitionOutcome outcome = report("G1", Role.IMPLEMENTER, "READY_FOR_QA");

        assertThat(outcome.decision().failClosed()).isTrue();
        assertThat(outcome.decision().nextRole()).isEqualTo(Role.MANAGER);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.IN_PROGRESS);
        assertThat(service.findEvents(sessionId, EventQuery.of("G1", EventType.ROLE_VIOLATION))).hasSize(1);
    }

    @Test
    void unknownStatus_failsClosedToManager() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        TransitionOutcome outcome = report("G1", Role.IMPLEMENTER, "DONE_I_THINK", "change_summary");

        assertThat(outcome.decision().failClosed()).isTrue();
        assertThat(outcome.decision().notes()).anyMatch(n -> n.contains("DONE_I_THINK"));
    }

    @Test
    void singleTrack_startsOneGroupAtATime() {
        service.createSession(sessionId, List.of(new ScopeItem("S1", "a"), new ScopeItem("S2", "b")),
                ExecutionMode.SINGLE_TRACK, TestingMode.FULL);
        group("G1", "First", "S1");
        group("G2", "Second", "S2");

        assertThat(service.startPendingGroups(sessionId, 4)).hasSize(1);
        assertThat(service.startPendingGroups(sessionId, 4)).isEmpty();
        assertThat(service.listTaskGroups(sessionId)).extracting(TaskGroup::getStatus)
                .containsExactlyInAnyOrder(GroupStatus.IN_PROGRESS, GroupStatus.PENDING);
    }

    // ------------------------------------------------------------------
    // Idempotency and late reports
    // ------------------------------------------------------------------

    @Test
    void retriedReportWithKey_appliedOnce() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        StatusReport status = new StatusReport(sessionId, "G1", Role.IMPLEMENTER, "PARTIAL",
                Set.of("change_summary"), "turn-17");

        TransitionOutcome first = service.reportStatus(status);
        TransitionOutcome retry = service.reportStatus(status);

        assertThat(first.duplicate()).isFalse();
        assertThat(retry.duplicate()).isTrue();
        assertThat(retry.decision()).isEqualTo(first.decision());
        assertThat(service.findEvents(sessionId, EventQuery.of("G1", EventType.TRANSITION)))
                .extracting(Event::getDedupKey).containsOnlyOnce("turn-17");
    }

    @Test
    void resentReview_returnsStoredResult() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        review("G1", Role.REVIEWER, 1, blocking("Missing null check"));

        ReviewOutcome again = review("G1", Role.REVIEWER, 1, blocking("Missing null check"));

        assertThat(again.duplicate()).isTrue();
        assertThat(again.review().blockingCount()).isEqualTo(1);
        assertThat(group("G1").getReviewIteration()).isEqualTo(1);
        assertThat(service.findEvents(sessionId, EventQuery.of("G1", EventType.ISSUES_RAISED))).hasSize(1);
    }

    @Test
    void skippedIteration_rejected() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");

        CommandResult<ReviewOutcome> result = commands.recordReview(sessionId, "G1", Role.REVIEWER, 3, List.of());

        assertThat(result.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(result.message()).contains("does not follow 0");
    }

    @Test
    void implementerCannotSubmitReview() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");

        CommandResult<ReviewOutcome> result = commands.recordReview(sessionId, "G1", Role.IMPLEMENTER, 1, List.of());

        assertThat(result.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
    }

    @Test
    void reportOnApprovedGroup_droppedAsStale() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        review("G1", Role.REVIEWER, 1);
        int transitions = service.findEvents(sessionId, EventQuery.of("G1", EventType.TRANSITION)).size();

        TransitionOutcome late = report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");

        assertThat(late.decision().stale()).isTrue();
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.APPROVED);
        assertThat(service.findEvents(sessionId, EventQuery.of("G1", EventType.TRANSITION))).hasSize(transitions);
    }

    @Test
    void reportFromReplacedRole_droppedWhileEscalated() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        report("G1", Role.IMPLEMENTER, "BLOCKED", "change_summary");

        TransitionOutcome late = report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");
        TransitionOutcome lead = report("G1", Role.LEAD_REVIEWER, "UNBLOCKED");

        assertThat(late.decision().stale()).isTrue();
        assertThat(lead.decision().stale()).isFalse();
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.IN_PROGRESS);
    }

    // ------------------------------------------------------------------
    // Timeouts
    // ------------------------------------------------------------------

    @Test
    void timeoutBeforeFirstReview_onlyRespawns() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);

        for (int i = 1; i <= 4; i++) {
            TransitionOutcome outcome = service.recordTimeout(sessionId, "G1", Role.IMPLEMENTER,
                    java.time.Instant.ofEpochMilli(1_000L * i), null);
            assertThat(outcome.decision().action()).isEqualTo(TransitionAction.RESPAWN);
        }
        assertThat(group("G1").getNoProgressCount()).isZero();
    }

    @Test
    void repeatedTimeouts_countAsStalledPasses() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        review("G1", Role.REVIEWER, 1, blocking("Missing null check"));

        RoutingDecision first  = service.recordTimeout(sessionId, "G1", Role.IMPLEMENTER,
                java.time.Instant.ofEpochMilli(1_000), "no answer").decision();
        RoutingDecision second = service.recordTimeout(sessionId, "G1", Role.IMPLEMENTER,
                java.time.Instant.ofEpochMilli(2_000), "no answer").decision();
        TransitionOutcome retried = service.recordTimeout(sessionId, "G1", Role.IMPLEMENTER,
                java.time.Instant.ofEpochMilli(2_000), "no answer");
        RoutingDecision third  = service.recordTimeout(sessionId, "G1", Role.IMPLEMENTER,
                java.time.Instant.ofEpochMilli(3_000), "no answer").decision();

        assertThat(first.action()).isEqualTo(TransitionAction.RESPAWN);
        assertThat(second.action()).isEqualTo(TransitionAction.RESPAWN);
        assertThat(retried.duplicate()).isTrue();
        assertThat(third.escalated()).isTrue();
        assertThat(third.nextRole()).isEqualTo(Role.LEAD_REVIEWER);
        assertThat(service.findEvents(sessionId, EventQuery.of("G1", EventType.NO_PROGRESS))).hasSize(3);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Test
    void undeliveredScope_rejectedWithOneItemPerMissingScopeItem() {
        session(TestingMode.FULL, "S1", "S2", "S3", "S4", "S5", "S6", "S7", "S8", "S9", "S10");
        group("G1", "Core", "S1", "S2", "S3", "S4", "S5", "S6");
        service.startPendingGroups(sessionId, 1);
        review("G1", Role.REVIEWER, 1);

        ValidationReport report = service.declareCompletion(sessionId, "all done");

        assertThat(report.accepted()).isFalse();
        assertThat(report.routeTo()).isEqualTo(Role.MANAGER);
        assertThat(report.missing()).hasSize(4)
                .allMatch(m -> m.category() == MissingItem.Category.SCOPE_ITEM)
                .extracting(MissingItem::reference).containsExactly("S7", "S8", "S9", "S10");
        assertThat(service.getSession(sessionId).isClosed()).isFalse();

        service.declareScopeChange(sessionId,
                new ScopeChange(List.of("S7", "S8", "S9", "S10"), "moved to next release", "user"), null);
        assertThat(service.declareCompletion(sessionId, "all done, scope reduced").accepted()).isTrue();
    }

    @Test
    void rejectionListsEveryCheckInOrder() {
        session(TestingMode.FULL, "S1", "S2");
        group("G1", "Core", "S1");
        group("G2", "Extras", "S2");
        service.startPendingGroups(sessionId, 2);
        review("G1", Role.REVIEWER, 1, blocking("Missing null check"));

        ValidationReport report = service.validateCompletion(sessionId);

        assertThat(report.missing()).extracting(MissingItem::category).containsExactly(
                MissingItem.Category.SCOPE_ITEM,
                MissingItem.Category.SCOPE_ITEM,
                MissingItem.Category.UNRESOLVED_BLOCKING_ISSUE,
                MissingItem.Category.MISSING_SIGN_OFF,
                MissingItem.Category.MISSING_SIGN_OFF);
    }

    @Test
    void descopedGroup_needsNoSignOff() {
        session(TestingMode.FULL, "S1", "S2");
        group("G1", "Core", "S1");
        group("G2", "Extras", "S2");
        service.startPendingGroups(sessionId, 1);
        review("G1", Role.REVIEWER, 1);
        service.declareScopeChange(sessionId, new ScopeChange(List.of("S2"), "not needed", "user"), null);

        assertThat(service.validateCompletion(sessionId).accepted()).isTrue();
    }

    @Test
    void validatorVerdicts_countedWithLowerCaseTag() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        double before = verdictCount("reject");

        service.validateCompletion(sessionId);

        assertThat(verdictCount("reject")).isEqualTo(before + 1);
    }

    private double verdictCount(String verdict) {
        Counter counter = meterRegistry.find("baton.validator.verdicts").tag("verdict", verdict).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void closedSession_validatesAsAcceptedWithoutWrites() {
        session(TestingMode.FULL);
        assertThat(service.declareCompletion(sessionId, "nothing to do").accepted()).isTrue();
        int events = service.findEvents(sessionId, EventQuery.all()).size();

        assertThat(service.validateCompletion(sessionId).accepted()).isTrue();
        assertThat(service.findEvents(sessionId, EventQuery.all())).hasSize(events);
    }

    @Test
    void scopeChangeForUnknownItem_rejected() {
        session(TestingMode.FULL, "S1");

        CommandResult<?> result = commands.declareScopeChange(sessionId,
                new ScopeChange(List.of("S9"), "typo", "user"), null);

        assertThat(result.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
    }

    // ------------------------------------------------------------------
    // Status changes outside the review path
    // ------------------------------------------------------------------

    @Test
    void manualApproval_refusedAndValidatorStillRejects() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");

        CommandResult<TaskGroup> approved = commands.upsertTaskGroup(sessionId,
                new TaskGroupUpdate("G1", null, GroupStatus.APPROVED, null, null, null, null));
        CommandResult<TaskGroup> createdWithNotes = commands.upsertTaskGroup(sessionId,
                new TaskGroupUpdate("G2", "Extras", GroupStatus.APPROVED_WITH_NOTES, null, null, null, List.of("S1")));

        assertThat(approved.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(approved.message()).contains("through a review");
        assertThat(createdWithNotes.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.PENDING);
        assertThat(commands.getTaskGroup(sessionId, "G2").status()).isEqualTo(ResultStatus.NOT_FOUND);
        assertThat(service.declareCompletion(sessionId, "all done").accepted()).isFalse();
    }

    @Test
    void manualStatusChange_allowedBeforeSignOff() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");

        service.upsertTaskGroup(sessionId, new TaskGroupUpdate("G1", null, GroupStatus.IN_PROGRESS,
                null, null, null, null));

        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.IN_PROGRESS);
    }

    @Test
    void cancelledGroup_cannotBeReopened() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        TransitionOutcome cancelled = report("G1", Role.MANAGER, "CANCEL");
        assertThat(cancelled.decision().groupStatus()).isEqualTo(GroupStatus.REJECTED);

        CommandResult<TaskGroup> reopened = commands.upsertTaskGroup(sessionId,
                new TaskGroupUpdate("G1", null, GroupStatus.IN_PROGRESS, null, null, null, null));

        assertThat(reopened.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(reopened.message()).contains("REJECTED");
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.REJECTED);
    }

    @Test
    void reviewerApprovalWithOpenBlockingIssue_routedAsChangesRequired() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        deliverToReview("G1");
        review("G1", Role.REVIEWER, 1, blocking("Missing null check"));

        TransitionOutcome claimed = report("G1", Role.REVIEWER, "APPROVED", "issue_list");

        assertThat(claimed.decision().groupStatus()).isEqualTo(GroupStatus.CHANGES_REQUIRED);
        assertThat(claimed.decision().nextRole()).isEqualTo(Role.IMPLEMENTER);
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.CHANGES_REQUIRED);
        assertThat(group("G1").getBlockingIssuesCount()).isEqualTo(1);

        // The group is still workable: the implementer's next report is routed.
        TransitionOutcome next = report("G1", Role.IMPLEMENTER, "READY_FOR_QA", "change_summary");
        assertThat(next.decision().stale()).isFalse();

        service.recordResponses(sessionId, "G1", new IssueResponses(1,
                List.of(new IssueResponse("G1-1-1", ResponseStatus.FIXED, null))));
        TransitionOutcome approved = report("G1", Role.REVIEWER, "CHANGES_REQUIRED", "issue_list");

        assertThat(approved.decision().groupStatus()).isEqualTo(GroupStatus.APPROVED);
        assertThat(service.declareCompletion(sessionId, "done").accepted()).isTrue();
    }

    @Test
    void reviewerOutcomeWithoutRecordedReview_rejected() {
        session(TestingMode.FULL, "S1");
        group("G1", "Search", "S1");
        service.startPendingGroups(sessionId, 1);
        deliverToReview("G1");

        CommandResult<TransitionOutcome> result = commands.reportStatus(new StatusReport(sessionId, "G1",
                Role.REVIEWER, "APPROVED", Set.of("issue_list"), null));

        assertThat(result.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(result.message()).contains("record-review");
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.UNDER_REVIEW);
    }

    // ------------------------------------------------------------------
    // Frozen workflow configuration
    // ------------------------------------------------------------------

    @Test
    void sessionWithoutStoredWorkflow_isNotRoutedWithTheCurrentFile() {
        store.createSession(sessionId, List.of(new ScopeItem("S1", "deliver S1")),
                ExecutionMode.MULTI_TRACK, TestingMode.FULL);
        group("G1", "Search", "S1");

        CommandResult<TransitionOutcome> result = commands.reportStatus(new StatusReport(sessionId, "G1",
                Role.MANAGER, "PLANNING_COMPLETE", Set.of(), null));

        assertThat(result.status()).isEqualTo(ResultStatus.INTERNAL_ERROR);
        assertThat(result.message()).contains("no stored workflow config");
        assertThat(group("G1").getStatus()).isEqualTo(GroupStatus.PENDING);
    }

    @Test
    void unusableStoredWorkflow_isNotRoutedWithTheCurrentFile() {
        store.createSession(sessionId, List.of(new ScopeItem("S1", "deliver S1")),
                ExecutionMode.MULTI_TRACK, TestingMode.FULL);
        store.upsertState(sessionId, StateSnapshot.GLOBAL_SCOPE, "workflow_config", "{}");
        group("G1", "Search", "S1");

        CommandResult<TransitionOutcome> result = commands.reportStatus(new StatusReport(sessionId, "G1",
                Role.MANAGER, "PLANNING_COMPLETE", Set.of(), null));

        assertThat(result.status()).isEqualTo(ResultStatus.INTERNAL_ERROR);
        assertThat(result.message()).contains("unusable stored workflow config");
    }

    // ------------------------------------------------------------------
    // Store commands through the service
    // ------------------------------------------------------------------

    @Test
    void createSession_freezesWorkflowConfig() {
        session(TestingMode.FULL, "S1");

        assertThat(service.getState(sessionId, StateSnapshot.GLOBAL_SCOPE, "workflow_config")).isPresent();
        assertThat(commands.upsertState(sessionId, StateSnapshot.GLOBAL_SCOPE, "workflow_config", "{}").status())
                .isEqualTo(ResultStatus.VALIDATION_ERROR);
    }

    @Test
    void createSession_twice_conflict() {
        session(TestingMode.FULL, "S1");

        CommandResult<Session> again = commands.createSession(sessionId, List.of(),
                ExecutionMode.SINGLE_TRACK, TestingMode.FULL);

        assertThat(again.status()).isEqualTo(ResultStatus.CONFLICT);
    }

    @Test
    void groupWithUnknownScopeItem_rejected() {
        session(TestingMode.FULL, "S1");

        CommandResult<TaskGroup> result = commands.upsertTaskGroup(sessionId,
                TaskGroupUpdate.create("G1", "Core", List.of("S1", "S2")));

        assertThat(result.status()).isEqualTo(ResultStatus.VALIDATION_ERROR);
        assertThat(commands.getTaskGroup(sessionId, "G1").status()).isEqualTo(ResultStatus.NOT_FOUND);
    }
}
