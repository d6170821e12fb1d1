package com.baton.coordinator.ledger;

import com.baton.coordinator.event.*;
import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.TaskGroup;
import com.baton.coordinator.store.AppendResult;
import com.baton.coordinator.store.CoordinationException;
import com.baton.coordinator.store.CoordinationStore;
import com.baton.coordinator.store.Digests;
import com.baton.coordinator.store.EventQuery;
import com.baton.coordinator.store.SessionWriteGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Issue history of every task group, kept as events.
 *
 * A review pass stores one complete ISSUES_RAISED list per iteration; the
 * implementer answers with ISSUE_RESPONSES; the reviewer rules on rejections
 * with REVIEW_VERDICTS. The current state of an issue is never stored: it is
 * derived by joining the latest list with the latest responses of the same
 * iteration.
 *
 * Issue ids are {@code {group}-{iteration}-{sequence}}, so ids of different
 * groups and iterations never collide. Issues are matched across iterations
 * by fingerprint (normalised title plus location) instead.
 */
@Service
public class IssueLedger {

    private static final Logger log = LoggerFactory.getLogger(IssueLedger.class);

    private final CoordinationStore store;
    private final EventPayloadCodec codec;
    private final SessionWriteGuard guard;

    public IssueLedger(CoordinationStore store, EventPayloadCodec codec, SessionWriteGuard guard) {
        this.store = store;
        this.codec = codec;
        this.guard = guard;
    }

    // ------------------------------------------------------------------
    // Review passes
    // ------------------------------------------------------------------

    /**
     * Store the issue list of one review pass.
     *
     * On a re-review, new non-blocking issues are dropped (only issues whose
     * fingerprint was in the previous list may stay non-blocking) while new
     * blocking issues are kept. A blocking issue whose rejection was already
     * accepted in an earlier iteration is closed right away and an audit
     * warning is left for the manager.
     *
     * Repeating a pass for an iteration that is already stored writes nothing
     * and returns the stored result.
     */
    public ReviewRecord recordReview(String sessionId, String groupId, int iteration, List<IssueDraft> drafts) {
        if (iteration < 1) {
            throw CoordinationException.validation("iteration must be >= 1, was " + iteration);
        }
        if (drafts == null || drafts.stream().anyMatch(Objects::isNull)) {
            throw CoordinationException.validation("issues cannot be null");
        }
        for (IssueDraft draft : drafts) {
            if (draft.title() == null || draft.title().isBlank()) {
                throw CoordinationException.validation("issue title is required");
            }
            if (draft.severity() == null) {
                throw CoordinationException.validation("severity is required for issue '" + draft.title() + "'");
            }
        }

        return guard.inTransaction(sessionId, () -> {
            store.requireTaskGroup(sessionId, groupId);
            List<IssuesRaised> history = raisedHistory(sessionId, groupId);

            Optional<IssuesRaised> already = history.stream().filter(r -> r.iteration() == iteration).findFirst();
            if (already.isPresent()) {
                log.debug("Review iteration {} of group {} already recorded", iteration, groupId);
                return summarise(sessionId, groupId, already.get(), List.of(), true);
            }

            Optional<IssuesRaised> previous = history.stream()
                    .filter(r -> r.iteration() < iteration)
                    .reduce((first, second) -> second);
            Set<String> previousFingerprints = previous
                    .map(p -> p.issues().stream().map(Issue::fingerprint).collect(Collectors.toSet()))
                    .orElse(Set.of());

            List<IssueDraft> kept    = new ArrayList<>();
            List<IssueDraft> dropped = new ArrayList<>();
            for (IssueDraft draft : drafts) {
                boolean isNew = !previousFingerprints.contains(Issue.fingerprintOf(draft.title(), draft.location()));
                if (previous.isPresent() && !draft.blocking() && isNew) {
                    dropped.add(draft);
                } else {
                    kept.add(draft);
                }
            }
            if (!dropped.isEmpty()) {
                log.info("Re-review {} of group {} added {} new non-blocking issue(s), dropped",
                        iteration, groupId, dropped.size());
            }

            List<Issue> issues = new ArrayList<>();
            int seq = 1;
            for (IssueDraft draft : kept) {
                issues.add(new Issue(groupId + "-" + iteration + "-" + seq++, draft.title(), draft.description(),
                        draft.severity(), draft.blocking(), draft.location()));
            }
            IssuesRaised raised = new IssuesRaised(iteration, issues);
            store.appendEvent(sessionId, groupId, raised, "issues:" + sessionId + ":" + groupId + ":" + iteration);

            guardReRejections(sessionId, groupId, raised, history);
            return summarise(sessionId, groupId, raised, dropped, false);
        });
    }

    private void guardReRejections(String sessionId, String groupId, IssuesRaised raised, List<IssuesRaised> history) {
        Map<String, Integer> acceptedBefore = new HashMap<>();
        for (IssuesRaised earlier : history) {
            if (earlier.iteration() >= raised.iteration()) {
                continue;
            }
            for (IssueRecord record : view(sessionId, groupId, earlier)) {
                if (record.blocking() && record.resolution() == ResolutionStatus.REJECTED_AND_ACCEPTED) {
                    acceptedBefore.put(Issue.fingerprintOf(record.title(), record.location()), earlier.iteration());
                }
            }
        }

        List<IssueResponse> auto = new ArrayList<>();
        for (Issue issue : raised.issues()) {
            Integer acceptedIn = acceptedBefore.get(issue.fingerprint());
            if (issue.blocking() && acceptedIn != null) {
                auto.add(new IssueResponse(issue.id(), ResponseStatus.REJECTED_AND_ACCEPTED,
                        "rejection already accepted in iteration " + acceptedIn));
            }
        }
        if (auto.isEmpty()) {
            return;
        }

        String key = sessionId + ":" + groupId + ":" + raised.iteration();
        store.appendEvent(sessionId, groupId, new IssueResponses(raised.iteration(), auto), "responses:" + key + ":auto");

        List<String> ids = auto.stream().map(IssueResponse::issueId).toList();
        store.appendEvent(sessionId, groupId, new AuditEntry(
                "reviewer re-raised issues whose rejection was already accepted; closed automatically",
                Map.of("groupId", groupId,
                       "iteration", String.valueOf(raised.iteration()),
                       "issues", String.join(",", ids))),
                "rereject:" + key);
        log.warn("Group {} iteration {}: re-raised issues {} were already accepted as rejected, auto-accepted",
                groupId, raised.iteration(), ids);
    }

    private ReviewRecord summarise(String sessionId, String groupId, IssuesRaised raised,
                                   List<IssueDraft> dropped, boolean duplicate) {
        List<IssueRecord> view = view(sessionId, groupId, raised);
        List<String> autoAccepted = view.stream()
                .filter(r -> r.resolution() == ResolutionStatus.REJECTED_AND_ACCEPTED)
                .map(IssueRecord::id)
                .toList();
        int blocking    = (int) view.stream().filter(IssueRecord::unresolvedBlocking).count();
        int nonBlocking = (int) view.stream().filter(r -> !r.blocking()).count();
        return new ReviewRecord(raised.iteration(), raised.issues(), dropped, autoAccepted,
                blocking, nonBlocking, duplicate);
    }

    // ------------------------------------------------------------------
    // Implementer responses
    // ------------------------------------------------------------------

    /**
     * Store the implementer's answers to the latest issue list.
     *
     * Rejections already accepted by the reviewer are carried into the new
     * event, so the latest responses of an iteration are always complete.
     *
     * @throws CoordinationException VALIDATION_ERROR for an iteration other than the latest,
     *                               an unknown issue id or a self-accepted rejection
     */
    public AppendResult recordResponses(String sessionId, String groupId, IssueResponses responses) {
        if (responses == null) {
            throw CoordinationException.validation("responses are required");
        }
        responses.validate();
        for (IssueResponse response : responses.responses()) {
            if (response.status() == ResponseStatus.REJECTED_AND_ACCEPTED) {
                throw CoordinationException.validation(
                        "only the reviewer can accept a rejection (issue " + response.issueId() + ")");
            }
        }

        return guard.inTransaction(sessionId, () -> {
            store.requireTaskGroup(sessionId, groupId);
            IssuesRaised latest = latestRaised(sessionId, groupId).orElseThrow(() ->
                    CoordinationException.validation("group " + groupId + " has no issues to respond to"));
            if (latest.iteration() != responses.iteration()) {
                throw CoordinationException.validation("responses are for iteration %d but the latest review is %d"
                        .formatted(responses.iteration(), latest.iteration()));
            }
            Set<String> known = latest.issues().stream().map(Issue::id).collect(Collectors.toSet());
            for (IssueResponse response : responses.responses()) {
                if (!known.contains(response.issueId())) {
                    throw CoordinationException.validation("issue " + response.issueId()
                            + " is not part of iteration " + latest.iteration());
                }
            }

            Map<String, IssueResponse> merged = new LinkedHashMap<>();
            responses.responses().forEach(r -> merged.put(r.issueId(), r));
            latestResponses(sessionId, groupId, latest.iteration()).ifPresent(previous ->
                    previous.responses().stream()
                            .filter(r -> r.status() == ResponseStatus.REJECTED_AND_ACCEPTED)
                            .forEach(r -> merged.put(r.issueId(), r)));
            return appendResponses(sessionId, groupId, latest.iteration(), merged);
        });
    }

    // ------------------------------------------------------------------
    // Reviewer verdicts on rejections
    // ------------------------------------------------------------------

    /**
     * Record the reviewer's rulings on rejected issues. Accepted rejections
     * become REJECTED_AND_ACCEPTED in a superseding responses event;
     * overruled ones stay REJECTED and therefore open.
     *
     * @return ids whose rejection was accepted by this call
     */
    public List<String> recordVerdicts(String sessionId, String groupId, ReviewVerdicts verdicts) {
        if (verdicts == null) {
            throw CoordinationException.validation("verdicts are required");
        }
        verdicts.validate();

        return guard.inTransaction(sessionId, () -> {
            store.requireTaskGroup(sessionId, groupId);
            IssueResponses current = latestResponses(sessionId, groupId, verdicts.iteration()).orElseThrow(() ->
                    CoordinationException.validation("no responses recorded for iteration " + verdicts.iteration()
                            + " of group " + groupId));
            Map<String, IssueResponse> merged = new LinkedHashMap<>();
            current.responses().forEach(r -> merged.put(r.issueId(), r));

            for (RejectionVerdict verdict : verdicts.verdicts()) {
                IssueResponse answered = merged.get(verdict.issueId());
                if (answered == null || (answered.status() != ResponseStatus.REJECTED
                        && answered.status() != ResponseStatus.REJECTED_AND_ACCEPTED)) {
                    throw CoordinationException.validation("issue " + verdict.issueId() + " was not rejected");
                }
            }

            store.appendEvent(sessionId, groupId, verdicts, "verdicts:" + sessionId + ":" + groupId + ":"
                    + verdicts.iteration() + ":" + Digests.sha256Hex(verdicts.toString()));

            List<String> accepted = new ArrayList<>();
            for (RejectionVerdict verdict : verdicts.verdicts()) {
                IssueResponse answered = merged.get(verdict.issueId());
                if (verdict.accepted() && answered.status() == ResponseStatus.REJECTED) {
                    merged.put(verdict.issueId(), new IssueResponse(verdict.issueId(),
                            ResponseStatus.REJECTED_AND_ACCEPTED, answered.reason()));
                    accepted.add(verdict.issueId());
                }
            }
            if (!accepted.isEmpty()) {
                appendResponses(sessionId, groupId, verdicts.iteration(), merged);
                log.info("Group {} iteration {}: reviewer accepted rejection of {}",
                        groupId, verdicts.iteration(), accepted);
            }
            return accepted;
        });
    }

    private AppendResult appendResponses(String sessionId, String groupId, int iteration,
                                         Map<String, IssueResponse> merged) {
        IssueResponses payload = new IssueResponses(iteration, List.copyOf(merged.values()));
        String key = "responses:" + sessionId + ":" + groupId + ":" + iteration + ":"
                + Digests.sha256Hex(payload.toString());
        return store.appendEvent(sessionId, groupId, payload, key);
    }

    // ------------------------------------------------------------------
    // Views
    // ------------------------------------------------------------------

    /** Issues of the group's latest review pass with their current resolution. */
    public List<IssueRecord> issues(String sessionId, String groupId) {
        return latestRaised(sessionId, groupId)
                .map(raised -> view(sessionId, groupId, raised))
                .orElse(List.of());
    }

    public List<IssueRecord> unresolvedBlocking(String sessionId, String groupId) {
        return issues(sessionId, groupId).stream().filter(IssueRecord::unresolvedBlocking).toList();
    }

    /** Unresolved blocking issues of every group in the session. */
    public List<IssueRecord> unresolvedBlocking(String sessionId) {
        List<IssueRecord> result = new ArrayList<>();
        for (TaskGroup group : store.listTaskGroups(sessionId)) {
            result.addAll(unresolvedBlocking(sessionId, group.getGroupId()));
        }
        return result;
    }

    /** True when at least one review pass was recorded for the group. */
    public boolean hasHistory(String sessionId, String groupId) {
        return store.latestEvent(sessionId, groupId, EventType.ISSUES_RAISED).isPresent();
    }

    private List<IssueRecord> view(String sessionId, String groupId, IssuesRaised raised) {
        Map<String, IssueResponse> answers = latestResponses(sessionId, groupId, raised.iteration())
                .map(r -> r.responses().stream().collect(Collectors.toMap(IssueResponse::issueId, x -> x)))
                .orElse(Map.of());
        return raised.issues().stream().map(issue -> {
            IssueResponse answer = answers.get(issue.id());
            return answer == null
                    ? IssueRecord.of(groupId, raised.iteration(), issue, ResolutionStatus.OPEN, null)
                    : IssueRecord.of(groupId, raised.iteration(), issue,
                            ResolutionStatus.of(answer.status()), answer.reason());
        }).toList();
    }

    private List<IssuesRaised> raisedHistory(String sessionId, String groupId) {
        return codec.decodeAll(store.findEvents(sessionId, EventQuery.of(groupId, EventType.ISSUES_RAISED)),
                IssuesRaised.class);
    }

    private Optional<IssuesRaised> latestRaised(String sessionId, String groupId) {
        return store.latestEvent(sessionId, groupId, EventType.ISSUES_RAISED)
                .map(e -> codec.decode(e, IssuesRaised.class));
    }

    private Optional<IssueResponses> latestResponses(String sessionId, String groupId, int iteration) {
        List<IssueResponses> all = codec.decodeAll(
                store.findEvents(sessionId, EventQuery.of(groupId, EventType.ISSUE_RESPONSES)), IssueResponses.class);
        IssueResponses latest = null;
        for (IssueResponses responses : all) {
            if (responses.iteration() == iteration) {
                latest = responses;
            }
        }
        return Optional.ofNullable(latest);
    }
}
