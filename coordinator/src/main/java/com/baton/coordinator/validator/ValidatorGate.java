package com.baton.coordinator.validator;

import com.baton.coordinator.event.EventPayloadCodec;
import com.baton.coordinator.event.ScopeChange;
import com.baton.coordinator.event.ValidatorVerdict;
import com.baton.coordinator.ledger.IssueLedger;
import com.baton.coordinator.ledger.IssueRecord;
import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.ScopeItem;
import com.baton.coordinator.model.Session;
import com.baton.coordinator.model.TaskGroup;
import com.baton.coordinator.store.CoordinationStore;
import com.baton.coordinator.store.Digests;
import com.baton.coordinator.store.EventQuery;
import com.baton.coordinator.store.SessionWriteGuard;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Final check before a session may close.
 *
 * Runs all three checks and reports everything that is missing, in this
 * order:
 * <ol>
 *   <li>every original scope item is delivered by a signed-off group, or was
 *       removed by an explicit SCOPE_CHANGE;</li>
 *   <li>no blocking issue is unresolved in any group;</li>
 *   <li>every group is signed off (APPROVED or APPROVED_WITH_NOTES).</li>
 * </ol>
 * A group whose scope items were all removed by a scope change does not need
 * a sign-off. Accepting closes the session; rejecting hands it back to the
 * manager. Both outcomes are recorded as a VALIDATOR_VERDICT event.
 *
 * Metric: baton.validator.verdicts{verdict="accept|reject"}
 */
@Service
public class ValidatorGate {

    private static final Logger log = LoggerFactory.getLogger(ValidatorGate.class);

    private final CoordinationStore store;
    private final IssueLedger       ledger;
    private final EventPayloadCodec codec;
    private final SessionWriteGuard guard;
    private final MeterRegistry     meterRegistry;

    public ValidatorGate(CoordinationStore store,
                         IssueLedger ledger,
                         EventPayloadCodec codec,
                         SessionWriteGuard guard,
                         MeterRegistry meterRegistry) {
        this.store         = store;
        this.ledger        = ledger;
        this.codec         = codec;
        this.guard         = guard;
        this.meterRegistry = meterRegistry;
    }

    public ValidationReport validate(String sessionId) {
        return guard.inTransaction(sessionId, () -> {
            Session session = store.requireSession(sessionId);
            if (session.isClosed()) {
                log.info("Session {} is already closed, nothing to validate", sessionId);
                return ValidationReport.accept();
            }

            List<TaskGroup> groups  = store.listTaskGroups(sessionId);
            Set<String>     removed = removedScopeItems(sessionId);
            List<MissingItem> missing = new ArrayList<>();

            // 1. Scope
            Set<String> delivered = new HashSet<>();
            for (TaskGroup group : groups) {
                if (group.getStatus().isSignedOff()) {
                    delivered.addAll(group.getScopeItemIds());
                }
            }
            for (ScopeItem item : session.getOriginalScope()) {
                if (!delivered.contains(item.id()) && !removed.contains(item.id())) {
                    missing.add(new MissingItem(MissingItem.Category.SCOPE_ITEM, item.id(),
                            "scope item '" + item.description() + "' is not delivered by a signed-off group"
                                    + " and no scope change removed it"));
                }
            }

            // 2. Blocking issues
            for (IssueRecord issue : ledger.unresolvedBlocking(sessionId)) {
                missing.add(new MissingItem(MissingItem.Category.UNRESOLVED_BLOCKING_ISSUE, issue.id(),
                        "group " + issue.groupId() + ": " + issue.title() + " (" + issue.resolution() + ")"));
            }

            // 3. Sign-offs
            for (TaskGroup group : groups) {
                boolean descoped = !group.getScopeItemIds().isEmpty() && removed.containsAll(group.getScopeItemIds());
                if (!group.getStatus().isSignedOff() && !descoped) {
                    missing.add(new MissingItem(MissingItem.Category.MISSING_SIGN_OFF, group.getGroupId(),
                            "group " + group.getGroupId() + " is " + group.getStatus()));
                }
            }

            ValidatorVerdict verdict = new ValidatorVerdict(missing.isEmpty(), missing);
            store.appendEvent(sessionId, null, verdict,
                    "validator:" + sessionId + ":" + Digests.sha256Hex(verdict.toString()));

            ValidationReport report;
            if (missing.isEmpty()) {
                store.closeSession(sessionId);
                report = ValidationReport.accept();
                log.info("Session {} accepted by validator", sessionId);
            } else {
                report = ValidationReport.reject(missing);
                log.info("Session {} rejected by validator: {} missing item(s)", sessionId, missing.size());
            }
            meterRegistry.counter("baton.validator.verdicts",
                    "verdict", report.verdict().name().toLowerCase(Locale.ROOT)).increment();
            return report;
        });
    }

    private Set<String> removedScopeItems(String sessionId) {
        Set<String> removed = new HashSet<>();
        codec.decodeAll(store.findEvents(sessionId, new EventQuery(null, EventType.SCOPE_CHANGE, null, null)),
                        ScopeChange.class)
                .forEach(change -> removed.addAll(change.removedItemIds()));
        return removed;
    }
}
