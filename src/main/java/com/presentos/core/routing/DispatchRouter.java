package com.presentos.core.routing;

import com.presentos.core.forward.DownstreamForwarder;
import com.presentos.core.model.CompleteTaskIntent;
import com.presentos.core.model.DownstreamResponse;
import com.presentos.core.model.ErrorKind;
import com.presentos.core.model.IntentRecord;
import com.presentos.core.model.OutcomeStatus;
import com.presentos.core.model.RawMessage;
import com.presentos.core.model.RouteOutcome;
import com.presentos.core.model.TaskField;
import com.presentos.core.model.TaskRecord;
import com.presentos.core.model.TaskStatus;
import com.presentos.core.model.UnknownIntent;
import com.presentos.core.persistence.PersistenceException;
import com.presentos.core.persistence.PersistenceGateway;
import com.presentos.core.persistence.TaskLookup;
import com.presentos.core.reconcile.ReconciliationLinker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes the action sequence the {@link RouteTable} lists for a normalized intent:
 * lookup → create → forward → reconcile.
 *
 * <p>Stateless. Only a failed create or a failed lookup changes the reported outcome;
 * once a record exists, forwarding and link failures are reported as warnings and
 * nothing is rolled back.
 */
@Service
public class DispatchRouter {

    private static final Logger log = LoggerFactory.getLogger(DispatchRouter.class);

    private final PersistenceGateway persistence;
    private final DownstreamForwarder forwarder;
    private final ReconciliationLinker linker;
    private final PayloadProjector projector;

    public DispatchRouter(PersistenceGateway persistence,
                          DownstreamForwarder forwarder,
                          ReconciliationLinker linker,
                          PayloadProjector projector) {
        this.persistence = persistence;
        this.forwarder = forwarder;
        this.linker = linker;
        this.projector = projector;
    }

    public RouteOutcome dispatch(String requestId, IntentRecord record, RawMessage message) {
        RoutePlan plan = RouteTable.planFor(record.intent());
        var outcome = RouteOutcome.builder(requestId, record.intent()).record(record);

        if (record instanceof UnknownIntent unknown) {
            log.info("Message not routed: {}", unknown.reason());
            return outcome.status(OutcomeStatus.UNKNOWN).raw(unknown.raw()).build();
        }

        TaskRecord stored = null;

        if (plan.lookupByTitle()) {
            String taskName = ((CompleteTaskIntent) record).taskName();
            TaskLookup lookup = persistence.findFirstByTitle(taskName);
            if (lookup.isFailed()) {
                return outcome.status(OutcomeStatus.NOT_FOUND)
                        .error(ErrorKind.NOT_FOUND, "Task lookup for '" + taskName + "' failed")
                        .warn("lookup", lookup.failure())
                        .build();
            }
            if (lookup.match() == null) {
                log.info("No task matches '{}'", taskName);
                return outcome.status(OutcomeStatus.NOT_FOUND)
                        .error(ErrorKind.NOT_FOUND, "No task matching '" + taskName + "'")
                        .build();
            }
            stored = lookup.match();
            outcome.taskId(stored.id());
            if (!persistence.patch(stored.id(), TaskField.STATUS, TaskStatus.COMPLETED)) {
                outcome.warn("status", "Could not mark task " + stored.id() + " as Completed");
            }
        }

        if (plan.persists()) {
            TaskRecord draft = TaskRecords.fromIntent(record, message.receivedAt().toOffsetDateTime());
            try {
                stored = draft.withId(persistence.create(draft));
            } catch (PersistenceException e) {
                return outcome.status(OutcomeStatus.FAILED)
                        .error(ErrorKind.PERSISTENCE_ERROR, e.getMessage())
                        .build();
            }
            outcome.taskId(stored.id());
        }

        if (plan.forwards() && record.forwardable()) {
            DownstreamResponse response = forwarder.forward(plan.handler(), projector.project(record, stored));
            outcome.downstream(response);
            if (!response.isSuccess()) {
                String detail = plan.handler() + " handler returned HTTP " + response.status();
                if (plan.forwardIsPrimary()) {
                    outcome.error(ErrorKind.DOWNSTREAM_ERROR, detail);
                } else {
                    outcome.warn("forward", detail);
                }
            } else if (plan.linkField() != null && stored != null) {
                String taskId = stored.id();
                linker.reconcile(taskId, response, plan.linkField()).ifPresentOrElse(
                        outcome::link,
                        () -> outcome.warn("link", "No " + plan.linkField().propertyName() + " attached to " + taskId));
            }
        } else if (plan.forwards()) {
            log.debug("{} has no due date; skipping {} handler", record.intent(), plan.handler());
        }

        return outcome.build();
    }
}
