package com.liftlog.projection;

import com.liftlog.contract.EventPayload;
import com.liftlog.store.EventRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Maintains the user's workout templates in creation order and counts how often
 * each one is used to start a workout.
 */
public class TemplateReducer implements ProjectionReducer<List<WorkoutTemplate>> {

    @Override
    public List<String> keysFor(EventRecord event, ReductionContext context) {
        return switch (event.type()) {
            case TEMPLATE_CREATED, TEMPLATE_UPDATED, TEMPLATE_DELETED -> List.of(ProjectionKeys.TEMPLATES);
            case WORKOUT_STARTED -> {
                String templateId = event.payloadAs(EventPayload.WorkoutStarted.class).fromTemplateId();
                yield templateId != null && context.prior().template(templateId).isPresent()
                    ? List.of(ProjectionKeys.TEMPLATES)
                    : List.of();
            }
            default -> List.of();
        };
    }

    @Override
    public List<WorkoutTemplate> initialState(String key) {
        return List.of();
    }

    @Override
    public List<WorkoutTemplate> reduce(String key, List<WorkoutTemplate> prior, EventRecord event,
                                        ReductionContext context) {
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.TemplateCreated created) {
            if (indexOf(prior, created.templateId()) >= 0) {
                context.referenceMiss(created.templateId());
                return prior;
            }
            List<WorkoutTemplate> next = new ArrayList<>(prior);
            next.add(new WorkoutTemplate(created.templateId(), created.name(), created.exerciseIds(),
                created.sourceWorkoutId(), event.timestamp(), null, 0));
            return List.copyOf(next);
        }
        if (payload instanceof EventPayload.TemplateUpdated updated) {
            return replace(prior, updated.templateId(), context,
                t -> t.patched(updated.name(), updated.exerciseIds()));
        }
        if (payload instanceof EventPayload.TemplateDeleted deleted) {
            return replace(prior, deleted.templateId(), context, t -> null);
        }
        if (payload instanceof EventPayload.WorkoutStarted started) {
            return replace(prior, started.fromTemplateId(), context, t -> t.used(event.timestamp()));
        }
        return prior;
    }

    private List<WorkoutTemplate> replace(List<WorkoutTemplate> prior, String templateId, ReductionContext context,
                                          UnaryOperator<WorkoutTemplate> change) {
        int index = indexOf(prior, templateId);
        if (index < 0) {
            context.referenceMiss(templateId);
            return prior;
        }
        List<WorkoutTemplate> next = new ArrayList<>(prior);
        WorkoutTemplate changed = change.apply(prior.get(index));
        if (changed == null) {
            next.remove(index);
        } else {
            next.set(index, changed);
        }
        return List.copyOf(next);
    }

    private static int indexOf(List<WorkoutTemplate> templates, String templateId) {
        for (int i = 0; i < templates.size(); i++) {
            if (templates.get(i).templateId().equals(templateId)) {
                return i;
            }
        }
        return -1;
    }
}
