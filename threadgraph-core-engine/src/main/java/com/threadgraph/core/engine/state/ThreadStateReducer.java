package com.threadgraph.core.engine.state;

import com.threadgraph.core.exception.ThreadGraphInvalidUpdateException;
import com.threadgraph.integration.models.state.ThreadState;
import com.threadgraph.integration.models.state.ThreadStateField;
import com.threadgraph.integration.models.state.ThreadStateUpdate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines a snapshot with a partial update according to the merge policy of each field.
 *
 * <p>The whole update is validated before anything is applied: a rejected update leaves no trace.
 * Fields absent from the update keep their value. Append-only fields only ever grow.
 */
@Slf4j
public class ThreadStateReducer {

    public ThreadState merge(ThreadState base, ThreadStateUpdate update) {
        if (update == null || update.isEmpty()) {
            return base;
        }
        update.asMap().forEach(this::validate);

        Map<ThreadStateField, Object> merged = new EnumMap<>(ThreadStateField.class);
        merged.putAll(base.getValues());
        update.asMap().forEach((field, value) -> {
            switch (field.getMergePolicy()) {
                case APPEND -> merged.put(field, concat(base, field, (List<?>) value));
                case OVERWRITE -> {
                    if (value == null) {
                        merged.remove(field);
                    } else {
                        merged.put(field, value);
                    }
                }
            }
        });
        log.trace("Merged update into thread {}: {}", base.getThreadId(), update.fields());
        return base.toBuilder().values(merged).build();
    }

    private List<Object> concat(ThreadState base, ThreadStateField field, List<?> additions) {
        List<?> existing = (List<?>) base.get(field);
        List<Object> combined = new ArrayList<>((existing == null ? 0 : existing.size()) + additions.size());
        if (existing != null) {
            combined.addAll(existing);
        }
        combined.addAll(additions);
        return combined;
    }

    private void validate(ThreadStateField field, Object value) {
        if (field.isAppendOnly()) {
            if (!(value instanceof List<?> elements)) {
                throw new ThreadGraphInvalidUpdateException(field, "append-only field expects a sequence of elements");
            }
            for (Object element : elements) {
                if (element == null) {
                    throw new ThreadGraphInvalidUpdateException(field, "sequence elements cannot be absent");
                }
                checkValue(field, element);
            }
            return;
        }
        if (value != null) {
            checkValue(field, value);
        }
    }

    private void checkValue(ThreadStateField field, Object value) {
        if (!field.getValueType().isInstance(value)) {
            throw new ThreadGraphInvalidUpdateException(field,
                    "expected " + field.getValueType().getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
        if (!field.accepts(value)) {
            throw new ThreadGraphInvalidUpdateException(field, value + " " + field.getConstraintDescription());
        }
    }
}
