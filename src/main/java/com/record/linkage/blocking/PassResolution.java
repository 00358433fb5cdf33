package com.record.linkage.blocking;

import com.record.linkage.core.model.FieldMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of mapping a pass's logical variables onto both sides' field maps.
 * Either a concrete {@link BlockingKey}, or the reason the pass cannot run.
 */
public record PassResolution(PassDefinition pass, BlockingKey key, Set<String> missingFields) {

    public PassResolution {
        missingFields = Collections.unmodifiableSet(new LinkedHashSet<>(missingFields));
    }

    public static PassResolution resolve(PassDefinition pass, FieldMap fieldsA, FieldMap fieldsB) {
        if (pass.variables().isEmpty()) {
            return new PassResolution(pass, null, Set.of());
        }
        List<String> columnsA = new ArrayList<>();
        List<String> columnsB = new ArrayList<>();
        Set<String> missing = new LinkedHashSet<>();
        for (String variable : pass.variables()) {
            Optional<String> columnA = fieldsA.column(variable);
            Optional<String> columnB = fieldsB.column(variable);
            if (columnA.isEmpty() || columnB.isEmpty()) {
                missing.add(variable);
                continue;
            }
            columnsA.add(columnA.get());
            columnsB.add(columnB.get());
        }
        if (!missing.isEmpty()) {
            return new PassResolution(pass, null, missing);
        }
        if (pass.isInverted()) {
            Collections.reverse(columnsB);
        }
        return new PassResolution(pass, new BlockingKey(columnsA, columnsB), Set.of());
    }

    public boolean isResolved() {
        return key != null;
    }

    public boolean hasNoVariables() {
        return key == null && missingFields.isEmpty();
    }
}
