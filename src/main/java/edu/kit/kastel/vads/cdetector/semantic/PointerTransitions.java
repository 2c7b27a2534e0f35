package edu.kit.kastel.vads.cdetector.semantic;

import java.util.EnumMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.diagnostic.Category;

/// The pointer lifecycle as data: the state each event leads to and the fault it reveals.
/// A missing entry is a bug in the table, never a property of the analyzed program.
public final class PointerTransitions {
    private static final Map<PointerState, Map<PointerEvent, PointerState>> NEXT = new EnumMap<>(PointerState.class);
    private static final Map<PointerState, Map<PointerEvent, Category>> FAULTS = new EnumMap<>(PointerState.class);

    static {
        for (PointerState state : PointerState.values()) {
            Map<PointerEvent, PointerState> next = new EnumMap<>(PointerEvent.class);
            next.put(PointerEvent.ASSIGN_NULL, PointerState.NULL);
            next.put(PointerEvent.ASSIGN_ALLOCATION, PointerState.ALLOCATED);
            next.put(PointerEvent.ASSIGN_ADDRESS, PointerState.VALID);
            next.put(PointerEvent.DEREFERENCE, state);
            NEXT.put(state, next);
            FAULTS.put(state, new EnumMap<>(PointerEvent.class));
        }
        free(PointerState.UNKNOWN, PointerState.FREED);
        // free(NULL) does nothing
        free(PointerState.NULL, PointerState.NULL);
        free(PointerState.VALID, PointerState.FREED);
        free(PointerState.ALLOCATED, PointerState.FREED);
        free(PointerState.FREED, PointerState.FREED);

        fault(PointerState.UNKNOWN, PointerEvent.DEREFERENCE, Category.WILD_POINTER);
        fault(PointerState.NULL, PointerEvent.DEREFERENCE, Category.NULL_DEREFERENCE);
        fault(PointerState.FREED, PointerEvent.DEREFERENCE, Category.USE_AFTER_FREE);
        fault(PointerState.FREED, PointerEvent.FREE, Category.DOUBLE_FREE);
    }

    private PointerTransitions() {
    }

    private static void free(PointerState from, PointerState to) {
        NEXT.get(from).put(PointerEvent.FREE, to);
    }

    private static void fault(PointerState state, PointerEvent event, Category category) {
        FAULTS.get(state).put(event, category);
    }

    public static PointerState next(PointerState state, PointerEvent event) {
        PointerState next = NEXT.get(state).get(event);
        if (next == null) {
            throw new SemanticException("no transition for " + event + " in state " + state);
        }
        return next;
    }

    public static @Nullable Category fault(PointerState state, PointerEvent event) {
        return FAULTS.get(state).get(event);
    }
}
