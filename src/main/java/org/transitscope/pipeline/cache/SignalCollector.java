package org.transitscope.pipeline.cache;

import org.transitscope.host.ComponentKind;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostRecord;
import org.transitscope.host.HostValues;
import org.transitscope.pipeline.geometry.PositionReader;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Signal;
import org.transitscope.pipeline.model.SignalState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads signal positions and aspects. Loader behind the signal cache.
 */
public class SignalCollector {

    /** Fields of the signal component that may carry the aspect, in priority order. */
    static final List<String> STATE_FIELDS = List.of("state", "signalState", "mainState", "aspect", "value");

    private final EntityAccessor accessor;

    public SignalCollector(EntityAccessor accessor) {
        this.accessor = accessor;
    }

    public List<Signal> load() {
        List<Signal> signals = new ArrayList<>();
        for (long id : accessor.enumerate(EntityKind.SIGNAL)) {
            Point position = accessor.getEntity(id)
                    .flatMap(PositionReader::entityPosition)
                    .orElse(Point.ORIGIN);
            signals.add(new Signal(id, position, stateOf(id)));
        }
        return signals;
    }

    private SignalState stateOf(long id) {
        Optional<HostRecord> component = accessor.getComponent(id, ComponentKind.SIGNAL);
        if (component.isEmpty()) {
            return SignalState.UNKNOWN;
        }
        Object raw = component.get().first(STATE_FIELDS);
        if (raw == null) {
            return SignalState.UNKNOWN;
        }
        return SignalState.fromHostValue(HostValues.safeInt(raw));
    }
}
