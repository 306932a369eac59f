package org.transitscope.pipeline.cache;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.transitscope.host.ComponentKind;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.pipeline.model.Point;
import org.transitscope.pipeline.model.Signal;
import org.transitscope.pipeline.model.SignalState;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SignalCollectorTest {

    @Test
    void normalizesSignalStates() {
        FixtureHostApi host = FixtureHostApi.builder()
                .entity(EntityKind.SIGNAL, 60, Map.of("position", List.of(120, 210, 0)))
                .entity(EntityKind.SIGNAL, 61, Map.of("position", List.of(1, 2)))
                .entity(EntityKind.SIGNAL, 62, Map.of())
                .entity(EntityKind.SIGNAL, 63, Map.of())
                .component(ComponentKind.SIGNAL, 60, Map.of("state", 1))
                .component(ComponentKind.SIGNAL, 61, Map.of("aspect", 0))
                .component(ComponentKind.SIGNAL, 62, Map.of("value", 3))
                .build();

        List<Signal> signals = new SignalCollector(new EntityAccessor(host)).load();

        assertThat(signals).containsExactly(
                new Signal(60, new Point(120, 210, 0), SignalState.PROCEED),
                new Signal(61, new Point(1, 2, 0), SignalState.STOP),
                new Signal(62, Point.ORIGIN, SignalState.PROCEED),
                new Signal(63, Point.ORIGIN, SignalState.UNKNOWN));
    }
}
