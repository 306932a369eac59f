package org.transitscope.host.capability;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.transitscope.host.EntityAccessor;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostFunctions;
import org.transitscope.host.IHostApi;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.junit.extensions.logging.LogWatchExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CapabilityTableTest {

    @Test
    void probesTheHostOnlyOnce() {
        FixtureHostApi host = FixtureHostApi.builder()
                .entity(EntityKind.VEHICLE, 1, Map.of("name", "A"))
                .build();
        EntityAccessor accessor = new EntityAccessor(host);

        for (int i = 0; i < 5; i++) {
            accessor.enumerate(EntityKind.VEHICLE);
            accessor.enumerate(EntityKind.LINE);
            accessor.gameTime();
        }

        assertThat(host.functionQueryCount()).isEqualTo(1);
    }

    @Test
    void vehicleCandidatesFollowTheDeclaredOrder() {
        FixtureHostApi host = FixtureHostApi.builder()
                .entityTypes(Map.of("VEHICLE", 101, "TRAIN_VEHICLE", 150, "LINE", 102))
                .build();

        List<String> labels = CapabilityTable.probe(host).candidates(Capability.ENUMERATE_VEHICLES).stream()
                .map(ProbeCandidate::label)
                .toList();

        assertThat(labels).hasSize(18);
        assertThat(labels.subList(0, 4)).containsExactly(
                "game.interface.getVehicles()",
                "api.engine.getEntityList(ET.VEHICLE)",
                "api.engine.getEntityList(ET.TRAIN_VEHICLE)",
                "api.engine.getEntityList(10)");
        assertThat(labels.get(17)).isEqualTo("api.engine.getEntityList(1)");
    }

    @Test
    void lineCandidatesUseTheNamedEntityListWhenDedicatedGetterIsMissing() {
        FixtureHostApi host = FixtureHostApi.builder()
                .withoutFunction(HostFunctions.GI_GET_LINES)
                .withFunction(HostFunctions.GI_GET_ENTITY_LIST)
                .build();

        List<ProbeCandidate> candidates = CapabilityTable.probe(host).candidates(Capability.ENUMERATE_LINES);

        assertThat(candidates).extracting(ProbeCandidate::function)
                .containsOnly(HostFunctions.GI_GET_ENTITY_LIST);
        assertThat(candidates).extracting(c -> c.fixedArgs().get(0))
                .containsExactly("LINE", "entity.LINE", "TRANSPORT_LINE");
    }

    @Test
    void capabilityWithoutAnyHostFunctionIsUnavailable() {
        FixtureHostApi host = FixtureHostApi.builder()
                .withoutFunction(HostFunctions.GI_GET_GAME_TIME)
                .build();

        CapabilityTable table = CapabilityTable.probe(host);

        assertThat(table.isAvailable(Capability.GAME_TIME)).isFalse();
        assertThat(table.isAvailable(Capability.ENUMERATE_VEHICLES)).isTrue();
        assertThat(table.render()).contains("GAME_TIME: UNAVAILABLE");
    }

    @Test
    void componentAccessNeedsTheComponentTypeTable() {
        FixtureHostApi host = FixtureHostApi.builder()
                .componentTypes(Map.of())
                .build();

        CapabilityTable table = CapabilityTable.probe(host);

        assertThat(table.isAvailable(Capability.GET_COMPONENT)).isFalse();
        assertThat(table.render()).contains(HostFunctions.COMPONENT_TYPES + ": missing");
    }

    @Test
    void hostRefusingToListFunctionsLeavesEverythingUnavailable() {
        IHostApi broken = new IHostApi() {
            @Override
            public Set<String> functions() {
                throw new IllegalStateException("interface not ready");
            }

            @Override
            public Object invoke(String function, Object... args) {
                throw new IllegalStateException("interface not ready");
            }

            @Override
            public Map<String, Object> constants(String table) {
                throw new IllegalStateException("interface not ready");
            }
        };

        CapabilityTable table = CapabilityTable.probe(broken);

        for (Capability capability : Capability.values()) {
            assertThat(table.isAvailable(capability)).as(capability.name()).isFalse();
        }
        assertThat(new EntityAccessor(broken, table).enumerate(EntityKind.STATION)).isEmpty();
    }

    @Test
    void hostWithAnIncompatibleInterfaceIsProbedAsEmpty() {
        IHostApi incompatible = new IHostApi() {
            @Override
            public Set<String> functions() {
                throw new NoSuchMethodError("functions()");
            }

            @Override
            public Object invoke(String function, Object... args) {
                throw new NoSuchMethodError(function);
            }

            @Override
            public Map<String, Object> constants(String table) {
                throw new IncompatibleClassChangeError(table);
            }
        };

        CapabilityTable table = CapabilityTable.probe(incompatible);

        assertThat(table.isAvailable(Capability.GET_ENTITY)).isFalse();
        assertThat(new EntityAccessor(incompatible, table).gameTime()).isEmpty();
    }

    @Test
    void reportListsCandidatesAndConstantTables() {
        String report = CapabilityTable.probe(FixtureHostApi.builder().build()).render();

        assertThat(report).startsWith("TransitScope host capability report\n");
        assertThat(report).contains("ENUMERATE_STATIONS: AVAILABLE via game.interface.getStations()");
        assertThat(report).contains("entity types:\n");
        assertThat(report).contains("  VEHICLE = 101\n");
        assertThat(report).contains("component types (first 20):\n");
    }
}
