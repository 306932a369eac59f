package org.transitscope.host;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.transitscope.host.capability.Capability;
import org.transitscope.host.fixture.FixtureHostApi;
import org.transitscope.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EntityAccessorTest {

    @Test
    void enumerateFallsBackToEntityTypeListWhenDedicatedGetterIsMissing() {
        FixtureHostApi host = FixtureHostApi.builder()
                .withoutFunction(HostFunctions.GI_GET_VEHICLES)
                .entity(EntityKind.VEHICLE, 5, Map.of("name", "Tram 5"))
                .entity(EntityKind.VEHICLE, 6, Map.of("name", "Tram 6"))
                .build();

        List<Long> ids = new EntityAccessor(host).enumerate(EntityKind.VEHICLE);

        assertThat(ids).containsExactly(5L, 6L);
        assertThat(host.invocationCount(HostFunctions.GI_GET_VEHICLES)).isZero();
    }

    @Test
    void failingCandidateIsSkippedInFavourOfTheNextOne() {
        FixtureHostApi host = FixtureHostApi.builder()
                .failing(HostFunctions.GI_GET_VEHICLES)
                .entity(EntityKind.VEHICLE, 5, Map.of("name", "Tram 5"))
                .build();

        assertThat(new EntityAccessor(host).enumerate(EntityKind.VEHICLE)).containsExactly(5L);
        assertThat(host.invocationCount(HostFunctions.GI_GET_VEHICLES)).isEqualTo(1);
    }

    @Test
    void getVehicleFallsBackToGenericEntityGetter() {
        FixtureHostApi host = FixtureHostApi.builder()
                .withoutFunction(HostFunctions.GI_GET_VEHICLE)
                .entity(EntityKind.VEHICLE, 5, Map.of("name", "Tram 5"))
                .build();

        assertThat(new EntityAccessor(host).getVehicle(5))
                .hasValueSatisfying(record -> assertThat(record.string("name")).isEqualTo("Tram 5"));
    }

    @Test
    void nonPositiveIdsAreNeverSentToTheHost() {
        FixtureHostApi host = FixtureHostApi.builder().build();
        EntityAccessor accessor = new EntityAccessor(host);

        assertThat(accessor.getEntity(0)).isEmpty();
        assertThat(accessor.getLine(-3)).isEmpty();
        assertThat(host.invocationCount(HostFunctions.GI_GET_ENTITY)).isZero();
        assertThat(host.invocationCount(HostFunctions.GI_GET_LINE)).isZero();
    }

    @Test
    void hostExceptionsBecomeEmptyResults() {
        IHostApi host = new IHostApi() {
            @Override
            public Set<String> functions() {
                return Set.of(HostFunctions.GI_GET_ENTITY, HostFunctions.GI_GET_GAME_TIME);
            }

            @Override
            public Object invoke(String function, Object... args) throws Exception {
                throw new IOException("host went away");
            }

            @Override
            public Map<String, Object> constants(String table) {
                return Map.of();
            }
        };
        EntityAccessor accessor = new EntityAccessor(host);

        assertThat(accessor.supports(Capability.GET_ENTITY)).isTrue();
        assertThat(accessor.getEntity(7)).isEmpty();
        assertThat(accessor.gameTime()).isEmpty();
        assertThat(accessor.getComponent(7, ComponentKind.SIGNAL)).isEmpty();
    }

    @Test
    void linkageErrorsFromTheHostAreSkippedLikeExceptions() {
        FixtureHostApi fixture = FixtureHostApi.builder()
                .entity(EntityKind.VEHICLE, 5, Map.of("name", "Tram 5"))
                .build();
        IHostApi host = new IHostApi() {
            @Override
            public Set<String> functions() {
                return fixture.functions();
            }

            @Override
            public Object invoke(String function, Object... args) throws Exception {
                if (function.equals(HostFunctions.GI_GET_VEHICLE)) {
                    throw new NoSuchMethodError("getVehicle(J)");
                }
                if (function.equals(HostFunctions.GI_GET_GAME_TIME)) {
                    throw new AbstractMethodError("getGameTime()");
                }
                return fixture.invoke(function, args);
            }

            @Override
            public Map<String, Object> constants(String table) {
                return fixture.constants(table);
            }
        };
        EntityAccessor accessor = new EntityAccessor(host);

        assertThat(accessor.getVehicle(5))
                .hasValueSatisfying(record -> assertThat(record.string("name")).isEqualTo("Tram 5"));
        assertThat(accessor.gameTime()).isEmpty();
    }

    @Test
    void virtualMachineErrorsAreNotAbsorbed() {
        IHostApi host = new IHostApi() {
            @Override
            public Set<String> functions() {
                return Set.of(HostFunctions.GI_GET_ENTITY);
            }

            @Override
            public Object invoke(String function, Object... args) {
                throw new OutOfMemoryError("heap");
            }

            @Override
            public Map<String, Object> constants(String table) {
                return Map.of();
            }
        };

        assertThatThrownBy(() -> new EntityAccessor(host).getEntity(7)).isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void getComponentResolvesTheComponentTypeConstant() {
        FixtureHostApi host = FixtureHostApi.builder()
                .component(ComponentKind.SIGNAL, 60, Map.of("state", 1))
                .build();
        EntityAccessor accessor = new EntityAccessor(host);

        assertThat(accessor.getComponent(60, ComponentKind.SIGNAL))
                .hasValueSatisfying(record -> assertThat(record.integer("state")).isEqualTo(1));
        assertThat(accessor.getComponent(60, ComponentKind.TRACK_EDGE)).isEmpty();
    }

    @Test
    void enumerateRegionOnlyReturnsEntitiesInsideTheRadius() {
        FixtureHostApi host = FixtureHostApi.builder()
                .entity(EntityKind.EDGE, 70, Map.of("position", List.of(10.0, 10.0)))
                .entity(EntityKind.EDGE, 71, Map.of("position", List.of(900.0, 900.0)))
                .entity(EntityKind.SIGNAL, 72, Map.of("position", List.of(5.0, 5.0)))
                .build();

        List<Long> ids = new EntityAccessor(host).enumerateRegion(new RegionBounds(0, 0, 100), EntityKind.EDGE);

        assertThat(ids).containsExactly(70L);
    }

    @Test
    void gameTimeIsPassedThroughUnchanged() {
        Map<String, Object> time = Map.of("date", Map.of("year", 1900));
        FixtureHostApi host = FixtureHostApi.builder().gameTime(time).build();

        assertThat(new EntityAccessor(host).gameTime()).contains(time);
    }

    @Test
    void extractIdsReadsSequencesKeysAndValues() {
        assertThat(EntityAccessor.extractIds(List.of(3, 1, 3, 0, -2, Map.of("entity", 9))))
                .containsExactly(3L, 1L, 9L);

        Map<Object, Object> keyed = new LinkedHashMap<>();
        keyed.put(12L, "x");
        keyed.put(15L, "y");
        assertThat(EntityAccessor.extractIds(keyed)).containsExactly(12L, 15L);

        Map<Object, Object> named = new LinkedHashMap<>();
        named.put("first", 21);
        named.put("second", Map.of("id", 22));
        assertThat(EntityAccessor.extractIds(named)).containsExactly(21L, 22L);

        assertThat(EntityAccessor.extractIds("nonsense")).isEmpty();
    }
}
