package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.adapter.inmemory.store.InMemoryContainer;
import com.ryuqq.decider.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.decider.application.runtime.DeciderRuntime;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.testkit.fixture.BulbCommand;
import com.ryuqq.decider.testkit.fixture.BulbDecider;
import com.ryuqq.decider.testkit.fixture.BulbEvent;
import com.ryuqq.decider.testkit.fixture.BulbState;
import com.ryuqq.decider.testkit.fixture.BulbStateCodec;
import com.ryuqq.decider.testkit.fixture.CatCommand;
import com.ryuqq.decider.testkit.fixture.CatDecider;
import com.ryuqq.decider.testkit.fixture.CatEvent;
import com.ryuqq.decider.testkit.fixture.CatState;
import com.ryuqq.decider.testkit.fixture.CatStateCodec;
import org.junit.jupiter.api.Named;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 모든 Runtime에서 같은 시나리오가 같은 결과를 내는지 검증.
 *
 * <p>InMemory / StateSnapshot / EventSourcing Runtime을 동일한 Bulb, Cat 시나리오로 실행합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
class RuntimeScenarioTest {

    static Stream<Arguments> bulbRuntimes() {
        BulbDecider decider = new BulbDecider();
        AggregateKey key = AggregateKey.of("bulb-1");
        return Stream.of(
            Arguments.of(Named.of("in-memory", new InMemoryRuntime<>(decider))),
            Arguments.of(Named.of("state-snapshot",
                new StateSnapshotRuntime<>(decider, new InMemoryContainer(), new BulbStateCodec(), key))),
            Arguments.of(Named.of("event-sourcing",
                new EventSourcingRuntime<>(decider, new InMemoryEventStore<BulbEvent>(), key)))
        );
    }

    static Stream<Arguments> catRuntimes() {
        CatDecider decider = new CatDecider();
        AggregateKey key = AggregateKey.of("cat-1");
        return Stream.of(
            Arguments.of(Named.of("in-memory", new InMemoryRuntime<>(decider))),
            Arguments.of(Named.of("state-snapshot",
                new StateSnapshotRuntime<>(decider, new InMemoryContainer(), new CatStateCodec(), key))),
            Arguments.of(Named.of("event-sourcing",
                new EventSourcingRuntime<>(decider, new InMemoryEventStore<CatEvent>(), key)))
        );
    }

    @ParameterizedTest
    @MethodSource("bulbRuntimes")
    void bulb_FitSwitchOnOffOn_BlowsAndStaysBlown(DeciderRuntime<BulbCommand, BulbEvent, BulbState> runtime) {
        assertThat(runtime.decide(new BulbCommand.Fit(1))).containsExactly(new BulbEvent.Fitted(1));
        assertThat(runtime.decide(new BulbCommand.SwitchOn())).containsExactly(new BulbEvent.SwitchedOn());
        assertThat(runtime.decide(new BulbCommand.SwitchOff())).containsExactly(new BulbEvent.SwitchedOff());
        assertThat(runtime.decide(new BulbCommand.SwitchOn())).containsExactly(new BulbEvent.Blew());

        assertThat(runtime.decide(new BulbCommand.SwitchOn())).isEmpty();
        assertThat(runtime.decide(new BulbCommand.SwitchOff())).isEmpty();
        assertThat(runtime.state()).isEqualTo(new BulbState.Blown());
        assertThat(runtime.decider().isTerminal(runtime.state())).isTrue();
    }

    @ParameterizedTest
    @MethodSource("bulbRuntimes")
    void bulb_StateReflectsRemainingUses(DeciderRuntime<BulbCommand, BulbEvent, BulbState> runtime) {
        runtime.decide(new BulbCommand.Fit(3));
        runtime.decide(new BulbCommand.SwitchOn());

        assertThat(runtime.state()).isEqualTo(new BulbState.Working(BulbState.Status.ON, 2));
    }

    @ParameterizedTest
    @MethodSource("bulbRuntimes")
    void bulb_InvalidCommand_ThrowsAndLeavesStateUnchanged(DeciderRuntime<BulbCommand, BulbEvent, BulbState> runtime) {
        runtime.decide(new BulbCommand.Fit(2));

        assertThatThrownBy(() -> runtime.decide(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(runtime.state()).isEqualTo(new BulbState.Working(BulbState.Status.OFF, 2));
    }

    @ParameterizedTest
    @MethodSource("catRuntimes")
    void cat_SleepAndWake(DeciderRuntime<CatCommand, CatEvent, CatState> runtime) {
        assertThat(runtime.decide(new CatCommand.WakeUp())).isEmpty();
        assertThat(runtime.decide(new CatCommand.GoToSleep())).containsExactly(new CatEvent.GotToSleep());
        assertThat(runtime.state()).isEqualTo(new CatState.Asleep());
        assertThat(runtime.decide(new CatCommand.WakeUp())).containsExactly(new CatEvent.WokeUp());
        assertThat(runtime.state()).isEqualTo(new CatState.Awake());
    }
}
