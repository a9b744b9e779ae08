package com.ryuqq.decider.testkit.fixture;

import com.ryuqq.decider.core.contract.Decider;
import com.ryuqq.decider.testkit.fixture.CatCommand.GoToSleep;
import com.ryuqq.decider.testkit.fixture.CatCommand.WakeUp;
import com.ryuqq.decider.testkit.fixture.CatEvent.GotToSleep;
import com.ryuqq.decider.testkit.fixture.CatEvent.WokeUp;
import com.ryuqq.decider.testkit.fixture.CatState.Asleep;
import com.ryuqq.decider.testkit.fixture.CatState.Awake;

import java.util.List;

/**
 * 고양이 Decider (테스트 픽스처).
 *
 * <ul>
 *   <li>Asleep에서 WakeUp → WokeUp</li>
 *   <li>Awake에서 GoToSleep → GotToSleep</li>
 *   <li>그 외 조합 → 아무 일도 일어나지 않음</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class CatDecider implements Decider<CatCommand, CatEvent, CatState> {

    @Override
    public CatState initialState() {
        return new Awake();
    }

    @Override
    public boolean isTerminal(CatState state) {
        return false;
    }

    @Override
    public List<CatEvent> decide(CatCommand command, CatState state) {
        if (command instanceof WakeUp) {
            return state instanceof Asleep ? List.of(new WokeUp()) : List.of();
        }
        if (command instanceof GoToSleep) {
            return state instanceof Awake ? List.of(new GotToSleep()) : List.of();
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }

    @Override
    public CatState evolve(CatState state, CatEvent event) {
        if (state instanceof Asleep && event instanceof WokeUp) {
            return new Awake();
        }
        if (state instanceof Awake && event instanceof GotToSleep) {
            return new Asleep();
        }
        throw new IllegalArgumentException("Cannot apply " + event + " to " + state);
    }

    @Override
    public String toString() {
        return "Cat";
    }
}
