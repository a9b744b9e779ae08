package com.ryuqq.decider.testkit.fixture;

import com.ryuqq.decider.core.contract.Decider;
import com.ryuqq.decider.testkit.fixture.BulbCommand.Fit;
import com.ryuqq.decider.testkit.fixture.BulbCommand.SwitchOff;
import com.ryuqq.decider.testkit.fixture.BulbCommand.SwitchOn;
import com.ryuqq.decider.testkit.fixture.BulbEvent.Blew;
import com.ryuqq.decider.testkit.fixture.BulbEvent.Fitted;
import com.ryuqq.decider.testkit.fixture.BulbEvent.SwitchedOff;
import com.ryuqq.decider.testkit.fixture.BulbEvent.SwitchedOn;
import com.ryuqq.decider.testkit.fixture.BulbState.Blown;
import com.ryuqq.decider.testkit.fixture.BulbState.NotFitted;
import com.ryuqq.decider.testkit.fixture.BulbState.Status;
import com.ryuqq.decider.testkit.fixture.BulbState.Working;

import java.util.List;

/**
 * 전구 Decider (테스트 픽스처).
 *
 * <p><strong>업무 규칙:</strong></p>
 * <ul>
 *   <li>NotFitted에서 Fit → Fitted</li>
 *   <li>Working(OFF, 0)에서 SwitchOn → Blew</li>
 *   <li>Working(OFF, n &gt; 0)에서 SwitchOn → SwitchedOn</li>
 *   <li>Working(ON)에서 SwitchOff → SwitchedOff</li>
 *   <li>그 외 조합 → 아무 일도 일어나지 않음</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class BulbDecider implements Decider<BulbCommand, BulbEvent, BulbState> {

    @Override
    public BulbState initialState() {
        return new NotFitted();
    }

    @Override
    public boolean isTerminal(BulbState state) {
        return state instanceof Blown;
    }

    @Override
    public List<BulbEvent> decide(BulbCommand command, BulbState state) {
        if (command instanceof Fit fit) {
            return state instanceof NotFitted ? List.of(new Fitted(fit.maxUses())) : List.of();
        }
        if (command instanceof SwitchOn) {
            if (state instanceof Working working && working.status() == Status.OFF) {
                return working.remainingUses() == 0 ? List.of(new Blew()) : List.of(new SwitchedOn());
            }
            return List.of();
        }
        if (command instanceof SwitchOff) {
            if (state instanceof Working working && working.status() == Status.ON) {
                return List.of(new SwitchedOff());
            }
            return List.of();
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }

    @Override
    public BulbState evolve(BulbState state, BulbEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Unknown event: null");
        }
        // 끊어진 전구는 어떤 이벤트도 흡수
        if (state instanceof Blown) {
            return state;
        }
        if (state instanceof NotFitted && event instanceof Fitted fitted) {
            return new Working(Status.OFF, fitted.maxUses());
        }
        if (state instanceof Working working) {
            if (event instanceof SwitchedOn) {
                return new Working(Status.ON, working.remainingUses() - 1);
            }
            if (event instanceof SwitchedOff) {
                return new Working(Status.OFF, working.remainingUses());
            }
            if (event instanceof Blew) {
                return new Blown();
            }
        }
        throw new IllegalArgumentException("Cannot apply " + event + " to " + state);
    }

    @Override
    public String toString() {
        return "Bulb";
    }
}
