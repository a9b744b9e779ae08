package com.ryuqq.decider.testkit.fixture;

/**
 * 고양이 Command.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface CatCommand permits CatCommand.WakeUp, CatCommand.GoToSleep {

    record WakeUp() implements CatCommand {
    }

    record GoToSleep() implements CatCommand {
    }
}
