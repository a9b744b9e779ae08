package com.ryuqq.decider.testkit.fixture;

/**
 * 고양이 Event.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface CatEvent permits CatEvent.WokeUp, CatEvent.GotToSleep {

    record WokeUp() implements CatEvent {
    }

    record GotToSleep() implements CatEvent {
    }
}
