package com.marketalert.scheduler.task;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * One unit of periodic work driven by the scheduling loop.
 */
public interface AlertTask {

    String name();

    /**
     * @param now loop time of the tick that found this task due
     * @return number of alerts handed to the notifier
     */
    Mono<Integer> run(Instant now);
}
