package com.marketalert.scheduler.task;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.state.AlertState;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * "Still alive" message while the market is closed, carrying the loop tick count.
 */
public class HeartbeatTask implements AlertTask {

    private final AlertState state;
    private final AlertDispatcher dispatcher;

    public HeartbeatTask(AlertState state, AlertDispatcher dispatcher) {
        this.state      = state;
        this.dispatcher = dispatcher;
    }

    @Override
    public String name() {
        return "closed-heartbeat";
    }

    @Override
    public Mono<Integer> run(Instant now) {
        return Mono.defer(() -> dispatcher.dispatch(AlertKind.HEARTBEAT, "-",
                                                    AlertMessageFormatter.heartbeat(state.loopTicks()))
            .thenReturn(1));
    }
}
