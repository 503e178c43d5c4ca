package com.marketalert.scheduler.dispatch;

import com.marketalert.common.model.AlertKind;
import com.marketalert.common.provider.AlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Single exit point towards the messaging sink.
 *
 * <p>Callers reach this only after the cooldown ledger has authorised the alert. A failed
 * send is logged and reported as {@code false}; it is not retried within the cycle.
 */
@Component
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final AlertNotifier notifier;

    public AlertDispatcher(AlertNotifier notifier) {
        this.notifier = notifier;
    }

    public Mono<Boolean> dispatch(AlertKind kind, String symbol, String text) {
        log.info("ALERT_FIRED kind={} symbol={}", kind, symbol);
        return notifier.send(text, kind)
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.error("Notifier raised instead of reporting failure. kind={} symbol={}", kind, symbol, e);
                return Mono.just(false);
            })
            .doOnNext(ok -> {
                if (!ok) {
                    log.warn("ALERT_NOT_DELIVERED kind={} symbol={}", kind, symbol);
                }
            });
    }
}
