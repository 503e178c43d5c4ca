package com.marketalert.common.provider;

import com.marketalert.common.model.AlertKind;
import reactor.core.publisher.Mono;

/**
 * Messaging sink for formatted alerts.
 *
 * <p>Emits {@code true} when the sink accepted the message and {@code false} on any
 * failure. Never signals an error and always completes within its own timeout.
 */
public interface AlertNotifier {

    Mono<Boolean> send(String text, AlertKind kind);
}
