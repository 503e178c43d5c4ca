package com.marketalert.scheduler.job;

import com.marketalert.common.format.AlertMessageFormatter;
import com.marketalert.common.model.AlertKind;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Owns the loop thread. Starts it once the context is refreshed and stops it when the
 * context closes (SIGINT/SIGTERM through the JVM shutdown hook), announcing both on the sink.
 */
public class AlertSchedulerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertSchedulerLifecycle.class);

    private final AlertLoop loop;
    private final AlertDispatcher dispatcher;
    private final Duration noticeTimeout;
    private final boolean autoStartup;

    private volatile Thread worker;

    public AlertSchedulerLifecycle(AlertLoop loop, AlertDispatcher dispatcher, Duration noticeTimeout, boolean autoStartup) {
        this.loop          = loop;
        this.dispatcher    = dispatcher;
        this.noticeTimeout = noticeTimeout;
        this.autoStartup   = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        announce(AlertKind.STARTUP, AlertMessageFormatter.startup());
        Thread thread = new Thread(loop, "alert-loop");
        thread.setDaemon(false);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Alert loop thread died.", e));
        worker = thread;
        thread.start();
        log.info("ALERT_SCHEDULER_STARTED thread={}", thread.getName());
    }

    @Override
    public synchronized void stop() {
        Thread thread = worker;
        if (thread == null) {
            return;
        }
        loop.stop();
        thread.interrupt();
        try {
            thread.join(noticeTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        worker = null;
        announce(AlertKind.SHUTDOWN, AlertMessageFormatter.shutdown());
        log.info("ALERT_SCHEDULER_STOPPED");
    }

    @Override
    public boolean isRunning() {
        return worker != null;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    private void announce(AlertKind kind, String text) {
        try {
            dispatcher.dispatch(kind, "-", text).block(noticeTimeout);
        } catch (RuntimeException e) {
            log.warn("Lifecycle notice not sent. kind={} reason={}", kind, e.toString());
        }
    }
}
