package com.marketalert.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketalert.common.baseline.VolumeBaselineTracker;
import com.marketalert.common.clock.MarketClock;
import com.marketalert.common.clock.MarketSession;
import com.marketalert.common.ledger.CooldownLedger;
import com.marketalert.common.ledger.Watchlist;
import com.marketalert.common.provider.MarketDataProvider;
import com.marketalert.common.rule.RuleEvaluator;
import com.marketalert.scheduler.dispatch.AlertDispatcher;
import com.marketalert.scheduler.job.AlertLoop;
import com.marketalert.scheduler.job.AlertSchedulerLifecycle;
import com.marketalert.scheduler.job.ScheduledTask;
import com.marketalert.scheduler.job.TaskGate;
import com.marketalert.scheduler.job.TaskTable;
import com.marketalert.scheduler.state.AlertState;
import com.marketalert.scheduler.task.DerivativeScanTask;
import com.marketalert.scheduler.task.HeartbeatTask;
import com.marketalert.scheduler.task.HousekeepingTask;
import com.marketalert.scheduler.task.MarketStateTask;
import com.marketalert.scheduler.task.PrimaryScanTask;
import com.marketalert.scheduler.task.SummaryTask;
import com.marketalert.scheduler.task.WatchlistSweepTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketClock marketClock(AlertProperties props) {
        AlertProperties.Market market = props.market();
        return new MarketClock(ZoneId.of(market.timezone()), market.openHour(), market.closeHour());
    }

    @Bean
    public RuleEvaluator ruleEvaluator(AlertProperties props) {
        return new RuleEvaluator(props.rules().toThresholds());
    }

    @Bean
    public AlertState alertState(AlertProperties props) {
        return new AlertState(
            new VolumeBaselineTracker(props.baseline().capacity(), props.baseline().minSamples()),
            new CooldownLedger(props.rules().cooldown()),
            new Watchlist(props.watchlist().ttl()),
            new MarketSession());
    }

    @Bean
    public TaskTable taskTable(AlertProperties props, Clock clock, MarketClock marketClock, RuleEvaluator ruleEvaluator,
                               AlertState alertState, MarketDataProvider marketDataProvider, AlertDispatcher dispatcher) {
        AlertProperties.Intervals every = props.intervals();
        Instant start = clock.instant();

        TaskTable table = new TaskTable()
            .register(new ScheduledTask(new MarketStateTask(marketClock, alertState, dispatcher),
                                        every.marketRecheck(), TaskGate.ALWAYS, start))
            .register(new ScheduledTask(new PrimaryScanTask(marketDataProvider, ruleEvaluator, alertState, dispatcher,
                                                            props.scan().topMoversLimit()),
                                        every.primaryScan(), TaskGate.MARKET_OPEN, start))
            .register(new ScheduledTask(new WatchlistSweepTask(marketDataProvider, alertState, dispatcher,
                                                               props.rules().insiderShareFloor()),
                                        every.watchlistSweep(), TaskGate.MARKET_OPEN, start))
            .register(new ScheduledTask(new DerivativeScanTask(marketDataProvider, ruleEvaluator.thresholds(),
                                                               alertState, dispatcher),
                                        every.derivativeScan(), TaskGate.MARKET_OPEN, start))
            .register(new ScheduledTask(new SummaryTask(marketDataProvider, alertState, dispatcher,
                                                        props.scan().summaryTopK(), marketClock.zone()),
                                        every.summary(), TaskGate.MARKET_OPEN, start))
            .register(new ScheduledTask(new HeartbeatTask(alertState, dispatcher),
                                        every.heartbeat(), TaskGate.MARKET_CLOSED, start.plus(every.heartbeat())))
            .register(new ScheduledTask(new HousekeepingTask(alertState),
                                        every.housekeeping(), TaskGate.ALWAYS, start.plus(every.housekeeping())));

        table.rows().forEach(row -> log.info("TASK_REGISTERED task={} intervalSeconds={} gate={}",
                                             row.name(), row.interval().toSeconds(), row.gate()));
        return table;
    }

    @Bean
    public AlertLoop alertLoop(TaskTable taskTable, AlertState alertState, AlertDispatcher dispatcher,
                               Clock clock, AlertProperties props) {
        return new AlertLoop(taskTable, alertState, dispatcher, clock,
                             props.intervals().tick(), props.intervals().taskTimeout());
    }

    @Bean
    public AlertSchedulerLifecycle alertSchedulerLifecycle(AlertLoop alertLoop, AlertDispatcher dispatcher,
                                                           AlertProperties props,
                                                           @Value("${alert.auto-start:true}") boolean autoStart) {
        return new AlertSchedulerLifecycle(alertLoop, dispatcher, props.intervals().taskTimeout(), autoStart);
    }
}
