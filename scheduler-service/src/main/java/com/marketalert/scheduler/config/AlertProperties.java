package com.marketalert.scheduler.config;

import com.marketalert.common.rule.RuleThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rule thresholds, market window, state sizing and task cadences under {@code alert.*}.
 *
 * <p>Every field is optional; {@code null} falls back to the documented default in the
 * compact constructors, so an empty {@code alert:} block yields a fully working setup.
 */
@ConfigurationProperties(prefix = "alert")
public record AlertProperties(
    Market market,
    Rules rules,
    Baseline baseline,
    Scan scan,
    Intervals intervals,
    Watchlist watchlist
) {

    public AlertProperties {
        if (market == null) {
            market = new Market(null, null, null);
        }
        if (rules == null) {
            rules = new Rules(null, null, null, null, null, null, null, null, null);
        }
        if (baseline == null) {
            baseline = new Baseline(null, null);
        }
        if (scan == null) {
            scan = new Scan(null, null);
        }
        if (intervals == null) {
            intervals = new Intervals(null, null, null, null, null, null, null, null, null);
        }
        if (watchlist == null) {
            watchlist = new Watchlist(null);
        }
    }

    public record Market(String timezone, Integer openHour, Integer closeHour) {
        public Market {
            if (timezone == null || timezone.isBlank()) {
                timezone = "America/New_York";
            }
            if (openHour == null) {
                openHour = 6;
            }
            if (closeHour == null) {
                closeHour = 18;
            }
        }
    }

    public record Rules(
        Double minPercentMove,
        Double exactBidPrice,
        Long exactBidShares,
        Double highValueBidPrice,
        Long highValueBidShares,
        Long insiderShareFloor,
        Double optionsVolumeOiRatio,
        Long optionsVolumeFloor,
        Duration cooldown
    ) {
        public Rules {
            RuleThresholds d = RuleThresholds.defaults();
            if (minPercentMove == null) {
                minPercentMove = d.minPercentMove();
            }
            if (exactBidPrice == null) {
                exactBidPrice = d.exactBidPrice();
            }
            if (exactBidShares == null) {
                exactBidShares = d.exactBidShares();
            }
            if (highValueBidPrice == null) {
                highValueBidPrice = d.highValueBidPrice();
            }
            if (highValueBidShares == null) {
                highValueBidShares = d.highValueBidShares();
            }
            if (insiderShareFloor == null) {
                insiderShareFloor = d.insiderShareFloor();
            }
            if (optionsVolumeOiRatio == null) {
                optionsVolumeOiRatio = d.optionsVolumeOiRatio();
            }
            if (optionsVolumeFloor == null) {
                optionsVolumeFloor = d.optionsVolumeFloor();
            }
            if (cooldown == null) {
                cooldown = Duration.ofSeconds(300);
            }
        }

        public RuleThresholds toThresholds() {
            return new RuleThresholds(minPercentMove, exactBidPrice, exactBidShares, highValueBidPrice,
                                      highValueBidShares, insiderShareFloor, optionsVolumeOiRatio, optionsVolumeFloor);
        }
    }

    public record Baseline(Integer capacity, Integer minSamples) {
        public Baseline {
            if (capacity == null) {
                capacity = 30;
            }
            if (minSamples == null) {
                minSamples = 5;
            }
        }
    }

    /**
     * @param topMoversLimit instruments requested per primary scan
     * @param summaryTopK    instruments listed in the periodic summary
     */
    public record Scan(Integer topMoversLimit, Integer summaryTopK) {
        public Scan {
            if (topMoversLimit == null) {
                topMoversLimit = 25;
            }
            if (summaryTopK == null) {
                summaryTopK = 5;
            }
        }
    }

    public record Intervals(
        Duration primaryScan,
        Duration derivativeScan,
        Duration summary,
        Duration watchlistSweep,
        Duration marketRecheck,
        Duration heartbeat,
        Duration housekeeping,
        Duration tick,
        Duration taskTimeout
    ) {
        public Intervals {
            if (primaryScan == null) {
                primaryScan = Duration.ofSeconds(30);
            }
            if (derivativeScan == null) {
                derivativeScan = Duration.ofSeconds(180);
            }
            if (summary == null) {
                summary = Duration.ofSeconds(300);
            }
            if (watchlistSweep == null) {
                watchlistSweep = Duration.ofSeconds(30);
            }
            if (marketRecheck == null) {
                marketRecheck = Duration.ofSeconds(60);
            }
            if (heartbeat == null) {
                heartbeat = Duration.ofSeconds(300);
            }
            if (housekeeping == null) {
                housekeeping = Duration.ofSeconds(600);
            }
            if (tick == null) {
                tick = Duration.ofSeconds(1);
            }
            if (taskTimeout == null) {
                taskTimeout = Duration.ofSeconds(60);
            }
        }
    }

    /**
     * @param ttl how long a symbol stays watched after its latest bid-match; zero keeps it forever
     */
    public record Watchlist(Duration ttl) {
        public Watchlist {
            if (ttl == null) {
                ttl = Duration.ofHours(24);
            }
        }
    }
}
