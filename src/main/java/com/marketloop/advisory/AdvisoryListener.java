package com.marketloop.advisory;

import com.marketloop.config.AdvisoryProperties;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.scheduler.ScanCycle;
import com.marketloop.strategy.ScanContext;
import com.marketloop.strategy.news.NewsSignalGenerator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Polls the headline feed, classifies unseen headlines and hands the resulting news
 * candidates to {@link ScanCycle#trade}, so they pass the same edge filter, ranking
 * and risk gate as scanner output. Nothing here places an order.
 *
 * <p>Headline ids are remembered in a bounded insertion-ordered set; once full the
 * oldest id is forgotten.
 */
@Component
public class AdvisoryListener {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryListener.class);

    private final HeadlineFeed headlineFeed;
    private final HeadlineClassifier headlineClassifier;
    private final NewsSignalGenerator newsSignalGenerator;
    private final ExchangeGateway exchangeGateway;
    private final ScanCycle scanCycle;
    private final AdvisoryProperties advisoryProperties;
    private final Set<String> seen;

    public AdvisoryListener(
            HeadlineFeed headlineFeed,
            HeadlineClassifier headlineClassifier,
            NewsSignalGenerator newsSignalGenerator,
            ExchangeGateway exchangeGateway,
            ScanCycle scanCycle,
            AdvisoryProperties advisoryProperties) {
        this.headlineFeed = headlineFeed;
        this.headlineClassifier = headlineClassifier;
        this.newsSignalGenerator = newsSignalGenerator;
        this.exchangeGateway = exchangeGateway;
        this.scanCycle = scanCycle;
        this.advisoryProperties = advisoryProperties;
        int capacity = Math.max(1, advisoryProperties.getSeenCapacity());
        this.seen = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    /** @return the number of positions opened from this poll */
    public int poll(ConfigSnapshot config) {
        if (!config.isLoopEnabled() || !config.isStrategyEnabled(StrategyType.NEWS_ARBITRAGE)) {
            log.debug("Advisory listener idle: loop or news strategy disabled");
            return 0;
        }
        if (!headlineClassifier.isEnabled()) {
            log.debug("Advisory listener idle: reasoning service disabled");
            return 0;
        }

        List<Headline> fresh = new ArrayList<>();
        for (Headline headline : headlineFeed.fetch()) {
            if (fresh.size() >= advisoryProperties.getMaxHeadlinesPerPoll()) {
                break;
            }
            if (seen.add(headline.getId())) {
                fresh.add(headline);
            }
        }
        if (fresh.isEmpty()) {
            return 0;
        }
        log.debug("Advisory listener: {} new headlines", fresh.size());

        List<HeadlineClassification> actionable = new ArrayList<>();
        for (Headline headline : fresh) {
            headlineClassifier.classify(headline)
                    .filter(c -> c.isActionable(NewsSignalGenerator.MIN_CONFIDENCE))
                    .ifPresent(c -> {
                        log.info("Relevant headline '{}' (confidence={}, direction={}, categories={})",
                                headline.getTitle(), c.getConfidence(), c.getDirection(), c.getAffectedCategories());
                        actionable.add(c);
                    });
        }
        if (actionable.isEmpty()) {
            return 0;
        }

        ScanContext context = scanCycle.context(config);
        List<MarketSnapshot> markets = exchangeGateway.listMarkets("open", null, context.getMarketFetchLimit());
        List<CandidateSignal> candidates = new ArrayList<>();
        for (HeadlineClassification classification : actionable) {
            candidates.addAll(newsSignalGenerator.generate(classification, markets, exchangeGateway, context));
        }
        if (candidates.isEmpty()) {
            return 0;
        }
        int opened = scanCycle.trade(candidates, config);
        log.info("Advisory listener: {} headlines acted on, {} candidates, {} opened", actionable.size(),
                candidates.size(), opened);
        return opened;
    }
}
