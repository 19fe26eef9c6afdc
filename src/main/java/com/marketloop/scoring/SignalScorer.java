package com.marketloop.scoring;

import com.marketloop.domain.model.CandidateSignal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ranks candidates by a composite of edge, capped annualized return and confidence.
 *
 * <pre>
 * score = 0.4 * edge + 0.3 * min(annualized, 5) / 5 + 0.3 * confidence
 * score *= 0.8 when hours to resolution exceed the horizon
 * </pre>
 *
 * <p>Stateless and deterministic.
 */
@Component
public class SignalScorer {

    private static final Logger log = LoggerFactory.getLogger(SignalScorer.class);

    static final BigDecimal EDGE_WEIGHT = new BigDecimal("0.4");
    static final BigDecimal RETURN_WEIGHT = new BigDecimal("0.3");
    static final BigDecimal CONFIDENCE_WEIGHT = new BigDecimal("0.3");
    static final BigDecimal MAX_ANNUALIZED_RETURN = new BigDecimal("5");
    static final BigDecimal LONG_DATED_PENALTY = new BigDecimal("0.8");

    public BigDecimal score(CandidateSignal signal, int horizonHours) {
        BigDecimal annualized = signal.getAnnualizedReturn() != null ? signal.getAnnualizedReturn() : BigDecimal.ZERO;
        BigDecimal normalizedReturn = annualized
                .max(BigDecimal.ZERO)
                .min(MAX_ANNUALIZED_RETURN)
                .divide(MAX_ANNUALIZED_RETURN, 8, RoundingMode.HALF_UP);

        BigDecimal score = EDGE_WEIGHT
                .multiply(signal.getEdge())
                .add(RETURN_WEIGHT.multiply(normalizedReturn))
                .add(CONFIDENCE_WEIGHT.multiply(signal.getConfidence()));
        if (signal.getHoursToResolution() > horizonHours) {
            score = score.multiply(LONG_DATED_PENALTY);
        }
        return score.setScale(6, RoundingMode.HALF_UP);
    }

    /**
     * Scores every candidate, keeps the higher-scoring one per (market, side), and
     * returns them best first. Ties keep input order.
     */
    public List<ScoredSignal> rank(List<CandidateSignal> signals, int horizonHours) {
        Map<String, ScoredSignal> best = new LinkedHashMap<>();
        for (CandidateSignal signal : signals) {
            ScoredSignal scored = new ScoredSignal(signal, score(signal, horizonHours));
            best.merge(
                    signal.dedupeKey(),
                    scored,
                    (existing, candidate) -> candidate.getScore().compareTo(existing.getScore()) > 0 ? candidate : existing);
        }
        List<ScoredSignal> ranked = new ArrayList<>(best.values());
        ranked.sort(Comparator.comparing(ScoredSignal::getScore).reversed());
        return ranked;
    }

    public List<CandidateSignal> filterMinimumEdge(List<CandidateSignal> signals, BigDecimal minEdge) {
        List<CandidateSignal> kept = signals.stream()
                .filter(signal -> signal.getEdge().compareTo(minEdge) >= 0)
                .toList();
        if (kept.size() < signals.size()) {
            log.debug("Filtered {} candidate(s) below min_edge={}", signals.size() - kept.size(), minEdge);
        }
        return kept;
    }
}
