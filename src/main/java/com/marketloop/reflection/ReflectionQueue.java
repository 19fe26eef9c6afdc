package com.marketloop.reflection;

import com.marketloop.config.LoopProperties;
import com.marketloop.event.TradeClosedEvent;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Bounded hand-off of closed trade ids from the close path to {@link ReflectionWorker}.
 * Offers never block; when full the id is dropped with a warning and picked up again
 * on the next restart through the unreflected-trades recovery.
 */
@Component
public class ReflectionQueue {

    private static final Logger log = LoggerFactory.getLogger(ReflectionQueue.class);

    private final BlockingQueue<String> queue;

    public ReflectionQueue(LoopProperties loopProperties) {
        this.queue = new LinkedBlockingQueue<>(loopProperties.getReflectionQueueCapacity());
    }

    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        offer(event.getTrade().getId());
    }

    public boolean offer(String tradeId) {
        boolean accepted = queue.offer(tradeId);
        if (!accepted) {
            log.warn("Reflection queue full ({}), dropping trade {}", queue.size(), tradeId);
        }
        return accepted;
    }

    /** Next trade id, or null when empty. */
    public String poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }
}
