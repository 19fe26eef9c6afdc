package com.marketloop.reflection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Drains {@link ReflectionQueue} on its own scheduled task. */
@Component
public class ReflectionWorker {

    private static final Logger log = LoggerFactory.getLogger(ReflectionWorker.class);

    static final int MAX_PER_DRAIN = 20;

    private final ReflectionQueue reflectionQueue;
    private final ReflectionService reflectionService;

    public ReflectionWorker(ReflectionQueue reflectionQueue, ReflectionService reflectionService) {
        this.reflectionQueue = reflectionQueue;
        this.reflectionService = reflectionService;
    }

    /** @return the number of reflections written */
    public int drain() {
        int written = 0;
        for (int i = 0; i < MAX_PER_DRAIN; i++) {
            String tradeId = reflectionQueue.poll();
            if (tradeId == null) {
                break;
            }
            try {
                if (reflectionService.reflect(tradeId).isPresent()) {
                    written++;
                }
            } catch (RuntimeException e) {
                log.error("Reflection failed for trade {}", tradeId, e);
            }
        }
        if (written > 0) {
            log.info("Reflection worker wrote {} reflections, {} still queued", written, reflectionQueue.size());
        }
        return written;
    }
}
