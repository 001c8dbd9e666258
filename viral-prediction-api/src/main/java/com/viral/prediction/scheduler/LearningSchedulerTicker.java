package com.viral.prediction.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Wall-clock driver for {@link LearningScheduler}. Off when {@code viral.prediction.scheduler.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "viral.prediction.scheduler", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class LearningSchedulerTicker {

    private final LearningScheduler scheduler;
    private final Clock clock;

    public LearningSchedulerTicker(LearningScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${viral.prediction.scheduler.tick-delay:60000}")
    public void tick() {
        scheduler.tick(clock.instant());
    }
}
