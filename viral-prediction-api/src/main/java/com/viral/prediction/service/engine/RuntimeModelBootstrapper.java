package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers one runtime model per platform once the application is up, so inference never targets
 * a model the runtime does not know. Off when {@code viral.prediction.learning.register-on-startup=false}.
 */
@Component
@ConditionalOnProperty(prefix = "viral.prediction.learning", name = "register-on-startup", havingValue = "true",
        matchIfMissing = true)
public class RuntimeModelBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(RuntimeModelBootstrapper.class);

    private final PlatformModelStateService modelStateService;

    public RuntimeModelBootstrapper(PlatformModelStateService modelStateService) {
        this.modelStateService = modelStateService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerPlatformModels() {
        List<Platform> registered = modelStateService.registerAll();
        log.info("[RuntimeModelBootstrapper] {}/{} platform models registered", registered.size(),
                Platform.values().length);
    }
}
