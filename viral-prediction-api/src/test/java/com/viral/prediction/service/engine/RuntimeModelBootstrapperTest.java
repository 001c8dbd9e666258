package com.viral.prediction.service.engine;

import com.viral.prediction.model.Platform;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class RuntimeModelBootstrapperTest {

    private final PlatformModelStateService modelStateService = mock(PlatformModelStateService.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(PlatformModelStateService.class, () -> modelStateService)
            .withUserConfiguration(RuntimeModelBootstrapper.class);

    @Test
    void registerPlatformModels_delegatesToStateService() {
        when(modelStateService.registerAll()).thenReturn(List.of(Platform.TWITTER));

        new RuntimeModelBootstrapper(modelStateService).registerPlatformModels();

        verify(modelStateService).registerAll();
    }

    @Test
    void bootstrapper_isPresentByDefault() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(RuntimeModelBootstrapper.class));
    }

    @Test
    void bootstrapper_canBeSwitchedOff() {
        contextRunner.withPropertyValues("viral.prediction.learning.register-on-startup=false")
                .run(context -> assertThat(context).doesNotHaveBean(RuntimeModelBootstrapper.class));
    }
}
