package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.domain.enums.AutomationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AutomationHandlerRegistry Tests")
class AutomationHandlerRegistryTest {

    @Mock
    private AutomationHandler marginGuard;

    @Mock
    private AutomationHandler takeProfitStopLoss;

    private AutomationHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        when(marginGuard.getAutomationType()).thenReturn(AutomationType.MARGIN_GUARD);
        when(takeProfitStopLoss.getAutomationType()).thenReturn(AutomationType.TP_SL);
        registry = new AutomationHandlerRegistry(List.of(marginGuard, takeProfitStopLoss));
        registry.initialize();
    }

    @Test
    @DisplayName("Should find handlers by automation type")
    void shouldFindHandler() {
        assertThat(registry.getHandler(AutomationType.MARGIN_GUARD)).containsSame(marginGuard);
        assertThat(registry.getHandler(AutomationType.TP_SL)).containsSame(takeProfitStopLoss);
    }

    @Test
    @DisplayName("Should report types without a handler")
    void shouldReportMissingHandler() {
        assertThat(registry.getHandler(AutomationType.AUTO_ENTRY)).isEmpty();
        assertThat(registry.hasHandler(AutomationType.AUTO_ENTRY)).isFalse();
        assertThat(registry.getHandler(null)).isEmpty();
    }

    @Test
    @DisplayName("Should list registered types")
    void shouldListRegisteredTypes() {
        assertThat(registry.getRegisteredTypes())
                .containsExactlyInAnyOrder(AutomationType.MARGIN_GUARD, AutomationType.TP_SL);
    }
}
