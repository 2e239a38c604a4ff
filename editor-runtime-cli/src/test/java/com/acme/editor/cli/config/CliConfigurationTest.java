package com.acme.editor.cli.config;

import com.acme.editor.runtime.config.RuntimeConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CliConfigurationTest {

    @Mock
    private Dotenv dotenv;

    private CliConfiguration config;

    @BeforeEach
    void setUp() {
        lenient().when(dotenv.get(anyString())).thenReturn(null);
        config = new CliConfiguration(dotenv);
    }

    @Test
    void testDefaults_whenNothingConfigured() {
        assertThat(config.getMaxEvents()).isEqualTo(5000);
        assertThat(config.getSnapshotInterval()).isEqualTo(1000);
        assertThat(config.getMaxSnapshots()).isEqualTo(10);
        assertThat(config.getMaxListeners()).isEqualTo(100);
        assertThat(config.getInitTimeoutMillis()).isEqualTo(10_000);
        assertThat(config.getMaxHistory()).isEqualTo(50);
    }

    @Test
    void testConfiguredValues_areUsed() {
        when(dotenv.get("EDITOR_MAX_EVENTS")).thenReturn("200");
        when(dotenv.get("EDITOR_SNAPSHOT_INTERVAL")).thenReturn(" 25 ");

        assertThat(config.getMaxEvents()).isEqualTo(200);
        assertThat(config.getSnapshotInterval()).isEqualTo(25);
    }

    @Test
    void testInvalidValue_fallsBackToDefault() {
        when(dotenv.get("EDITOR_MAX_LISTENERS")).thenReturn("lots");
        when(dotenv.get("EDITOR_MAX_HISTORY")).thenReturn("-3");

        assertThat(config.getMaxListeners()).isEqualTo(100);
        assertThat(config.getMaxHistory()).isEqualTo(50);
    }

    @Test
    void testToRuntimeConfig_copiesEverySetting() {
        when(dotenv.get("EDITOR_MAX_EVENTS")).thenReturn("300");
        when(dotenv.get("EDITOR_INIT_TIMEOUT_MS")).thenReturn("1500");
        when(dotenv.get("EDITOR_MAX_HISTORY")).thenReturn("7");

        RuntimeConfig runtimeConfig = config.toRuntimeConfig();

        assertThat(runtimeConfig.getEventLog().getMaxEvents()).isEqualTo(300);
        assertThat(runtimeConfig.getEventLog().getSnapshotInterval()).isEqualTo(1000);
        assertThat(runtimeConfig.getRegistry().getInitTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(runtimeConfig.getHistory().getMaxEntries()).isEqualTo(7);
        assertThat(runtimeConfig.getEventBus().getMaxListeners()).isEqualTo(100);
    }

    @Test
    void testGetInstance_returnsSingleton() {
        assertThat(CliConfiguration.getInstance()).isSameAs(CliConfiguration.getInstance());
    }
}
