package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.WorkerRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationContext;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownConfigTest {

    @Mock
    private ApplicationContext applicationContext;

    @Mock
    private ObjectProvider<WorkerRuntime> runtimeProvider;

    @Mock
    private ObjectProvider<JedisPooled> jedisProvider;

    @Mock
    private WorkerRuntime runtime;

    @Mock
    private JedisPooled jedis;

    private final PipelineProperties properties = new PipelineProperties();
    private GracefulShutdownConfig shutdown;

    @BeforeEach
    void setUp() {
        shutdown = new GracefulShutdownConfig(applicationContext, runtimeProvider, jedisProvider, properties);
    }

    @Test
    void stopsClaimsDrainsThenClosesRedis() {
        when(runtimeProvider.getIfAvailable()).thenReturn(runtime);
        when(jedisProvider.getIfAvailable()).thenReturn(jedis);
        when(runtime.inFlight()).thenReturn(2, 1, 0);

        assertThat(shutdown.drainAndClose()).isTrue();

        InOrder order = inOrder(runtime, jedis);
        order.verify(runtime).stopAccepting();
        order.verify(runtime).shutdownExecutors();
        order.verify(jedis).close();
    }

    @Test
    void givesUpAfterTimeoutAndStillClosesResources() {
        properties.getWorker().setShutdownTimeout(Duration.ofMillis(300));
        when(runtimeProvider.getIfAvailable()).thenReturn(runtime);
        when(jedisProvider.getIfAvailable()).thenReturn(jedis);
        when(runtime.inFlight()).thenReturn(1);

        assertThat(shutdown.drainAndClose()).isFalse();

        verify(runtime).shutdownExecutors();
        verify(jedis).close();
    }

    @Test
    void nothingToDrainWithoutWorkersOrRedis() {
        when(runtimeProvider.getIfAvailable()).thenReturn(null);
        when(jedisProvider.getIfAvailable()).thenReturn(null);

        assertThat(shutdown.drainAndClose()).isTrue();
        assertThat(GracefulShutdownConfig.isShuttingDown()).isFalse();
    }
}
