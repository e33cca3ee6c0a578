package com.nayem.fluxion.spring;

import com.nayem.fluxion.action.ActionEvent;
import com.nayem.fluxion.action.ActionRunner;
import com.nayem.fluxion.action.FluxionListener;
import com.nayem.fluxion.action.ListenerRegistry;
import com.nayem.fluxion.core.Dispatcher;
import com.nayem.fluxion.core.DispatcherMetrics;
import com.nayem.fluxion.core.SequentialDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(FluxionProperties.class)
public class FluxionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FluxionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DispatcherMetrics fluxionDispatcherMetrics(ObjectProvider<MeterRegistry> registryProvider,
            FluxionProperties properties) {
        MeterRegistry registry = properties.getMetrics().isEnabled() ? registryProvider.getIfAvailable() : null;
        return new DispatcherMetrics(registry, properties.getMetrics().getName());
    }

    @Bean
    @ConditionalOnMissingBean(Dispatcher.class)
    public SequentialDispatcher<ActionEvent> fluxionDispatcher(DispatcherMetrics metrics,
            FluxionProperties properties) {
        return SequentialDispatcher.<ActionEvent>builder()
                .tokenPrefix(properties.getTokenPrefix())
                .metrics(metrics)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ListenerRegistry fluxionListenerRegistry(Dispatcher<ActionEvent> dispatcher) {
        return new ListenerRegistry(dispatcher);
    }

    /**
     * Subscribes the {@link FluxionListener} beans once every singleton exists,
     * so a listener may inject the {@link ListenerRegistry} to wait for others.
     */
    @Bean
    public SmartInitializingSingleton fluxionListenerRegistrar(ListenerRegistry registry,
            ObjectProvider<FluxionListener> listeners) {
        return () -> {
            listeners.orderedStream().forEach(registry::register);
            log.info("Registered {} Fluxion listeners", registry.size());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "fluxion.action.enabled", havingValue = "true", matchIfMissing = true)
    public ActionRunner fluxionActionRunner(Dispatcher<ActionEvent> dispatcher, FluxionProperties properties) {
        return new ActionRunner(dispatcher, properties.getFailedEventType());
    }

    @Bean
    @ConditionalOnProperty(name = "fluxion.action.enabled", havingValue = "true", matchIfMissing = true)
    public ActionAspect fluxionActionAspect(ActionRunner runner, FluxionProperties properties) {
        return new ActionAspect(runner, properties.getAction().getBlockTimeout());
    }
}
