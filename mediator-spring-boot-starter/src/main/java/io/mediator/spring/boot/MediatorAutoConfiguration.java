package io.mediator.spring.boot;

import io.mediator.Mediator;
import io.mediator.dispatch.DefaultMediator;
import io.mediator.dispatch.DispatchInterceptor;
import io.mediator.spi.MetricsExporter;
import io.mediator.spring.SpringHandlerFactory;
import io.mediator.strategy.StrategyNotification;
import io.mediator.strategy.StrategyNotificationHandler;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the mediator.
 *
 * <p>Wires a {@link DefaultMediator} resolving handlers from the application context
 * through {@link SpringHandlerFactory}. Any {@link MetricsExporter} bean and all
 * {@link DispatchInterceptor} beans (in {@code @Order}) are applied. Unless disabled
 * with {@code mediator.strategy-handler.enabled=false}, a
 * {@link StrategyNotificationHandler} bean serves every {@link StrategyNotification}.
 *
 * @see MediatorProperties
 * @see MediatorMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Mediator.class)
@EnableConfigurationProperties(MediatorProperties.class)
public class MediatorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SpringHandlerFactory springHandlerFactory(ListableBeanFactory beanFactory) {
        return new SpringHandlerFactory(beanFactory);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(Mediator.class)
    public DefaultMediator mediator(MediatorProperties props,
                                    SpringHandlerFactory handlerFactory,
                                    ObjectProvider<MetricsExporter> metricsProvider,
                                    ObjectProvider<DispatchInterceptor> interceptorProvider) {
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        List<DispatchInterceptor> interceptors = interceptorProvider.orderedStream().toList();

        DefaultMediator.Builder builder = DefaultMediator.builder()
                .handlerFactory(handlerFactory)
                .publishParallelism(props.getPublish().getParallelism())
                .shutdownTimeoutMs(props.getPublish().getShutdownTimeoutMs())
                .interceptors(interceptors);
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean(StrategyNotificationHandler.class)
    @ConditionalOnProperty(prefix = "mediator.strategy-handler", name = "enabled", matchIfMissing = true)
    public StrategyNotificationHandler<StrategyNotification> strategyNotificationHandler(Mediator mediator) {
        return new StrategyNotificationHandler<>(mediator);
    }
}
