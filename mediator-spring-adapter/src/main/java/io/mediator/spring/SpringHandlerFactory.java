package io.mediator.spring;

import io.mediator.HandlerAmbiguityException;
import io.mediator.HandlerResolutionException;
import io.mediator.Notification;
import io.mediator.NotificationHandler;
import io.mediator.Request;
import io.mediator.RequestHandler;
import io.mediator.spi.MultiInstanceFactory;
import io.mediator.spi.SingleInstanceFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Resolves handlers from Spring beans by generic type.
 *
 * <p>A request of type {@code Q implements Request<R>} is served by the single bean
 * assignable to {@code RequestHandler<Q, R>}. A notification is delivered to every
 * {@code NotificationHandler<T>} bean whose declared {@code T} is the notification's
 * class or one of its supertypes, so a {@code StrategyNotificationHandler<StrategyNotification>}
 * bean receives every strategy notification. A handler bean whose {@code T} cannot be
 * resolved (a raw type, or a lambda registered without a typed bean definition) is
 * treated as handling everything within the bound of {@code T}.
 *
 * <p>Beans are fetched on every lookup, so prototype-scoped handlers yield a new
 * instance per dispatch. Notification handlers follow {@code @Order} / {@code Ordered},
 * then bean definition order.
 */
public final class SpringHandlerFactory implements SingleInstanceFactory, MultiInstanceFactory {

    private final ListableBeanFactory beanFactory;

    public SpringHandlerFactory(ListableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory");
    }

    @Override
    public Object getInstance(Class<?> requestType) {
        ResolvableType responseType = ResolvableType.forClass(requestType).as(Request.class).getGeneric(0);
        if (responseType.resolve() == null) {
            throw new HandlerResolutionException("Cannot determine the response type of "
                    + requestType.getName() + "; it must implement Request<R> with a concrete R");
        }
        ResolvableType handlerType = ResolvableType.forClassWithGenerics(RequestHandler.class,
                ResolvableType.forClass(requestType), responseType);

        String[] beanNames = beanFactory.getBeanNamesForType(handlerType);
        if (beanNames.length == 0) {
            return null;
        }
        if (beanNames.length > 1) {
            throw new HandlerAmbiguityException(requestType, Arrays.asList(beanNames));
        }
        return beanFactory.getBean(beanNames[0]);
    }

    @Override
    public List<?> getInstances(Class<?> notificationType) {
        List<Object> handlers = new ArrayList<>();
        for (String beanName : beanFactory.getBeanNamesForType(NotificationHandler.class)) {
            if (handledType(beanName).isAssignableFrom(notificationType)) {
                handlers.add(beanFactory.getBean(beanName));
            }
        }
        AnnotationAwareOrderComparator.sort(handlers);
        return Collections.unmodifiableList(handlers);
    }

    private Class<?> handledType(String beanName) {
        Class<?> handled = declaredType(beanName).as(NotificationHandler.class).getGeneric(0).resolve();
        return handled != null ? handled : Notification.class;
    }

    // runtime classes of lambdas carry no generics, so prefer the bean definition's type
    private ResolvableType declaredType(String beanName) {
        ConfigurableListableBeanFactory configurable = configurableBeanFactory();
        if (configurable != null && configurable.containsBeanDefinition(beanName)) {
            ResolvableType declared = configurable.getMergedBeanDefinition(beanName).getResolvableType();
            if (declared.resolve() != null) {
                return declared;
            }
        }
        return ResolvableType.forClass(beanFactory.getType(beanName));
    }

    private ConfigurableListableBeanFactory configurableBeanFactory() {
        if (beanFactory instanceof ConfigurableListableBeanFactory configurable) {
            return configurable;
        }
        if (beanFactory instanceof ConfigurableApplicationContext context) {
            return context.getBeanFactory();
        }
        return null;
    }
}
