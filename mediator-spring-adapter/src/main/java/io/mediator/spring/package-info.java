/**
 * Spring container integration for the mediator.
 *
 * <p>{@link io.mediator.spring.SpringHandlerFactory} implements both handler factory SPIs
 * on top of a {@link org.springframework.beans.factory.ListableBeanFactory}, matching
 * handler beans by their generic type. Bean scopes and lifecycles stay with the container.
 *
 * @see io.mediator.spring.SpringHandlerFactory
 */
package io.mediator.spring;
