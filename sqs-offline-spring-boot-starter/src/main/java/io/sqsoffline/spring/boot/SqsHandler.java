package io.sqsoffline.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a queue handler.
 *
 * <p>The annotated bean must implement {@link io.sqsoffline.invoke.QueueHandler} or
 * {@link io.sqsoffline.invoke.CallbackQueueHandler}. The annotation names the handler
 * reference that queue configuration points at.
 *
 * <pre>{@code
 * @Component
 * @SqsHandler("handlers.orders")
 * public class OrdersHandler implements QueueHandler {
 *   public Object handle(SqsEvent event, InvocationContext context) { ... }
 * }
 * }</pre>
 *
 * @see SqsHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SqsHandler {

    /**
     * Handler reference, {@code <module>.<export>}.
     */
    String value();
}
