package io.sqsoffline.spring.boot;

import io.sqsoffline.invoke.CallbackQueueHandler;
import io.sqsoffline.invoke.DefaultHandlerRegistry;
import io.sqsoffline.invoke.QueueHandler;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link SqsHandler} and registers them
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see SqsHandler
 */
public class SqsHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public SqsHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SqsHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            SqsHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), SqsHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @SqsHandler annotation on " + bean.getClass().getName());
            }
            String handlerRef = annotation.value();
            try {
                if (bean instanceof QueueHandler handler) {
                    registry.register(handlerRef, handler);
                } else if (bean instanceof CallbackQueueHandler handler) {
                    registry.register(handlerRef, handler);
                } else {
                    throw new BeanCreationException(beanName,
                            "Bean annotated with @SqsHandler must implement QueueHandler or CallbackQueueHandler, " +
                                    "but " + bean.getClass().getName() + " does not");
                }
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
