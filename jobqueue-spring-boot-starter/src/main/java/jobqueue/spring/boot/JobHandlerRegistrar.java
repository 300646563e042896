package jobqueue.spring.boot;

import jobqueue.JobHandler;
import jobqueue.registry.DefaultHandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link JobHandlerFor} and registers them in the
 * {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before the worker starts.
 *
 * @see JobHandlerFor
 */
public class JobHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public JobHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JobHandlerFor.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof JobHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JobHandlerFor must implement JobHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation
            JobHandlerFor annotation = AnnotationUtils.findAnnotation(bean.getClass(), JobHandlerFor.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @JobHandlerFor annotation on " + bean.getClass().getName());
            }
            if (annotation.value().isBlank()) {
                throw new BeanCreationException(beanName, "@JobHandlerFor must name a job type");
            }

            try {
                registry.register(annotation.value(), handler);
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
