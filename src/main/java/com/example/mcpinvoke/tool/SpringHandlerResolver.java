package com.example.mcpinvoke.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;

public class SpringHandlerResolver implements HandlerResolver {

    private static final Logger log = LoggerFactory.getLogger(SpringHandlerResolver.class);

    private final AutowireCapableBeanFactory beanFactory;

    public SpringHandlerResolver(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public Object resolve(Class<?> handlerType) {
        return resolveTyped(handlerType);
    }

    private <T> T resolveTyped(Class<T> handlerType) {
        return beanFactory.getBeanProvider(handlerType).getIfAvailable(() -> {
            log.debug("No bean of type {}, creating a new instance", handlerType.getName());
            return beanFactory.createBean(handlerType);
        });
    }
}
