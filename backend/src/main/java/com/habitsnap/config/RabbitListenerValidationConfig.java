package com.habitsnap.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListenerConfigurer;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

/**
 * Registers Spring Boot's bean validator with the RabbitMQ listener endpoints,
 * so that {@code @Valid @Payload} parameters are checked before the listener runs.
 *
 * @see com.habitsnap.messaging.SnapEventErrorHandler
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class RabbitListenerValidationConfig implements RabbitListenerConfigurer {

    private final LocalValidatorFactoryBean validator;

    @Override
    public void configureRabbitListeners(RabbitListenerEndpointRegistrar registrar) {
        log.debug("Enabling payload validation for RabbitMQ listeners");
        registrar.setValidator(validator);
    }
}
