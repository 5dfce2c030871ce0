package com.habitsnap.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.RabbitListenerErrorHandler;
import org.springframework.amqp.rabbit.support.ListenerExecutionFailedException;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.stereotype.Component;
import org.springframework.validation.BindingResult;

import java.util.stream.Collectors;

/**
 * Error handler for the snap event listener.
 *
 * A payload that fails bean validation will fail the same way on every
 * redelivery, so it is logged and acknowledged. Every other failure is
 * re-thrown and goes through the listener's retry and dead-letter path.
 *
 * @see SnapEventConsumer
 */
@Component("snapEventErrorHandler")
@Slf4j
public class SnapEventErrorHandler implements RabbitListenerErrorHandler {

    @Override
    public Object handleError(
            Message amqpMessage,
            org.springframework.messaging.Message<?> message,
            ListenerExecutionFailedException exception
    ) {
        Throwable cause = exception.getCause();
        if (cause instanceof MethodArgumentNotValidException) {
            log.warn("Discarding invalid snap event: errors={}, payload={}",
                    describe(((MethodArgumentNotValidException) cause).getBindingResult()),
                    message != null ? message.getPayload() : null);
            return null;
        }
        throw exception;
    }

    private static String describe(BindingResult bindingResult) {
        if (bindingResult == null) {
            return "[]";
        }
        return bindingResult.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
