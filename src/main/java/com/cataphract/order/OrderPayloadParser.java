package com.cataphract.order;

import com.cataphract.model.Order;
import com.cataphract.order.payload.OrderPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.exc.UnrecognizedPropertyException;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts an order's persisted parameter map into its typed payload.
 * Unknown keys, wrongly typed values and missing required keys raise
 * {@link OrderValidationException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderPayloadParser {

    private static final JsonMapper STRICT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Validator validator;

    public <T extends OrderPayload> T parse(Order order, Class<T> payloadType) {
        Map<String, Object> parameters = order.getParameters() != null ? order.getParameters() : Map.of();

        T payload;
        try {
            payload = STRICT_MAPPER.convertValue(parameters, payloadType);
        } catch (IllegalArgumentException | JacksonException e) {
            throw new OrderValidationException(describe(e), e);
        }
        if (payload == null) {
            throw new OrderValidationException("order parameters missing");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .distinct()
                    .sorted()
                    .collect(Collectors.joining("; "));
            log.debug("Order {} rejected: {}", order.getId(), message);
            throw new OrderValidationException(message);
        }
        return payload;
    }

    private static String describe(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof UnrecognizedPropertyException unknown) {
                return "unknown parameter: " + unknown.getPropertyName();
            }
        }
        return "invalid order parameters";
    }
}
