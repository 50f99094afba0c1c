package com.example.heuleum.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubscriptionPropertiesValidationTest {

    private static final String SUBJECT = "heuleum.events";
    private static final String STREAM = "events";
    private static final String DURABLE = "heuleum-tracker";
    private static final Duration ACK_WAIT = Duration.ofSeconds(30);

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesWhenAllFieldsValid() {
        SubscriptionProperties properties = new SubscriptionProperties(SUBJECT, STREAM, DURABLE, ACK_WAIT, 5);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenAckWaitIsZero() {
        SubscriptionProperties properties = new SubscriptionProperties(SUBJECT, STREAM, DURABLE, Duration.ZERO, 5);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenMaxAttemptsIsZero() {
        SubscriptionProperties properties = new SubscriptionProperties(SUBJECT, STREAM, DURABLE, ACK_WAIT, 0);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void brokerMaxDeliverLeavesRoomForTheDeadLetterAttempt() {
        SubscriptionProperties properties = new SubscriptionProperties(SUBJECT, STREAM, DURABLE, ACK_WAIT, 5);

        assertEquals(6L, properties.brokerMaxDeliver());
    }
}
