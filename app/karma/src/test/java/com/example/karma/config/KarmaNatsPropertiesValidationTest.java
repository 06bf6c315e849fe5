/*
 * どこで: Karma 設定のバリデーションテスト
 * 何を: KarmaNatsProperties の Bean Validation を検証する
 * なぜ: 起動時に不正な NATS 設定を検出できるようにするため
 */
package com.example.karma.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KarmaNatsPropertiesValidationTest {

    private static final String SUBJECT = "karma.order-events";
    private static final String STREAM = "KARMA_ORDER_EVENTS";
    private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validationPassesWhenAllFieldsValid() {
        KarmaNatsProperties properties = new KarmaNatsProperties(SUBJECT, STREAM, DUPLICATE_WINDOW);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenSubjectIsBlank() {
        KarmaNatsProperties properties = new KarmaNatsProperties(" ", STREAM, DUPLICATE_WINDOW);

        assertFalse(validator.validate(properties).isEmpty());
    }

    @Test
    void validationFailsWhenDuplicateWindowIsMissing() {
        KarmaNatsProperties properties = new KarmaNatsProperties(SUBJECT, STREAM, null);

        assertFalse(validator.validate(properties).isEmpty());
    }
}
