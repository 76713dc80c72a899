package com.bottlespin.dto;

import static org.junit.jupiter.api.Assertions.*;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SelectChallengeRequestTest {
  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void blankTypeAndText_areValid() {
    assertTrue(validator.validate(new SelectChallengeRequest("ABCDEF", "", null)).isEmpty());
    assertTrue(validator.validate(new SelectChallengeRequest("ABCDEF", null, "   ")).isEmpty());
  }

  @Test
  void blankRoomCode_isInvalid() {
    Set<ConstraintViolation<SelectChallengeRequest>> v =
        validator.validate(new SelectChallengeRequest(" ", "truth", "Q?"));

    assertEquals(1, v.size());
    assertEquals("roomCode", v.iterator().next().getPropertyPath().toString());
  }
}
