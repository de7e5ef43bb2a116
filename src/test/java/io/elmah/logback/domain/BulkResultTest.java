package io.elmah.logback.domain;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BulkResultTest {

  @Test
  void successAndRedirectStatusesAreAccepted() {
    assertTrue(new BulkResult(201, "https://api.elmah.io/v3/messages/x/1").accepted());
    assertTrue(new BulkResult(302, null).accepted());
  }

  @Test
  void errorStatusesAreNotAccepted() {
    assertFalse(new BulkResult(400, null).accepted());
    assertFalse(new BulkResult(500, null).accepted());
  }

  @Test
  void missingStatusIsNotAccepted() {
    assertFalse(new BulkResult(0, null).accepted());
  }
}
