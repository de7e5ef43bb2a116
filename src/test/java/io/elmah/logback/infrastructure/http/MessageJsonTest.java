package io.elmah.logback.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.elmah.logback.domain.BulkResult;
import io.elmah.logback.domain.CreateMessage;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageJsonTest {
  private final MessageJson json = new MessageJson();

  @Test
  void emptyMessageIsEmptyObject() throws IOException {
    assertEquals("{}", json.write(new CreateMessage()));
  }

  @Test
  void specialCharactersAreEscaped() throws IOException {
    CreateMessage message = new CreateMessage();
    message.setTitle("line\n\"quoted\"");

    assertEquals("{\"title\":\"line\\n\\\"quoted\\\"\"}", json.write(message));
  }

  @Test
  void readsBulkResults() throws IOException {
    List<BulkResult> results = json.readBulkResults(
        "[{\"statusCode\":201,\"location\":\"https://api.elmah.io/m/1\"},{\"statusCode\":400}]");

    assertEquals(2, results.size());
    assertTrue(results.get(0).accepted());
    assertEquals("https://api.elmah.io/m/1", results.get(0).location());
    assertFalse(results.get(1).accepted());
    assertNull(results.get(1).location());
  }

  @Test
  void blankBulkResponseHasNoResults() throws IOException {
    assertTrue(json.readBulkResults("").isEmpty());
  }

  @Test
  void nonArrayBulkResponseIsRejected() {
    assertThrows(IOException.class, () -> json.readBulkResults("{\"statusCode\":201}"));
  }
}
