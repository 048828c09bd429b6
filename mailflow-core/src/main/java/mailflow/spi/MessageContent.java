package mailflow.spi;

import java.util.Map;

/**
 * What to send. Rendering is the provider's concern; {@code variables} carries values the
 * template may substitute, such as an issued discount code.
 */
public record MessageContent(String subject, String templateId, String htmlContent,
    Map<String, String> variables) {

  public MessageContent {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }
}
