package io.intellixity.sift.selector;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/** Jackson binding for {@link Selector}; lenient ({@link UnknownOperatorPolicy#SKIP}). */
public final class SelectorJsonDeserializer extends JsonDeserializer<Selector> {
  private static final SelectorReader LENIENT = new SelectorReader();

  @Override
  public Selector deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    return LENIENT.read(root);
  }

  @Override
  public Selector getNullValue(DeserializationContext ctxt) {
    return Selector.empty();
  }
}
