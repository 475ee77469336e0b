package io.intellixity.sift.selector;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Writes a {@link Selector} back in the wire format read by {@link SelectorReader}. */
public final class SelectorJsonSerializer extends JsonSerializer<Selector> {
  @Override
  public void serialize(Selector s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null || s.isEmpty()) {
      g.writeStartObject();
      g.writeEndObject();
      return;
    }
    writeNode(s.root(), g);
  }

  private static void writeNode(SelectorNode node, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (node instanceof OperatorNode op) {
      g.writeObjectFieldStart(SelectorReader.OPERATOR_KEY);
      g.writeArrayFieldStart(op.connective().token());
      for (SelectorNode child : op.children()) writeNode(child, g);
      g.writeEndArray();
      g.writeEndObject();
    } else if (node instanceof Statement st) {
      g.writeObjectFieldStart(SelectorReader.STATEMENT_KEY);
      for (var fe : st.conditions().entrySet()) {
        g.writeObjectFieldStart(fe.getKey());
        for (Map.Entry<ComparisonOperator, Object> oe : fe.getValue().entrySet()) {
          g.writeObjectField(oe.getKey().token(), oe.getValue());
        }
        g.writeEndObject();
      }
      g.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported SelectorNode: " + node.getClass().getName());
    }
    g.writeEndObject();
  }
}
