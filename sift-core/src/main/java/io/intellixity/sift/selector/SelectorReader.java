package io.intellixity.sift.selector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the selector wire format into a {@link Selector}.\n
 *
 * Shape:\n
 * - node: {"operator": {"$and"|"$or": [node, ...]}} or {"statement": {field: {"$eq": v, ...}}}\n
 * - a node with both keys takes the operator path; a node with neither is empty\n
 * - in an operator object the first recognized connective wins\n
 *
 * Anything outside the vocabulary is handled by the configured {@link UnknownOperatorPolicy}.\n
 */
public final class SelectorReader {
  private static final Logger log = LoggerFactory.getLogger(SelectorReader.class);

  public static final String OPERATOR_KEY = "operator";
  public static final String STATEMENT_KEY = "statement";

  private final ObjectMapper json;
  private final UnknownOperatorPolicy policy;

  public SelectorReader() {
    this(new ObjectMapper(), UnknownOperatorPolicy.SKIP);
  }

  public SelectorReader(UnknownOperatorPolicy policy) {
    this(new ObjectMapper(), policy);
  }

  public SelectorReader(ObjectMapper json, UnknownOperatorPolicy policy) {
    this.json = Objects.requireNonNull(json, "json");
    this.policy = (policy == null) ? UnknownOperatorPolicy.SKIP : policy;
  }

  public UnknownOperatorPolicy policy() { return policy; }

  public Selector read(String selectorJson) {
    if (selectorJson == null || selectorJson.isBlank()) return Selector.empty();
    try {
      return read(json.readTree(selectorJson));
    } catch (JsonProcessingException e) {
      throw new SelectorValidationException("Selector is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  public Selector read(Map<String, ?> selector) {
    if (selector == null) return Selector.empty();
    return read(json.<JsonNode>valueToTree(selector));
  }

  public Selector read(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) return Selector.empty();
    if (!root.isObject()) {
      malformed("Selector must be a JSON object but was " + root.getNodeType());
      return Selector.empty();
    }
    return Selector.of(parseNode(root, "$"));
  }

  private SelectorNode parseNode(JsonNode n, String path) {
    if (!n.isObject()) {
      malformed("Selector node at " + path + " must be an object but was " + n.getNodeType());
      return null;
    }
    JsonNode operator = n.get(OPERATOR_KEY);
    JsonNode statement = n.get(STATEMENT_KEY);

    if (operator != null) {
      if (statement != null) {
        log.debug("Selector node at {} carries both '{}' and '{}'; statement ignored", path, OPERATOR_KEY, STATEMENT_KEY);
      }
      return parseOperator(operator, path + "." + OPERATOR_KEY);
    }
    if (statement != null) {
      return parseStatement(statement, path + "." + STATEMENT_KEY);
    }
    return null;
  }

  private SelectorNode parseOperator(JsonNode op, String path) {
    if (!op.isObject()) {
      malformed("Operator at " + path + " must be an object but was " + op.getNodeType());
      return null;
    }

    Connective connective = null;
    JsonNode body = null;
    Iterator<Map.Entry<String, JsonNode>> it = op.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      Connective c = Connective.fromToken(e.getKey());
      if (c == null) {
        unsupported("Unsupported connective '" + e.getKey() + "' at " + path);
        continue;
      }
      if (connective != null) {
        unsupported("Extra connective '" + e.getKey() + "' at " + path + " (already using " + connective.token() + ")");
        continue;
      }
      connective = c;
      body = e.getValue();
    }
    if (connective == null) return null;

    String childPath = path + "." + connective.token();
    if (!body.isArray()) {
      malformed("Connective " + childPath + " must hold an array but was " + body.getNodeType());
      return new OperatorNode(connective, List.of());
    }

    List<SelectorNode> children = new ArrayList<>();
    for (int i = 0; i < body.size(); i++) {
      SelectorNode child = parseNode(body.get(i), childPath + "[" + i + "]");
      if (child != null) children.add(child);
    }
    return new OperatorNode(connective, children);
  }

  private SelectorNode parseStatement(JsonNode st, String path) {
    if (!st.isObject()) {
      malformed("Statement at " + path + " must be an object but was " + st.getNodeType());
      return null;
    }

    // Fields are kept even when none of their conditions survive, so schema checks still see them.
    Statement.Builder b = Statement.builder();
    boolean any = false;
    Iterator<Map.Entry<String, JsonNode>> fields = st.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> fe = fields.next();
      String field = fe.getKey();
      JsonNode conditions = fe.getValue();
      b.field(field);
      any = true;
      if (!conditions.isObject()) {
        malformed("Conditions for field '" + field + "' at " + path + " must be an object but was " + conditions.getNodeType());
        continue;
      }

      Iterator<Map.Entry<String, JsonNode>> ops = conditions.fields();
      while (ops.hasNext()) {
        Map.Entry<String, JsonNode> oe = ops.next();
        ComparisonOperator op = ComparisonOperator.fromToken(oe.getKey());
        if (op == null) {
          unsupported("Unsupported operator '" + oe.getKey() + "' on field '" + field + "' at " + path);
          continue;
        }
        Object value = scalarOrNull(oe.getValue());
        if (value == null) {
          malformed("Operator " + op.token() + " on field '" + field + "' at " + path
              + " needs a string or number value but got " + oe.getValue().getNodeType());
          continue;
        }
        b.where(field, op, value);
      }
    }
    return any ? b.build() : null;
  }

  private static Object scalarOrNull(JsonNode v) {
    if (v == null) return null;
    if (v.isTextual()) return v.textValue();
    if (v.isNumber()) return v.numberValue();
    return null;
  }

  private void unsupported(String message) {
    if (policy == UnknownOperatorPolicy.REJECT) throw new SelectorValidationException(message);
    log.debug("{}; skipped", message);
  }

  private void malformed(String message) {
    if (policy == UnknownOperatorPolicy.REJECT) throw new SelectorValidationException(message);
    log.debug("{}; treated as empty", message);
  }
}
