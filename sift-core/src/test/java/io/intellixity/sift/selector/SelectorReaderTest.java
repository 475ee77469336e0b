package io.intellixity.sift.selector;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SelectorReaderTest {
  private static final SelectorReader LENIENT = new SelectorReader();
  private static final SelectorReader STRICT = new SelectorReader(UnknownOperatorPolicy.REJECT);

  @Test
  void readsNestedTreeInDocumentOrder() {
    Selector s = LENIENT.read("""
        {"operator": {"$and": [
          {"operator": {"$or": [
            {"statement": {"age": {"$gte": 18}}},
            {"statement": {"membership": {"$eq": "premium"}}}
          ]}},
          {"statement": {"country": {"$eq": "Germany"}}}
        ]}}
        """);
    assertTrue(s.root() instanceof OperatorNode);
    OperatorNode and = (OperatorNode) s.root();
    assertEquals(Connective.AND, and.connective());
    assertEquals(2, and.children().size());
    OperatorNode or = (OperatorNode) and.children().get(0);
    assertEquals(Connective.OR, or.connective());
    assertEquals(Selectors.gte("age", 18), or.children().get(0));
    assertEquals(Selectors.eq("country", "Germany"), and.children().get(1));
  }

  @Test
  void blankNullAndEmptyObjectAreEmpty() {
    assertTrue(LENIENT.read("").isEmpty());
    assertTrue(LENIENT.read("null").isEmpty());
    assertTrue(LENIENT.read("{}").isEmpty());
    assertTrue(STRICT.read("{}").isEmpty());
    assertTrue(LENIENT.read((Map<String, ?>) null).isEmpty());
  }

  @Test
  void keepsOperatorOrderWithinAField() {
    Selector s = LENIENT.read("""
        {"statement": {"age": {"$lte": 30, "$gte": 18}}}
        """);
    Statement st = (Statement) s.root();
    List<Comparison> cs = st.comparisons();
    assertEquals(ComparisonOperator.LTE, cs.get(0).operator());
    assertEquals(ComparisonOperator.GTE, cs.get(1).operator());
  }

  @Test
  void firstRecognizedConnectiveWins() {
    Selector s = LENIENT.read("""
        {"operator": {"$nor": [], "$or": [{"statement": {"a": {"$eq": 1}}}], "$and": []}}
        """);
    assertEquals(Connective.OR, ((OperatorNode) s.root()).connective());
  }

  @Test
  void operatorWithoutConnectiveIsEmpty() {
    assertTrue(LENIENT.read("{\"operator\": {}}").isEmpty());
  }

  @Test
  void lenientDropsNonScalarValuesButKeepsTheirFields() {
    Selector s = LENIENT.read("""
        {"statement": {"a": {"$eq": null}, "b": {"$eq": [1]}, "c": {"$eq": true}, "d": {"$eq": 1.5}}}
        """);
    Statement st = (Statement) s.root();
    assertEquals(List.of(new Comparison("d", ComparisonOperator.EQ, 1.5)), st.comparisons());
    assertEquals(List.of("a", "b", "c", "d"), List.copyOf(st.fields()));
  }

  @Test
  void fieldWithOnlyUnknownOperatorsIsStillNamed() {
    Selector s = LENIENT.read("{\"statement\": {\"country\": {\"$in\": [\"DE\"]}}}");
    Statement st = (Statement) s.root();
    assertEquals(List.of("country"), List.copyOf(st.fields()));
    assertTrue(st.comparisons().isEmpty());
  }

  @Test
  void repeatedOperatorOnOneFieldKeepsLastValue() {
    Selector s = LENIENT.read("{\"statement\": {\"age\": {\"$gte\": 1, \"$gte\": 2}}}");
    Statement st = (Statement) s.root();
    assertEquals(List.of(new Comparison("age", ComparisonOperator.GTE, 2)), st.comparisons());
  }

  @Test
  void builderRepeatedOperatorKeepsLastValue() {
    Statement st = Statement.builder().gte("a", 1).gte("a", 2).build();
    assertEquals(List.of(new Comparison("a", ComparisonOperator.GTE, 2)), st.comparisons());
    assertEquals(Selectors.gte("a", 2), st);
  }

  @Test
  void helpersSkipNullChildren() {
    OperatorNode and = Selectors.and(Selectors.eq("a", 1), null, Selectors.eq("b", 2));
    assertEquals(List.of(Selectors.eq("a", 1), Selectors.eq("b", 2)), and.children());
    assertTrue(Selectors.or((SelectorNode) null).children().isEmpty());
  }

  @Test
  void strictRejectsUnknownOperator() {
    SelectorValidationException ex = assertThrows(
        SelectorValidationException.class,
        () -> STRICT.read("{\"statement\": {\"age\": {\"$in\": [1, 2]}}}")
    );
    assertTrue(ex.getMessage().contains("Unsupported operator '$in'"));
    assertTrue(ex.getMessage().contains("'age'"));
  }

  @Test
  void strictRejectsUnknownConnective() {
    SelectorValidationException ex = assertThrows(
        SelectorValidationException.class,
        () -> STRICT.read("{\"operator\": {\"$nor\": []}}")
    );
    assertTrue(ex.getMessage().contains("'$nor'"));
  }

  @Test
  void strictRejectsSecondConnective() {
    assertThrows(
        SelectorValidationException.class,
        () -> STRICT.read("{\"operator\": {\"$and\": [], \"$or\": []}}")
    );
  }

  @Test
  void strictRejectsNullValue() {
    assertThrows(
        SelectorValidationException.class,
        () -> STRICT.read("{\"statement\": {\"age\": {\"$eq\": null}}}")
    );
  }

  @Test
  void invalidJsonIsAValidationError() {
    assertThrows(SelectorValidationException.class, () -> LENIENT.read("{\"statement\": "));
  }

  @Test
  void readsPlainMaps() {
    Map<String, Object> raw = Map.of(
        "operator", Map.of("$or", List.of(
            Map.of("statement", Map.of("a", Map.of("$gt", 1))),
            Map.of("statement", Map.of("b", Map.of("$ne", "x")))
        ))
    );
    Selector s = LENIENT.read(raw);
    assertEquals(Selectors.or(Selectors.gt("a", 1), Selectors.ne("b", "x")), s.root());
  }
}
