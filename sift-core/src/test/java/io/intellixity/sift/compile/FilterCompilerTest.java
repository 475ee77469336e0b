package io.intellixity.sift.compile;

import io.intellixity.sift.selector.*;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.intellixity.sift.selector.Selectors.*;
import static org.junit.jupiter.api.Assertions.*;

final class FilterCompilerTest {
  private static final SelectorReader READER = new SelectorReader();
  private static final Pattern PLACEHOLDER = Pattern.compile(":([A-Za-z_][A-Za-z0-9_]*)");

  private static CompiledFilter compile(String json) {
    return new FilterCompiler().compileSelector(READER.read(json));
  }

  @Test
  void singleStatementAtRootIsParenthesized() {
    CompiledFilter cf = compile("""
        {"statement": {"age": {"$eq": 30}}}
        """);
    assertEquals("(age = :age)", cf.fragment());
    assertEquals(Map.of("age", 30), cf.params());
  }

  @Test
  void andGroupJoinsParenthesizedChildren() {
    CompiledFilter cf = compile("""
        {"operator": {"$and": [
          {"statement": {"age": {"$gte": 18}}},
          {"statement": {"country": {"$eq": "Germany"}}}
        ]}}
        """);
    assertEquals("(age >= :age) AND (country = :country)", cf.fragment());
    assertEquals(Map.of("age", 18, "country", "Germany"), cf.params());
  }

  @Test
  void nestedOrInsideAnd() {
    FilterCompiler compiler = new FilterCompiler();
    CompiledFilter cf = compiler.compileSelector(READER.read("""
        {"operator": {"$and": [
          {"operator": {"$or": [
            {"statement": {"age": {"$gte": 18}}},
            {"statement": {"membership": {"$eq": "premium"}}}
          ]}},
          {"statement": {"country": {"$eq": "Germany"}}}
        ]}}
        """));
    assertEquals("((age >= :age) OR (membership = :membership)) AND (country = :country)", cf.fragment());
    assertEquals(Map.of("age", 18, "membership", "premium", "country", "Germany"), cf.params());
    assertEquals(Set.of("age", "membership", "country"), compiler.fields());
    assertEquals(Set.of("age", "membership", "country"), cf.fields());
  }

  @Test
  void rangeOnOneFieldSharesOnePlaceholderAndLastValueWins() {
    // Both comparisons render, but they bind the same :age placeholder; the $lte value is the one bound.
    CompiledFilter cf = compile("""
        {"statement": {"age": {"$gte": 18, "$lte": 30}}}
        """);
    assertEquals("(age >= :age AND age <= :age)", cf.fragment());
    assertEquals(Map.of("age", 30), cf.params());
  }

  @Test
  void perOperatorNamingBindsRangeBoundsSeparately() {
    CompiledFilter cf = new FilterCompiler(PlaceholderNaming.PER_OPERATOR)
        .compileSelector(Selector.of(between("age", 18, 30)));
    assertEquals("(age >= :age_gte AND age <= :age_lte)", cf.fragment());
    assertEquals(Map.of("age_gte", 18, "age_lte", 30), cf.params());
  }

  @Test
  void emptySelectorCompilesToNothing() {
    CompiledFilter cf = compile("{}");
    assertEquals("", cf.fragment());
    assertTrue(cf.params().isEmpty());
    assertTrue(cf.isEmpty());
    assertEquals("", cf.whereClause());
    assertSame(CompiledFilter.EMPTY, new FilterCompiler().compileSelector(Selector.empty()));
  }

  @Test
  void operatorTakesPrecedenceOverStatementOnTheSameNode() {
    CompiledFilter cf = compile("""
        {"statement": {"name": {"$eq": "x"}},
         "operator": {"$or": [{"statement": {"age": {"$lt": 5}}}]}}
        """);
    assertEquals("(age < :age)", cf.fragment());
    assertFalse(cf.params().containsKey("name"));
  }

  @Test
  void unknownOperatorIsSkipped() {
    CompiledFilter cf = compile("""
        {"statement": {"age": {"$in": [1, 2], "$ne": 4}}}
        """);
    assertEquals("(age != :age)", cf.fragment());
    assertEquals(Map.of("age", 4), cf.params());
  }

  @Test
  void fieldWithOnlyUnknownOperatorsIsStillReported() {
    FilterCompiler compiler = new FilterCompiler();
    CompiledFilter cf = compiler.compileSelector(READER.read("""
        {"statement": {"country": {"$in": ["DE"]}}}
        """));
    assertEquals("", cf.fragment());
    assertTrue(cf.params().isEmpty());
    assertEquals(Set.of("country"), cf.fields());
    assertEquals(Set.of("country"), compiler.fields());
  }

  @Test
  void droppedChildStillContributesItsFields() {
    CompiledFilter cf = compile("""
        {"operator": {"$and": [
          {"statement": {"age": {"$gte": 18}}},
          {"statement": {"email": {"$like": "%@x"}}}
        ]}}
        """);
    assertEquals("(age >= :age)", cf.fragment());
    assertEquals(Set.of("age", "email"), cf.fields());
  }

  @Test
  void repeatedOperatorRendersOnceWithLastValue() {
    CompiledFilter cf = compile("{\"statement\": {\"age\": {\"$gte\": 1, \"$gte\": 2}}}");
    assertEquals("(age >= :age)", cf.fragment());
    assertEquals(Map.of("age", 2), cf.params());

    CompiledFilter built = new FilterCompiler().compileStatement(Statement.builder().gte("a", 1).gte("a", 2).build());
    assertEquals("a >= :a", built.fragment());
    assertEquals(Map.of("a", 2), built.params());
  }

  @Test
  void identifierRendererAppliesToSqlTextOnly() {
    FilterCompiler compiler = new FilterCompiler(PlaceholderNaming.PER_FIELD, f -> "\"" + f + "\"");
    CompiledFilter cf = compiler.compileSelector(Selector.of(and(eq("order", 3), gte("Kind", "a"))));
    assertEquals("(\"order\" = :order) AND (\"Kind\" >= :Kind)", cf.fragment());
    assertEquals(Map.of("order", 3, "Kind", "a"), cf.params());
    assertEquals(Set.of("order", "Kind"), cf.fields());
  }

  @Test
  void placeholderIsAlwaysAPlainIdentifier() {
    CompiledFilter cf = new FilterCompiler().compileStatement(
        Statement.builder().eq("Created At", "x").gt("2nd-score", 5).build());
    assertEquals("Created At = :Created_At AND 2nd-score > :_2nd_score", cf.fragment());
    assertEquals(Map.of("Created_At", "x", "_2nd_score", 5), cf.params());
  }

  @Test
  void groupWithOnlyEmptyChildrenRendersEmpty() {
    CompiledFilter cf = compile("""
        {"operator": {"$and": [{}, {"operator": {"$or": []}}, {"statement": {"age": {"$foo": 1}}}]}}
        """);
    assertEquals("", cf.fragment());
    assertTrue(cf.params().isEmpty());
  }

  @Test
  void emptyChildIsDroppedNotRenderedAsEmptyParentheses() {
    CompiledFilter cf = new FilterCompiler().compileSelector(Selector.of(
        and(new OperatorNode(Connective.OR, List.of()), eq("name", "bob"))));
    assertEquals("(name = :name)", cf.fragment());
    assertFalse(cf.fragment().contains("()"));
  }

  @Test
  void dottedFieldKeepsNameInSqlButUsesUnderscorePlaceholder() {
    CompiledFilter cf = new FilterCompiler().compileSelector(Selector.of(eq("address.city", "Berlin")));
    assertEquals("(address.city = :address_city)", cf.fragment());
    assertEquals(Map.of("address_city", "Berlin"), cf.params());
    assertEquals(Set.of("address.city"), cf.fields());
  }

  @Test
  void everyOperatorMapsToItsSqlSymbol() {
    Statement st = Statement.builder()
        .eq("a", 1).ne("b", 2).lt("c", 3).lte("d", 4).gt("e", 5).gte("f", 6)
        .build();
    CompiledFilter cf = new FilterCompiler().compileStatement(st);
    assertEquals("a = :a AND b != :b AND c < :c AND d <= :d AND e > :e AND f >= :f", cf.fragment());
  }

  @Test
  void connectivesJoinEveryChildInOrder() {
    SelectorNode c1 = eq("a", 1);
    SelectorNode c2 = or(eq("b", 2), gt("c", 3));
    SelectorNode c3 = ne("d", "x");
    FilterCompiler compiler = new FilterCompiler();

    String and = compiler.compile(and(c1, c2, c3)).fragment();
    String or = compiler.compile(or(c1, c2, c3)).fragment();

    String expectedChildren = "(a = :a)|((b = :b) OR (c > :c))|(d != :d)";
    assertEquals(expectedChildren.replace("|", " AND "), and);
    assertEquals(expectedChildren.replace("|", " OR "), or);
  }

  @Test
  void laterChildOverwritesEarlierParamWithSamePlaceholder() {
    CompiledFilter cf = new FilterCompiler().compile(or(eq("age", 18), eq("age", 65)));
    assertEquals("(age = :age) OR (age = :age)", cf.fragment());
    assertEquals(Map.of("age", 65), cf.params());
  }

  @Test
  void everyPlaceholderHasAParam() {
    CompiledFilter cf = compile("""
        {"operator": {"$or": [
          {"operator": {"$and": [
            {"statement": {"a.b": {"$eq": 1}, "c": {"$lt": 2, "$gt": 0}}},
            {"statement": {"d": {"$ne": "x"}}}
          ]}},
          {"statement": {"e": {"$gte": 9}}}
        ]}}
        """);
    Matcher m = PLACEHOLDER.matcher(cf.fragment());
    Set<String> seen = new LinkedHashSet<>();
    while (m.find()) {
      seen.add(m.group(1));
      assertTrue(cf.params().containsKey(m.group(1)), "missing param for :" + m.group(1));
    }
    assertEquals(seen, cf.params().keySet());
  }

  @Test
  void valuesNeverReachTheFragment() {
    String hostile = "'; DROP TABLE users; --";
    CompiledFilter cf = new FilterCompiler().compile(and(eq("name", hostile), ne("nick", hostile)));
    assertFalse(cf.fragment().contains(hostile));
    assertFalse(cf.fragment().contains("DROP"));
    assertEquals(hostile, cf.params().get("name"));
  }

  @Test
  void fieldDiscoveryDoesNotDependOnChildOrder() {
    FilterCompiler first = new FilterCompiler();
    FilterCompiler second = new FilterCompiler();
    first.compile(and(eq("a", 1), or(eq("b", 2), eq("c", 3))));
    second.compile(and(or(eq("c", 3), eq("b", 2)), eq("a", 1)));
    assertEquals(first.fields(), second.fields());
  }

  @Test
  void instanceFieldsAccumulateAcrossCalls() {
    FilterCompiler compiler = new FilterCompiler();
    CompiledFilter one = compiler.compile(eq("a", 1));
    CompiledFilter two = compiler.compile(eq("b", 2));
    assertEquals(Set.of("a"), one.fields());
    assertEquals(Set.of("b"), two.fields());
    assertEquals(Set.of("a", "b"), compiler.fields());
  }

  @Test
  void compileStatementReturnsOnlyItsOwnParams() {
    FilterCompiler compiler = new FilterCompiler();
    compiler.compileStatement(eq("a", 1));
    CompiledFilter cf = compiler.compileStatement(eq("b", 2));
    assertEquals("b = :b", cf.fragment());
    assertEquals(Map.of("b", 2), cf.params());
  }

  @Test
  void whereClausePrefixesNonEmptyFragment() {
    CompiledFilter cf = new FilterCompiler().compile(eq("a", 1));
    assertEquals(" WHERE (a = :a)", cf.whereClause());
  }
}
