package io.intellixity.sift.compile;

import io.intellixity.sift.selector.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Translates a selector tree into a parameterized SQL boolean expression.\n
 *
 * Rendering:\n
 * - statement: {@code field op :placeholder} per comparison, joined by AND\n
 * - statement at the root: wrapped in parentheses\n
 * - operator node: every non-empty child wrapped in parentheses and joined by the connective\n
 * - empty selector: empty fragment, no params\n
 *
 * Only field names and operator symbols reach the SQL text; values travel as params.\n
 * Params are merged in tree order and a later binding of the same placeholder overwrites an earlier one.\n
 *
 * Every field a statement names is recorded, including fields whose conditions were all dropped.\n
 * {@link #fields()} accumulates over the lifetime of the instance. Instances are not thread-safe;
 * use one per compile when that matters. {@link CompiledFilter#fields()} only covers a single call.\n
 */
public final class FilterCompiler {
  private static final Logger log = LoggerFactory.getLogger(FilterCompiler.class);

  private static final Map<ComparisonOperator, String> SQL_SYMBOLS = new EnumMap<>(ComparisonOperator.class);

  static {
    for (ComparisonOperator op : ComparisonOperator.values()) SQL_SYMBOLS.put(op, symbolOf(op));
  }

  private final PlaceholderNaming naming;
  private final UnaryOperator<String> identifiers;
  private final Set<String> fields = new LinkedHashSet<>();

  public FilterCompiler() {
    this(PlaceholderNaming.PER_FIELD);
  }

  public FilterCompiler(PlaceholderNaming naming) {
    this(naming, UnaryOperator.identity());
  }

  /**
   * @param identifiers renders a field name into SQL (e.g. dialect quoting); placeholders and
   *                    {@link #fields()} keep the raw name
   */
  public FilterCompiler(PlaceholderNaming naming, UnaryOperator<String> identifiers) {
    this.naming = (naming == null) ? PlaceholderNaming.PER_FIELD : naming;
    this.identifiers = (identifiers == null) ? UnaryOperator.identity() : identifiers;
  }

  public PlaceholderNaming naming() { return naming; }

  /** SQL symbol for a comparison operator. */
  public static String sqlSymbol(ComparisonOperator operator) {
    return SQL_SYMBOLS.get(Objects.requireNonNull(operator, "operator"));
  }

  /** Comparisons of one statement joined by AND, without surrounding parentheses. */
  public CompiledFilter compileStatement(Statement statement) {
    Objects.requireNonNull(statement, "statement");
    List<String> parts = new ArrayList<>();
    Map<String, Object> params = new LinkedHashMap<>();
    Set<String> seen = new LinkedHashSet<>(statement.fields());
    fields.addAll(seen);

    for (Comparison c : statement.comparisons()) {
      String placeholder = naming.placeholder(c.field(), c.operator());
      params.put(placeholder, c.value());
      parts.add(identifiers.apply(c.field()) + " " + sqlSymbol(c.operator()) + " :" + placeholder);
    }
    return new CompiledFilter(String.join(" AND ", parts), params, seen);
  }

  public CompiledFilter compileSelector(Selector selector) {
    Objects.requireNonNull(selector, "selector");
    if (selector.isEmpty()) return CompiledFilter.EMPTY;
    return compile(selector.root());
  }

  /** Compile a node as the root of a selector. */
  public CompiledFilter compile(SelectorNode root) {
    if (root == null) return CompiledFilter.EMPTY;
    return root.accept(new SelectorVisitor<CompiledFilter>() {
      @Override
      public CompiledFilter visit(Statement statement) {
        CompiledFilter cf = compileStatement(statement);
        if (cf.isEmpty()) return cf;
        return new CompiledFilter("(" + cf.fragment() + ")", cf.params(), cf.fields());
      }

      @Override
      public CompiledFilter visit(OperatorNode operator) {
        return compileOperator(operator);
      }
    });
  }

  /** Every field seen by this instance since construction. */
  public Set<String> fields() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(fields));
  }

  private CompiledFilter compileOperator(OperatorNode node) {
    List<String> parts = new ArrayList<>();
    Map<String, Object> params = new LinkedHashMap<>();
    Set<String> seen = new LinkedHashSet<>();

    for (SelectorNode child : node.children()) {
      CompiledFilter cf = child.accept(new SelectorVisitor<CompiledFilter>() {
        @Override public CompiledFilter visit(Statement statement) { return compileStatement(statement); }
        @Override public CompiledFilter visit(OperatorNode operator) { return compileOperator(operator); }
      });
      seen.addAll(cf.fields());
      if (cf.isEmpty()) {
        log.debug("Dropping empty child {} of {} group", child, node.connective().token());
        continue;
      }
      parts.add("(" + cf.fragment() + ")");
      params.putAll(cf.params());
    }
    return new CompiledFilter(String.join(node.connective().joiner(), parts), params, seen);
  }

  private static String symbolOf(ComparisonOperator op) {
    return switch (op) {
      case EQ -> "=";
      case NE -> "!=";
      case LT -> "<";
      case LTE -> "<=";
      case GT -> ">";
      case GTE -> ">=";
    };
  }
}
