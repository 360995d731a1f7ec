package yarn.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The functions scripts can call, operators included.
 *
 * <p>A {@code Dialogue} creates its library with {@link #standardLibrary(VariableStorage)}, so the
 * visit tracking functions read the same storage the virtual machine writes.
 */
public final class Library {
  public static final String VISITED = "visited";
  public static final String VISITED_COUNT = "visited_count";

  private static final String VISITED_VARIABLE_PREFIX = "$Yarn.Internal.Visiting.";

  private final Map<String, YarnFunction> functions = new LinkedHashMap<>();

  public Library() {}

  /** The hidden variable counting how often {@code nodeName} completed. */
  public static String generateUniqueVisitedVariableForNode(String nodeName) {
    return VISITED_VARIABLE_PREFIX + nodeName;
  }

  public Library register(String name, YarnFunction function) {
    Preconditions.checkArgument(
        !functions.containsKey(name), "function '%s' is already registered", name);
    functions.put(name, Preconditions.checkNotNull(function));
    return this;
  }

  public <R> Library register(String name, Class<R> returnType, YarnFunction.Function0<R> fn) {
    return register(name, YarnFunction.of(returnType, fn));
  }

  public <A, R> Library register(
      String name, Class<R> returnType, Class<A> a, YarnFunction.Function1<A, R> fn) {
    return register(name, YarnFunction.of(returnType, a, fn));
  }

  public <A, B, R> Library register(
      String name,
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      YarnFunction.Function2<A, B, R> fn) {
    return register(name, YarnFunction.of(returnType, a, b, fn));
  }

  public <A, B, C, R> Library register(
      String name,
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      Class<C> c,
      YarnFunction.Function3<A, B, C, R> fn) {
    return register(name, YarnFunction.of(returnType, a, b, c, fn));
  }

  public <A, B, C, D, R> Library register(
      String name,
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      Class<C> c,
      Class<D> d,
      YarnFunction.Function4<A, B, C, D, R> fn) {
    return register(name, YarnFunction.of(returnType, a, b, c, d, fn));
  }

  public <A, B, C, D, E, R> Library register(
      String name,
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      Class<C> c,
      Class<D> d,
      Class<E> e,
      YarnFunction.Function5<A, B, C, D, E, R> fn) {
    return register(name, YarnFunction.of(returnType, a, b, c, d, e, fn));
  }

  public Library importLibrary(Library other) {
    other.functions.forEach(this::register);
    return this;
  }

  public Optional<YarnFunction> get(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(functions.keySet());
  }

  public ImmutableMap<String, YarnFunction> functions() {
    return ImmutableMap.copyOf(functions);
  }

  /**
   * Calls the function registered as {@code name}.
   *
   * @throws FunctionCallException if there is no such function, or the arguments don't fit it
   */
  public Value call(String name, List<Value> arguments) {
    YarnFunction function = functions.get(name);
    if (function == null) {
      throw new FunctionCallException(String.format("undefined function '%s'", name));
    }
    return function.call(arguments);
  }

  public static Library standardLibrary() {
    Library library = new Library();
    registerNumberOperators(library);
    registerStringOperators(library);
    registerBooleanOperators(library);
    registerHelpers(library);
    return library;
  }

  /** The standard library plus {@code visited} and {@code visited_count} over {@code storage}. */
  public static Library standardLibrary(VariableStorage storage) {
    Preconditions.checkNotNull(storage);
    return standardLibrary()
        .register(VISITED, Boolean.class, String.class, node -> visitCount(storage, node) > 0)
        .register(VISITED_COUNT, Double.class, String.class, node -> visitCount(storage, node));
  }

  private static double visitCount(VariableStorage storage, String node) {
    return storage
        .get(generateUniqueVisitedVariableForNode(node))
        .filter(v -> v.type() == ValueType.NUMBER)
        .map(Value::asNumber)
        .orElse(0.0);
  }

  private static void registerNumberOperators(Library library) {
    ValueType n = ValueType.NUMBER;
    library
        .register(
            Operator.ADD.functionName(n),
            Double.class,
            Double.class,
            Double.class,
            Double::sum)
        .register(
            Operator.MINUS.functionName(n),
            Double.class,
            Double.class,
            Double.class,
            (a, b) -> a - b)
        .register(
            Operator.MULTIPLY.functionName(n),
            Double.class,
            Double.class,
            Double.class,
            (a, b) -> a * b)
        .register(
            Operator.DIVIDE.functionName(n),
            Double.class,
            Double.class,
            Double.class,
            (a, b) -> a / b)
        .register(
            Operator.MODULO.functionName(n),
            Double.class,
            Double.class,
            Double.class,
            (a, b) -> a % b)
        .register(Operator.UNARY_MINUS.functionName(n), Double.class, Double.class, a -> -a)
        .register(
            Operator.EQUAL_TO.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a.doubleValue() == b.doubleValue())
        .register(
            Operator.NOT_EQUAL_TO.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a.doubleValue() != b.doubleValue())
        .register(
            Operator.GREATER_THAN.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a > b)
        .register(
            Operator.GREATER_THAN_OR_EQUAL_TO.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a >= b)
        .register(
            Operator.LESS_THAN.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a < b)
        .register(
            Operator.LESS_THAN_OR_EQUAL_TO.functionName(n),
            Boolean.class,
            Double.class,
            Double.class,
            (a, b) -> a <= b);
  }

  private static void registerStringOperators(Library library) {
    ValueType s = ValueType.STRING;
    library
        .register(
            Operator.ADD.functionName(s),
            String.class,
            String.class,
            String.class,
            String::concat)
        .register(
            Operator.EQUAL_TO.functionName(s),
            Boolean.class,
            String.class,
            String.class,
            String::equals)
        .register(
            Operator.NOT_EQUAL_TO.functionName(s),
            Boolean.class,
            String.class,
            String.class,
            (a, b) -> !a.equals(b));
  }

  private static void registerBooleanOperators(Library library) {
    ValueType b = ValueType.BOOLEAN;
    library
        .register(
            Operator.EQUAL_TO.functionName(b),
            Boolean.class,
            Boolean.class,
            Boolean.class,
            Boolean::equals)
        .register(
            Operator.NOT_EQUAL_TO.functionName(b),
            Boolean.class,
            Boolean.class,
            Boolean.class,
            (x, y) -> !x.equals(y))
        .register(
            Operator.AND.functionName(b),
            Boolean.class,
            Boolean.class,
            Boolean.class,
            Boolean::logicalAnd)
        .register(
            Operator.OR.functionName(b),
            Boolean.class,
            Boolean.class,
            Boolean.class,
            Boolean::logicalOr)
        .register(
            Operator.XOR.functionName(b),
            Boolean.class,
            Boolean.class,
            Boolean.class,
            Boolean::logicalXor)
        .register(Operator.NOT.functionName(b), Boolean.class, Boolean.class, x -> !x);
  }

  private static void registerHelpers(Library library) {
    library
        .register("string", String.class, Double.class, d -> Value.formatNumber(d))
        .register("number", Double.class, String.class, Library::parseNumber)
        .register("bool", Boolean.class, String.class, Library::parseBool)
        .register("round", Double.class, Double.class, Math::rint)
        .register(
            "round_places",
            Double.class,
            Double.class,
            Double.class,
            (d, places) ->
                BigDecimal.valueOf(d)
                    .setScale(places.intValue(), RoundingMode.HALF_EVEN)
                    .doubleValue())
        .register("floor", Double.class, Double.class, Math::floor)
        .register("ceil", Double.class, Double.class, Math::ceil)
        .register("inc", Double.class, Double.class, d -> d == Math.rint(d) ? d + 1 : Math.ceil(d))
        .register("dec", Double.class, Double.class, d -> d == Math.rint(d) ? d - 1 : Math.floor(d))
        .register("decimal", Double.class, Double.class, d -> d - (long) d.doubleValue())
        .register("int", Double.class, Double.class, d -> (double) (long) d.doubleValue());
  }

  private static double parseNumber(String s) {
    return Value.of(s)
        .convertToNumber()
        .orElseThrow(
            () -> new FunctionCallException(String.format("'%s' is not a number", s)));
  }

  private static boolean parseBool(String s) {
    return Value.of(s)
        .convertToBoolean()
        .orElseThrow(
            () -> new FunctionCallException(String.format("'%s' is not a boolean", s)));
  }

  @Override
  public String toString() {
    return "Library" + functions.keySet();
  }
}
