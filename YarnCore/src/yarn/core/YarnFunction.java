package yarn.core;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * A native function callable from scripts.
 *
 * <p>Parameter and return kinds are fixed when the function is created, from the {@code Class}
 * tokens given to {@code of}. Calls are validated for argument count and convertibility before the
 * native code runs.
 */
public abstract class YarnFunction {
  @FunctionalInterface
  public interface Function0<R> {
    R apply();
  }

  @FunctionalInterface
  public interface Function1<A, R> {
    R apply(A a);
  }

  @FunctionalInterface
  public interface Function2<A, B, R> {
    R apply(A a, B b);
  }

  @FunctionalInterface
  public interface Function3<A, B, C, R> {
    R apply(A a, B b, C c);
  }

  @FunctionalInterface
  public interface Function4<A, B, C, D, R> {
    R apply(A a, B b, C c, D d);
  }

  @FunctionalInterface
  public interface Function5<A, B, C, D, E, R> {
    R apply(A a, B b, C c, D d, E e);
  }

  private final ValueType returnType;
  private final ImmutableList<ValueType> parameterTypes;

  private YarnFunction(Class<?> returnType, Class<?>... parameterTypes) {
    this.returnType = ValueType.forJavaType(returnType);
    ImmutableList.Builder<ValueType> builder = ImmutableList.builder();
    for (Class<?> parameterType : parameterTypes) {
      builder.add(ValueType.forJavaType(parameterType));
    }
    this.parameterTypes = builder.build();
  }

  public final ValueType returnType() {
    return returnType;
  }

  public final ImmutableList<ValueType> parameterTypes() {
    return parameterTypes;
  }

  public final int arity() {
    return parameterTypes.size();
  }

  /**
   * Calls the function.
   *
   * @throws ArgumentCountException if {@code arguments} does not match {@link #arity()}
   * @throws ArgumentConversionException if an argument cannot be converted to its parameter kind
   */
  public final Value call(List<Value> arguments) {
    if (arguments.size() != arity()) {
      throw new ArgumentCountException(arity(), arguments.size());
    }

    Object[] converted = new Object[arguments.size()];
    for (int i = 0; i < converted.length; i++) {
      Value argument = arguments.get(i);
      ValueType expected = parameterTypes.get(i);
      Object javaValue = argument.convertTo(expected).orElse(null);
      if (javaValue == null) {
        throw new ArgumentConversionException(i, expected, argument);
      }
      converted[i] = javaValue;
    }
    return Value.fromJava(invoke(converted), returnType);
  }

  abstract Object invoke(Object[] arguments);

  public static <R> YarnFunction of(Class<R> returnType, Function0<R> function) {
    return new YarnFunction(returnType) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply();
      }
    };
  }

  public static <A, R> YarnFunction of(Class<R> returnType, Class<A> a, Function1<A, R> function) {
    return new YarnFunction(returnType, a) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply(a.cast(arguments[0]));
      }
    };
  }

  public static <A, B, R> YarnFunction of(
      Class<R> returnType, Class<A> a, Class<B> b, Function2<A, B, R> function) {
    return new YarnFunction(returnType, a, b) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply(a.cast(arguments[0]), b.cast(arguments[1]));
      }
    };
  }

  public static <A, B, C, R> YarnFunction of(
      Class<R> returnType, Class<A> a, Class<B> b, Class<C> c, Function3<A, B, C, R> function) {
    return new YarnFunction(returnType, a, b, c) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply(a.cast(arguments[0]), b.cast(arguments[1]), c.cast(arguments[2]));
      }
    };
  }

  public static <A, B, C, D, R> YarnFunction of(
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      Class<C> c,
      Class<D> d,
      Function4<A, B, C, D, R> function) {
    return new YarnFunction(returnType, a, b, c, d) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply(
            a.cast(arguments[0]), b.cast(arguments[1]), c.cast(arguments[2]), d.cast(arguments[3]));
      }
    };
  }

  public static <A, B, C, D, E, R> YarnFunction of(
      Class<R> returnType,
      Class<A> a,
      Class<B> b,
      Class<C> c,
      Class<D> d,
      Class<E> e,
      Function5<A, B, C, D, E, R> function) {
    return new YarnFunction(returnType, a, b, c, d, e) {
      @Override
      Object invoke(Object[] arguments) {
        return function.apply(
            a.cast(arguments[0]),
            b.cast(arguments[1]),
            c.cast(arguments[2]),
            d.cast(arguments[3]),
            e.cast(arguments[4]));
      }
    };
  }

  @Override
  public String toString() {
    return parameterTypes
            .stream()
            .map(ValueType::toString)
            .collect(Collectors.joining(", ", "(", ")"))
        + " -> "
        + returnType;
  }
}
