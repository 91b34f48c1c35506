package com.github.simbo1905.mockdispatch;

import java.lang.reflect.Method;
import lombok.SneakyThrows;

/// Call sites and expectations shared by the tests.
final class Fixtures {

  private Fixtures() {}

  interface Shape {
    double area();

    double scale(double factor);

    Shape child();
  }

  static final class Square implements Shape {
    @Override
    public double area() {
      return 1.0;
    }

    @Override
    public double scale(double factor) {
      return factor;
    }

    @Override
    public Shape child() {
      return this;
    }
  }

  static final Method SHAPE_AREA = method(Shape.class, "area");
  static final Method SHAPE_SCALE = method(Shape.class, "scale", double.class);
  static final Method SHAPE_CHILD = method(Shape.class, "child");
  static final Method SQUARE_AREA = method(Square.class, "area");

  record CallPattern(String text) implements Expectation {
    @Override
    public String describe() {
      return text;
    }
  }

  @SneakyThrows
  static Method method(Class<?> type, String name, Class<?>... parameterTypes) {
    return type.getMethod(name, parameterTypes);
  }

  static RecordedInvocation call(Method method, Object... arguments) {
    return new RecordedInvocation(method, arguments);
  }
}
