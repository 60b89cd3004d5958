package com.codurance.backoff;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves operations and attributes on a client by name.
 *
 * SDK clients are usually package-private classes behind a public interface,
 * so resolved methods are looked up again on a public type before use.
 */
final class OperationResolver {
  private static final Map<Class<?>, Class<?>> BOXES = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      char.class, Character.class,
      short.class, Short.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class);

  private OperationResolver() {
  }

  static boolean hasOperation(Class<?> type, String name) {
    return Arrays.stream(type.getMethods()).anyMatch(m -> m.getName().equals(name));
  }

  /**
   * Most specific public method named {@code name} that accepts {@code args}.
   */
  static Method resolveMethod(Class<?> type, String name, Object[] args) {
    List<Method> applicable = new ArrayList<>();
    for (Method method : type.getMethods()) {
      if (method.getName().equals(name) && !method.isBridge() && accepts(method, args))
        applicable.add(method);
    }
    if (applicable.isEmpty())
      throw new NoSuchOperationException(name, "No operation " + name + " on " + type.getName()
          + " accepts " + args.length + " argument(s) of the given types");

    Method best = applicable.get(0);
    for (Method candidate : applicable.subList(1, applicable.size())) {
      if (isMoreSpecific(candidate, best)) {
        best = candidate;
      } else if (!isMoreSpecific(best, candidate)) {
        throw new NoSuchOperationException(name, "Ambiguous operation " + name + " on " + type.getName()
            + ": " + best + " and " + candidate);
      }
    }
    return accessible(type, best);
  }

  static Optional<Field> resolveField(Class<?> type, String name) {
    try {
      return Optional.of(type.getField(name));
    } catch (NoSuchFieldException e) {
      return Optional.empty();
    }
  }

  private static boolean accepts(Method method, Object[] args) {
    Class<?>[] params = method.getParameterTypes();
    if (params.length != args.length)
      return false;
    for (int i = 0; i < params.length; i++) {
      Object arg = args[i];
      if (arg == null) {
        if (params[i].isPrimitive())
          return false;
      } else if (!box(params[i]).isInstance(arg)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isMoreSpecific(Method a, Method b) {
    Class<?>[] pa = a.getParameterTypes();
    Class<?>[] pb = b.getParameterTypes();
    for (int i = 0; i < pa.length; i++) {
      if (!box(pb[i]).isAssignableFrom(box(pa[i])))
        return false;
    }
    return true;
  }

  private static Class<?> box(Class<?> type) {
    return type.isPrimitive() ? BOXES.get(type) : type;
  }

  private static Method accessible(Class<?> type, Method method) {
    if (Modifier.isPublic(method.getDeclaringClass().getModifiers()))
      return method;
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      for (Class<?> iface : c.getInterfaces()) {
        Method found = publicMethod(iface, method);
        if (found != null)
          return found;
      }
      if (c != type) {
        Method found = publicMethod(c, method);
        if (found != null)
          return found;
      }
    }
    return method;
  }

  private static Method publicMethod(Class<?> owner, Method method) {
    if (!Modifier.isPublic(owner.getModifiers()))
      return null;
    try {
      return owner.getMethod(method.getName(), method.getParameterTypes());
    } catch (NoSuchMethodException e) {
      return null;
    }
  }
}
