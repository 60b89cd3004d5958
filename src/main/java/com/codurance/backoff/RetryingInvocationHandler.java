package com.codurance.backoff;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Map;

import com.codurance.backoff.reliability.RetryLoop;

/**
 * Routes every interface call through a {@link RetryLoop}. Object methods are
 * answered by the proxy itself and never reach the client.
 */
final class RetryingInvocationHandler implements InvocationHandler {
  private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
      boolean.class, false,
      byte.class, (byte) 0,
      char.class, '\0',
      short.class, (short) 0,
      int.class, 0,
      long.class, 0L,
      float.class, 0f,
      double.class, 0d);

  private final Object client;
  private final RetryLoop retryLoop;

  RetryingInvocationHandler(Object client, RetryLoop retryLoop) {
    this.client = client;
    this.retryLoop = retryLoop;
  }

  @Override
  public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
    if (method.getDeclaringClass() == Object.class)
      return invokeObjectMethod(proxy, method, args);

    Object result = retryLoop.execute(() -> invokeUnwrapped(client, method, args));
    if (result == null && method.getReturnType().isPrimitive())
      return ZERO_VALUES.get(method.getReturnType());
    return result;
  }

  private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
    switch (method.getName()) {
      case "equals":
        return args[0] != null && Proxy.isProxyClass(args[0].getClass())
            && Proxy.getInvocationHandler(args[0]) == this;
      case "hashCode":
        return System.identityHashCode(proxy);
      default:
        return "Retrying(" + client + ")";
    }
  }

  /**
   * Invoke reflectively, handing back the client's own exception instead of
   * the reflection wrapper so it can be classified and rethrown unchanged.
   */
  static Object invokeUnwrapped(Object target, Method method, Object[] args) throws Exception {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception)
        throw (Exception) cause;
      if (cause instanceof Error)
        throw (Error) cause;
      throw e;
    }
  }
}
