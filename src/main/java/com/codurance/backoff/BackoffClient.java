package com.codurance.backoff;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.backoff.client.ClientFactory;
import com.codurance.backoff.client.ServiceDescriptor;
import com.codurance.backoff.errors.AwsErrorCodeExtractor;
import com.codurance.backoff.errors.ErrorCodeExtractor;
import com.codurance.backoff.reliability.RetryLoop;
import com.codurance.backoff.reliability.RetryOptions;
import com.codurance.backoff.reliability.RetryPolicy;
import com.codurance.backoff.reliability.Sleeper;

/**
 * Retrying wrapper around a service client.
 *
 * Every operation called through the wrapper runs inside a {@link RetryLoop}
 * driven by the wrapper's {@link RetryPolicy}:
 * - {@link #call(Function)} for typed access through a lambda
 * - {@link #invoke(String, Object...)} for access by operation name
 * - {@link #proxy(Class)} for a drop-in implementation of the client interface
 *
 * The wrapper never changes after construction. {@link #withOptions} returns a
 * sibling over the same client with a derived policy, and {@link #close()} is a
 * no-op so siblings can be scoped with try-with-resources:
 *
 * <pre>{@code
 * BackoffClient<CloudWatchClient> cloudWatch = BackoffClient.of(CloudWatchClient.create());
 * try (BackoffClient<CloudWatchClient> lenient = cloudWatch.withOptions(
 *     RetryOptions.newBuilder().ignoredErrorCodes("ResourceNotFound").build())) {
 *   lenient.call(c -> c.describeAlarms(request));
 * }
 * }</pre>
 *
 * Thread safety is whatever the wrapped client offers; the wrapper adds no locking.
 */
public class BackoffClient<C> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(BackoffClient.class);

  private final C client;
  private final RetryPolicy policy;
  private final ErrorCodeExtractor errorCodeExtractor;
  private final Sleeper sleeper;
  private final RetryLoop retryLoop;

  private BackoffClient(Builder<C> builder) {
    this.client = Objects.requireNonNull(builder.client, "client");
    this.policy = Objects.requireNonNull(builder.policy, "policy");
    this.errorCodeExtractor = Objects.requireNonNull(builder.errorCodeExtractor, "errorCodeExtractor");
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
    this.retryLoop = new RetryLoop(policy, errorCodeExtractor, sleeper);
  }

  public static <C> Builder<C> newBuilder(C client) {
    return new Builder<>(client);
  }

  public static <C> BackoffClient<C> of(C client) {
    return newBuilder(client).build();
  }

  public static <C> BackoffClient<C> of(C client, RetryPolicy policy) {
    return newBuilder(client).policy(policy).build();
  }

  /**
   * Build the client through the given factory, then wrap it.
   */
  public static <C> BackoffClient<C> create(ClientFactory<C> factory, ServiceDescriptor descriptor, RetryPolicy policy) {
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(descriptor, "descriptor");
    C client = factory.create(descriptor);
    logger.debug("Wrapping client for {} with {}", descriptor.getServiceName(), policy);
    return of(client, policy);
  }

  /**
   * Run one operation against the client through the retry loop.
   *
   * @return the operation's result, or {@code null} if the failure was ignored
   */
  public <T> T call(Function<? super C, ? extends T> operation) {
    Objects.requireNonNull(operation, "operation");
    try {
      return retryLoop.execute(() -> operation.apply(client));
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Unexpected checked failure from operation", e);
    }
  }

  /**
   * Call an operation by name. A public field with that name is returned as
   * is when no operation exists and no arguments are given; reading it never
   * goes through the retry loop.
   *
   * @return the operation's result, the attribute value, or {@code null} if
   *     the failure was ignored
   * @throws NoSuchOperationException if nothing with that name accepts the arguments
   */
  public Object invoke(String operationName, Object... args) throws Exception {
    Objects.requireNonNull(operationName, "operationName");
    Object[] arguments = args == null ? new Object[0] : args;
    Class<?> type = client.getClass();

    if (!OperationResolver.hasOperation(type, operationName)) {
      Optional<Field> attribute = OperationResolver.resolveField(type, operationName);
      if (attribute.isPresent() && arguments.length == 0)
        return attribute.get().get(client);
      throw new NoSuchOperationException(operationName,
          "No operation or attribute " + operationName + " on " + type.getName());
    }

    Method method = OperationResolver.resolveMethod(type, operationName, arguments);
    return retryLoop.execute(() -> RetryingInvocationHandler.invokeUnwrapped(client, method, arguments));
  }

  /**
   * An implementation of {@code type} backed by the client, with every call
   * going through the retry loop. Ignored failures come back as {@code null},
   * or zero for primitive return types.
   */
  public <I> I proxy(Class<I> type) {
    Objects.requireNonNull(type, "type");
    if (!type.isInterface())
      throw new IllegalArgumentException(type.getName() + " is not an interface");
    if (!type.isInstance(client))
      throw new IllegalArgumentException(client.getClass().getName() + " does not implement " + type.getName());
    Object proxy = Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] {type},
        new RetryingInvocationHandler(client, retryLoop));
    return type.cast(proxy);
  }

  /**
   * A sibling wrapper over the same client whose policy overlays {@code options}.
   */
  public BackoffClient<C> withOptions(RetryOptions options) {
    return newBuilder(client)
        .policy(policy.deriveWith(options))
        .errorCodeExtractor(errorCodeExtractor)
        .sleeper(sleeper)
        .build();
  }

  public C getClient() {
    return client;
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  /** Nothing is held; the wrapped client stays open. */
  @Override
  public void close() {
  }

  public static class Builder<C> {
    private final C client;
    private RetryPolicy policy = RetryPolicy.defaults();
    private ErrorCodeExtractor errorCodeExtractor = new AwsErrorCodeExtractor();
    private Sleeper sleeper = Sleeper.THREAD;

    public Builder(C client) {
      this.client = client;
    }

    public Builder<C> policy(RetryPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Builder<C> errorCodeExtractor(ErrorCodeExtractor extractor) {
      this.errorCodeExtractor = extractor;
      return this;
    }

    public Builder<C> sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public BackoffClient<C> build() {
      return new BackoffClient<>(this);
    }
  }
}
