package com.codurance.backoff.client;

import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;

/**
 * Builds AWS SDK v2 clients from a builder supplier such as
 * {@code CloudWatchClient::builder}, applying the descriptor's region,
 * credentials and endpoint override.
 */
public class AwsClientFactory<C extends SdkClient> implements ClientFactory<C> {
  private static final Logger logger = LoggerFactory.getLogger(AwsClientFactory.class);

  private final Supplier<? extends AwsClientBuilder<?, C>> builderSupplier;

  public AwsClientFactory(Supplier<? extends AwsClientBuilder<?, C>> builderSupplier) {
    this.builderSupplier = Objects.requireNonNull(builderSupplier, "builderSupplier");
  }

  public static <C extends SdkClient> AwsClientFactory<C> of(Supplier<? extends AwsClientBuilder<?, C>> builderSupplier) {
    return new AwsClientFactory<>(builderSupplier);
  }

  /**
   * @throws IllegalArgumentException if the built client serves another
   *     service than the descriptor names
   */
  @Override
  public C create(ServiceDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    AwsClientBuilder<?, C> builder = builderSupplier.get();
    descriptor.getRegion().ifPresent(builder::region);
    descriptor.getCredentialsProvider().ifPresent(builder::credentialsProvider);
    descriptor.getEndpointOverride().ifPresent(builder::endpointOverride);

    C client = builder.build();
    if (!descriptor.getServiceName().equalsIgnoreCase(client.serviceName())) {
      client.close();
      throw new IllegalArgumentException("Builder produced a client for service " + client.serviceName()
          + " but " + descriptor.getServiceName() + " was requested");
    }
    logger.debug("Created {} client for {}", client.serviceName(), descriptor);
    return client;
  }
}
