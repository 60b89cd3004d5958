package com.codurance.backoff.client;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;

/**
 * Identifies the service a client is built for, with optional region,
 * credentials and endpoint. Unset values fall back to the SDK's default
 * provider chains.
 */
public final class ServiceDescriptor {
  private final String serviceName;
  private final Region region;
  private final AwsCredentialsProvider credentialsProvider;
  private final URI endpointOverride;

  private ServiceDescriptor(Builder builder) {
    this.serviceName = builder.serviceName;
    this.region = builder.region;
    this.credentialsProvider = builder.credentialsProvider;
    this.endpointOverride = builder.endpointOverride;
  }

  public static ServiceDescriptor of(String serviceName) {
    return newBuilder(serviceName).build();
  }

  public static Builder newBuilder(String serviceName) {
    return new Builder(serviceName);
  }

  public String getServiceName() { return serviceName; }
  public Optional<Region> getRegion() { return Optional.ofNullable(region); }
  public Optional<AwsCredentialsProvider> getCredentialsProvider() { return Optional.ofNullable(credentialsProvider); }
  public Optional<URI> getEndpointOverride() { return Optional.ofNullable(endpointOverride); }

  @Override
  public String toString() {
    return "ServiceDescriptor{serviceName=" + serviceName
        + ", region=" + region
        + ", endpointOverride=" + endpointOverride + "}";
  }

  public static class Builder {
    private final String serviceName;
    private Region region;
    private AwsCredentialsProvider credentialsProvider;
    private URI endpointOverride;

    public Builder(String serviceName) {
      Objects.requireNonNull(serviceName, "serviceName");
      if (serviceName.isBlank())
        throw new IllegalArgumentException("serviceName must not be blank");
      this.serviceName = serviceName;
    }

    public Builder region(Region region) {
      this.region = region;
      return this;
    }

    public Builder credentialsProvider(AwsCredentialsProvider provider) {
      this.credentialsProvider = provider;
      return this;
    }

    public Builder endpointOverride(URI endpoint) {
      this.endpointOverride = endpoint;
      return this;
    }

    public ServiceDescriptor build() {
      return new ServiceDescriptor(this);
    }
  }
}
