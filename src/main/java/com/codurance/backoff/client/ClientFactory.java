package com.codurance.backoff.client;

/**
 * External - builds the underlying service client for a descriptor.
 */
@FunctionalInterface
public interface ClientFactory<C> {

  C create(ServiceDescriptor descriptor);
}
