package io.shogun.api.shipping;

/** Point-in-time view of the shipper for operators. */
public record ShippingStatus(boolean enabled, boolean configured, int queueSize) {}
