package com.eyelevel.lotprocessor.model;

/**
 * Defines the states of a {@link WebhookDelivery}.
 */
public enum DeliveryStatus {
    /**
     * Waiting for its first attempt or for a scheduled retry.
     */
    PENDING,
    /**
     * The endpoint answered with a 2xx status. Terminal.
     */
    DELIVERED,
    /**
     * Every attempt failed. Terminal once the attempt count reached the configured maximum.
     */
    FAILED
}
