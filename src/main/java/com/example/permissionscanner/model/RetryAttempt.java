package com.example.permissionscanner.model;

import java.time.Instant;

/**
 * One failed call made while a request was being retried; {@code attempt} counts from 1.
 */
public record RetryAttempt(int attempt, Instant timestamp, String error) {
}
