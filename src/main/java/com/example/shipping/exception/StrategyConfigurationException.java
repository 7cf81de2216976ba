package com.example.shipping.exception;

/**
 * StrategyConfigurationException
 * Thrown when the strategy table is broken: empty, duplicated names or null factories.
 * Not retryable.
 */
public class StrategyConfigurationException extends RuntimeException {

	public StrategyConfigurationException(String message) {
		super(message);
	}
}
