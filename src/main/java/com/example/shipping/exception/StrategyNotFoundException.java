package com.example.shipping.exception;

/**
 * StrategyNotFoundException
 * Thrown when no shipping strategy is registered under the requested name.
 */
public class StrategyNotFoundException extends RuntimeException {

	private final String strategyName;

	public StrategyNotFoundException(String strategyName) {
		super("strategy not found: " + strategyName);
		this.strategyName = strategyName;
	}

	public String strategyName() {
		return strategyName;
	}
}
