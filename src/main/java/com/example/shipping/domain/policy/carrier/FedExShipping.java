package com.example.shipping.domain.policy.carrier;

import java.util.Set;

import com.example.shipping.domain.model.Carrier;
import com.example.shipping.domain.model.Order;
import com.example.shipping.domain.policy.ShippingStrategy;

public class FedExShipping implements ShippingStrategy {
	// 完全一致のみ（大文字小文字・国コードの正規化はしない）
	private static final Set<String> DISCOUNTED_COUNTRIES = Set.of("Russia", "USA");
	private static final double DISCOUNTED_DIVISOR = 7d;
	private static final double DEFAULT_DIVISOR = 5d;

	@Override
	public double calculate(Order order) {
		String country = order.destination().country();
		if (country != null && DISCOUNTED_COUNTRIES.contains(country)) {
			return order.cost() / DISCOUNTED_DIVISOR;
		}
		return order.cost() / DEFAULT_DIVISOR;
	}

	@Override
	public Carrier carrier() {
		return Carrier.FEDEX;
	}

	@Override
	public String toString() {
		return name();
	}
}
