package com.example.shipping.domain.policy.carrier;

import com.example.shipping.domain.model.Carrier;
import com.example.shipping.domain.model.Order;
import com.example.shipping.domain.policy.ShippingStrategy;

public class UpsShipping implements ShippingStrategy {
	private static final double RATIO = 0.3d;

	@Override
	public double calculate(Order order) {
		return order.cost() * RATIO;
	}

	@Override
	public Carrier carrier() {
		return Carrier.UPS;
	}

	@Override
	public String toString() {
		return name();
	}
}
