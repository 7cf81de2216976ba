package com.example.shipping;

import com.example.shipping.app.ShippingQuoteService;
import com.example.shipping.app.ShippingStrategyRegistry;
import com.example.shipping.domain.model.Address;
import com.example.shipping.domain.model.Order;

public class ShippingCostDemo {
	private ShippingCostDemo() {
	}

	public static void main(String[] args) {
		var order = new Order(1000, Address.ofCountry("Russia"));
		var service = new ShippingQuoteService(new ShippingStrategyRegistry());

		System.out.println(service.quote("FedEx", order).describe());

		for (var quote : service.compareAll(order)) {
			System.out.println(quote.describe());
		}
	}
}
