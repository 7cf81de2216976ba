package com.example.shipping.app;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.shipping.domain.model.Order;
import com.example.shipping.domain.policy.ShippingStrategy;
import com.example.shipping.dto.ShippingQuote;

public class ShippingQuoteService {

	private static final Logger log = LoggerFactory.getLogger(ShippingQuoteService.class);

	private final ShippingStrategyRegistry registry;

	public ShippingQuoteService(ShippingStrategyRegistry registry) {
		this.registry = registry;
	}

	public ShippingQuote quote(String carrierName, Order order) {
		validateOrder(order);
		return quoteWith(registry.get(carrierName), order);
	}

	// 登録順に全社分の見積りを返す（一部だけ返すことはしない）
	public List<ShippingQuote> compareAll(Order order) {
		validateOrder(order);
		List<ShippingQuote> quotes = registry.listAll().stream()
				.map(s -> quoteWith(s, order))
				.toList();
		log.debug("Compared {} shipping strategies for cost={}", quotes.size(), order.cost());
		return quotes;
	}

	private ShippingQuote quoteWith(ShippingStrategy strategy, Order order) {
		return new ShippingQuote(strategy.name(), strategy.calculate(order));
	}

	private void validateOrder(Order order) {
		if (order == null)
			throw new IllegalArgumentException("order must not be null");
	}
}
