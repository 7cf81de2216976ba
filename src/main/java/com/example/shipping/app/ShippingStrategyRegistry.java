package com.example.shipping.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.shipping.domain.policy.ShippingStrategy;
import com.example.shipping.domain.policy.carrier.EmsShipping;
import com.example.shipping.domain.policy.carrier.FedExShipping;
import com.example.shipping.domain.policy.carrier.UpsShipping;
import com.example.shipping.exception.StrategyConfigurationException;
import com.example.shipping.exception.StrategyNotFoundException;

/**
 * 名前 → 配送戦略ファクトリの対応表。
 * 生成時に一度だけ組み立て、以後は読み取り専用（ロック不要）。
 * get / listAll は呼び出し毎に新しいインスタンスを返す。
 */
public class ShippingStrategyRegistry {

	private static final Logger log = LoggerFactory.getLogger(ShippingStrategyRegistry.class);

	private final Map<String, Supplier<ShippingStrategy>> factories;

	public ShippingStrategyRegistry() {
		this(new Random());
	}

	// EMS の乱数源注入用
	public ShippingStrategyRegistry(Random random) {
		this(defaultFactories(random));
	}

	// 戦略表の差し替え用
	public ShippingStrategyRegistry(List<Supplier<ShippingStrategy>> factories) {
		if (factories == null)
			throw new StrategyConfigurationException("strategy factories must not be null");
		Map<String, Supplier<ShippingStrategy>> table = new LinkedHashMap<>();
		for (var factory : factories) {
			String name = nameOf(factory);
			if (table.containsKey(name))
				throw new StrategyConfigurationException("duplicate strategy name: " + name);
			table.put(name, factory);
			log.debug("Registered shipping strategy name={}", name);
		}
		this.factories = Collections.unmodifiableMap(table);
		log.info("Shipping strategy registry ready: {}", this.factories.keySet());
	}

	public ShippingStrategy get(String name) {
		Supplier<ShippingStrategy> factory = (name != null) ? factories.get(name) : null;
		if (factory == null) {
			log.debug("Shipping strategy lookup failed name={}", name);
			throw new StrategyNotFoundException(name);
		}
		return factory.get();
	}

	public List<ShippingStrategy> listAll() {
		if (factories.isEmpty())
			throw new StrategyConfigurationException("no strategies registered");
		List<ShippingStrategy> result = new ArrayList<>(factories.size());
		for (var factory : factories.values()) {
			result.add(factory.get());
		}
		return List.copyOf(result);
	}

	public List<String> names() {
		return List.copyOf(factories.keySet());
	}

	public boolean contains(String name) {
		return name != null && factories.containsKey(name);
	}

	private static List<Supplier<ShippingStrategy>> defaultFactories(Random random) {
		if (random == null)
			throw new StrategyConfigurationException("random must not be null");
		return List.of(
				UpsShipping::new, // 1. UPS
				FedExShipping::new, // 2. FedEx
				() -> new EmsShipping(random) // 3. EMS
		);
	}

	// 登録時に一度だけ生成して名前を読む
	private static String nameOf(Supplier<ShippingStrategy> factory) {
		if (factory == null)
			throw new StrategyConfigurationException("strategy factory must not be null");
		ShippingStrategy probe = factory.get();
		if (probe == null)
			throw new StrategyConfigurationException("strategy factory returned null");
		String name = probe.name();
		if (name == null || name.isBlank())
			throw new StrategyConfigurationException("strategy name must not be blank");
		return name;
	}
}
