package com.example.shipping.domain.policy.carrier;

import java.util.Random;

import com.example.shipping.domain.model.Carrier;
import com.example.shipping.domain.model.Order;
import com.example.shipping.domain.policy.ShippingStrategy;

/**
 * 呼び出し毎に [0, 1) の乱数を引いて cost に掛ける。
 * 同じ注文でも結果は一致しない。乱数源はテスト用に注入できる。
 */
public class EmsShipping implements ShippingStrategy {
	// java.util.Random はスレッドセーフ
	private static final Random SHARED_RANDOM = new Random();

	private final Random random;

	public EmsShipping() {
		this(SHARED_RANDOM);
	}

	public EmsShipping(Random random) {
		if (random == null)
			throw new IllegalArgumentException("random must not be null");
		this.random = random;
	}

	@Override
	public double calculate(Order order) {
		return random.nextDouble() * order.cost();
	}

	@Override
	public Carrier carrier() {
		return Carrier.EMS;
	}

	@Override
	public String toString() {
		return name();
	}
}
