package com.example.shipping.domain.model;

/**
 * 配送料見積りの対象となる注文。
 * cost は 0 以上の有限値、destination は必須（未設定は生成時に IAE）。
 * origin は保持するだけで計算には使わない。
 */
public record Order(double cost, Address destination, Address origin) {

	public Order {
		if (Double.isNaN(cost) || Double.isInfinite(cost))
			throw new IllegalArgumentException("cost must be finite");
		if (cost < 0)
			throw new IllegalArgumentException("cost must be >= 0");
		if (destination == null)
			throw new IllegalArgumentException("destination must not be null");
	}

	public Order(double cost, Address destination) {
		this(cost, destination, null);
	}
}
