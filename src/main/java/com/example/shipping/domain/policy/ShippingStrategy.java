package com.example.shipping.domain.policy;

import com.example.shipping.domain.model.Carrier;
import com.example.shipping.domain.model.Order;

public interface ShippingStrategy {
	/**
	 * order: cost >= 0, destination 非null を前提とする
	 * 返り値: order.cost と同じ通貨単位の配送料（>=0、副作用なし）
	 */
	double calculate(Order order);

	Carrier carrier();

	/**
	 * レジストリのキー兼表示名。既定は carrier() の表示名。
	 * Carrier にない独自の戦略を差し替え用の戦略表に載せる場合は name() を上書きすること。
	 */
	default String name() {
		return carrier().displayName();
	}
}
