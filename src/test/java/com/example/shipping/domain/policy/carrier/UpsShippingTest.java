package com.example.shipping.domain.policy.carrier;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.shipping.domain.model.Address;
import com.example.shipping.domain.model.Carrier;
import com.example.shipping.domain.model.Order;

class UpsShippingTest {

	UpsShipping sut = new UpsShipping();

	@Test
	@Tag("anchor")
	@DisplayName("UPS anchorテスト 1000 → 300")
	void charges_thirty_percent_of_cost() {
		assertThat(sut.calculate(new Order(1000, Address.ofCountry("Russia")))).isEqualTo(300.0);
	}

	@ParameterizedTest
	@ValueSource(doubles = { 0, 1, 99.99, 12345.678 })
	void ratio_is_constant(double cost) {
		assertThat(sut.calculate(new Order(cost, Address.ofCountry("Germany")))).isEqualTo(cost * 0.3);
	}

	@Test
	@DisplayName("国に依存しない")
	void ignores_destination_country() {
		var toUsa = sut.calculate(new Order(500, Address.ofCountry("USA")));
		var toJapan = sut.calculate(new Order(500, Address.ofCountry("Japan")));

		assertThat(toUsa).isEqualTo(toJapan);
	}

	@Test
	void is_named_after_carrier() {
		assertThat(sut.carrier()).isEqualTo(Carrier.UPS);
		assertThat(sut.name()).isEqualTo("UPS");
		assertThat(sut).hasToString("UPS");
	}
}
