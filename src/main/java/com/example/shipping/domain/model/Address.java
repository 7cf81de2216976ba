package com.example.shipping.domain.model;

public record Address(String contactName, String city, String region, String country, String postalCode) {

	// 国だけ分かっていれば計算できる
	public static Address ofCountry(String country) {
		return new Address(null, null, null, country, null);
	}
}
