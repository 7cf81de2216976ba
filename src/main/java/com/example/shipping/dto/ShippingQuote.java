package com.example.shipping.dto;

public record ShippingQuote(String carrier, double cost) {

	public String describe() {
		return "Shipping cost from " + carrier + " is: " + cost;
	}
}
