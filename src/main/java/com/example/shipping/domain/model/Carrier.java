package com.example.shipping.domain.model;

public enum Carrier {
	UPS("UPS"),
	FEDEX("FedEx"),
	EMS("EMS");

	private final String displayName;

	Carrier(String displayName) {
		this.displayName = displayName;
	}

	// レジストリのキーと表示名を兼ねる
	public String displayName() {
		return displayName;
	}
}
