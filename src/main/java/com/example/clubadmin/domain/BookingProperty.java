package com.example.clubadmin.domain;

/** Cabin a booking payment belongs to; selects the booking revenue account. */
public enum BookingProperty {
    TAHOE("tahoe_booking_revenue"),
    CLEAR_LAKE("clear_lake_booking_revenue");

    private final String revenueAccount;

    BookingProperty(String revenueAccount) {
        this.revenueAccount = revenueAccount;
    }

    public String revenueAccount() {
        return revenueAccount;
    }
}
