package com.example.clubadmin.domain;

public enum BoardPosition {
    PRESIDENT("President"),
    VICE_PRESIDENT("Vice President"),
    SECRETARY("Secretary"),
    TREASURER("Treasurer"),
    CLEAR_LAKE_CABIN_MASTER("Clear Lake Cabin Master"),
    TAHOE_CABIN_MASTER("Tahoe Cabin Master"),
    EVENT_DIRECTOR("Event Director"),
    MEMBER_OUTREACH("Member Outreach & Events"),
    MEMBERSHIP_DIRECTOR("Membership Director");

    private final String label;

    BoardPosition(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
