package com.aycom.explore.model;

public enum MembershipStatus {
    NONE,
    PENDING,
    JOINED
}
