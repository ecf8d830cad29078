package com.retail.herd.model;

public enum TrendStatus {
    NORMAL,
    RISING,
    TRENDING_UP,
    FALLING,
    TRENDING_DOWN;

    public boolean isTrending() {
        return this == TRENDING_UP || this == TRENDING_DOWN;
    }
}
