package com.stlmonitor.core.model;

public enum FeedDialect {
    RSS,
    ATOM
}
