package com.querybreakdown.search;

public enum EditType {
    DELETION,
    REPLACEMENT
}
