package com.github.salilvnair.portassist.intent;

public enum MatchType {
    REGEX,
    CONTAINS,
    STARTS_WITH
}
