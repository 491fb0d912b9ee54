package com.swapanalysis.pojo;

public enum LintLevel {
    ALLOW,
    WARN,
    DENY
}
