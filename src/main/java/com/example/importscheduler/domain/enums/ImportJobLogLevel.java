package com.example.importscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ImportJobLogLevel {

    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String code;
}
