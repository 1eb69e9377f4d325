package com.loanmatch.matching.config;

import lombok.Getter;

import java.util.List;

/**
 * Thrown at startup when matching or escalation settings are inconsistent. Fatal: the context does not start.
 */
@Getter
public class InvalidMatchingConfigurationException extends RuntimeException {

    private final List<String> problems;

    public InvalidMatchingConfigurationException(List<String> problems) {
        super("Invalid matching configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
