package com.challenges.tslgen.output;

public enum OutputFormat {
    TEXT,
    JSON
}
