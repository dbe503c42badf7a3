package com.challenges.tslgen.parser;

/** Name length limits enforced while parsing. */
public final class TslLimits {
    public static final int MAX_CATEGORY_NAME_LENGTH = 80;
    public static final int MAX_CHOICE_NAME_LENGTH = 80;
    public static final int MAX_PROPERTY_NAME_LENGTH = 32;

    private TslLimits() {
    }
}
