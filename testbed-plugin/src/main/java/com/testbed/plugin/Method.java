package com.testbed.plugin;

import java.util.Comparator;
import java.util.Objects;

/**
 * A registered method of a step: the {@code how} value that selects it, a description and an
 * order. When {@code how} is a prefix of several method names the lowest order wins.
 */
public record Method(String stepName, String name, String description, int order) {

    public static final int DEFAULT_ORDER = 50;

    static final Comparator<Method> BY_ORDER =
            Comparator.comparingInt(Method::order).thenComparing(Method::name);

    public Method {
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(name, "name");
        description = description != null ? description : "";
    }
}
