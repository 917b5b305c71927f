package com.testbed.discover;

import java.util.List;

/** Discover step collaborator: the tests selected for a plan, in execution order. */
@FunctionalInterface
public interface Discover {

    List<DiscoveredTest> tests();
}
