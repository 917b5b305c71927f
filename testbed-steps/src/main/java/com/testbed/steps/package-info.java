/**
 * Plan and step pipeline. A {@link com.testbed.steps.Plan} owns an execute and a report step;
 * each step turns its configuration records into phases through the plugin registry, runs them
 * and persists its state under the plan workdir.
 */
package com.testbed.steps;
