package com.testbed.guest;

import java.util.List;

/** Provision step collaborator: the guests provisioned for a plan, in provisioning order. */
@FunctionalInterface
public interface Provision {

    List<Guest> guests();
}
