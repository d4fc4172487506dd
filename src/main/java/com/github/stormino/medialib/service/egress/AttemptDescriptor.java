package com.github.stormino.medialib.service.egress;

import lombok.NonNull;
import lombok.Value;

/**
 * One rung of the strategy ladder.
 */
@Value
public class AttemptDescriptor {

    @NonNull
    RouteDescriptor route;

    @NonNull
    ClientIdentity clientIdentity;

    boolean useCredential;

    @Override
    public String toString() {
        return "route=" + route + ", client=" + clientIdentity.getToolName()
                + ", credential=" + (useCredential ? "yes" : "no");
    }
}
