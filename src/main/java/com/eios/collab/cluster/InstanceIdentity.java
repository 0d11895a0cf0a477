package com.eios.collab.cluster;

import com.eios.collab.config.CollabConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.UUID;

/**
 * Name of this process on the fan-out bus. Messages carrying it are echoes of our
 * own publishes and are ignored on receipt.
 */
@Singleton
public class InstanceIdentity {

    private final String id;

    @Inject
    public InstanceIdentity(CollabConfig config) {
        this(config.instanceId().orElseGet(() -> "instance-" + UUID.randomUUID().toString().substring(0, 8)));
    }

    public InstanceIdentity(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isSelf(String instanceId) {
        return id.equals(instanceId);
    }
}
