package com.photocurator.node.kernel.resource;

/**
 * Platform hook that reads the current device resources.
 */
@FunctionalInterface
public interface ResourceSampler {

    ResourceStatus sample() throws Exception;
}
