// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

/**
 * The replication settings of a storage pool.
 *
 * @param size the number of replicas of each object
 * @param minSize the number of replicas below which the pool stops serving I/O
 *
 * @author nodeverify
 */
public record PoolReplication(int size, int minSize) {

    /** Returns the number of replicas this pool can lose before becoming under-replicated */
    public int margin() {
        return size - minSize;
    }

}
