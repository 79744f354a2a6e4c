// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

/**
 * Thrown when a node is looked up by a name which is not in the topology.
 *
 * @author nodeverify
 */
public class NodeNotFoundException extends RuntimeException {

    public NodeNotFoundException(String name) {
        super("Node " + name + " was not found");
    }

}
