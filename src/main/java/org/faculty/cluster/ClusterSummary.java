package org.faculty.cluster;

import java.util.List;

/**
 * One cluster and its members, in input order.
 */
public record ClusterSummary(int clusterId, List<ClusterAssignment> members) {

    public ClusterSummary {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
