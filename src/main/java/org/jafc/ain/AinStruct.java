package org.jafc.ain;

import java.util.Collections;
import java.util.List;

/**
 * A structure definition. The member list is set exactly once after the structure
 * has been created, so that members may refer to the structure itself.
 */
public class AinStruct {

    private final String name;
    private List<AinVariable> members;

    public AinStruct(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The members in declaration order; empty until {@link #setMembers(List)} was called.
     */
    public List<AinVariable> getMembers() {
        return members == null ? Collections.emptyList() : members;
    }

    public boolean hasMembers() {
        return members != null;
    }

    /**
     * @param members The members in declaration order.
     * @throws IllegalStateException if the members were already set.
     */
    public void setMembers(List<AinVariable> members) {
        if (this.members != null) {
            throw new IllegalStateException("Members of struct '" + name + "' are already defined");
        }
        this.members = List.copyOf(members);
    }
}
