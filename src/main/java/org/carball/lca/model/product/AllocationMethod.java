package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AllocationMethod {
    /** material mass / total mass */
    MASS("mass"),
    /** material mass x unit price / sum over all materials */
    ECONOMIC("economic");

    private final String name;

    AllocationMethod(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static AllocationMethod fromName(String name) {
        if (name == null) {
            return MASS;
        }
        for (AllocationMethod method : values()) {
            if (method.name.equalsIgnoreCase(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown allocation method: " + name + ". Use: mass or economic");
    }
}
