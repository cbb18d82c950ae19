package org.jafc.ain;

/**
 * A named, typed slot in the bytecode object: a function argument or local,
 * a global variable or a structure member.
 */
public class AinVariable {

    private final String name;
    private final String name2;
    private AinType type;

    /**
     * @param name  The variable name.
     * @param name2 The secondary name (only present in version 12 and later), may be null.
     * @param type  The type, may be null if it is filled in later.
     */
    public AinVariable(String name, String name2, AinType type) {
        this.name = name;
        this.name2 = name2;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public String getName2() {
        return name2;
    }

    public AinType getType() {
        return type;
    }

    public void setType(AinType type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
