package org.jafc.ain;

/**
 * The type of a variable, member or return value in the bytecode object.
 *
 * @param data  The data type.
 * @param struc The structure index if {@code data} is {@link AinDataType#STRUCT}, otherwise -1.
 */
public record AinType(AinDataType data, int struc) {

    public static final AinType VOID = new AinType(AinDataType.VOID, -1);
    public static final AinType INT = new AinType(AinDataType.INT, -1);
    public static final AinType FLOAT = new AinType(AinDataType.FLOAT, -1);
    public static final AinType STRING = new AinType(AinDataType.STRING, -1);

    public AinType {
        if (data == null) {
            throw new IllegalArgumentException("data type must not be null");
        }
        if (data != AinDataType.STRUCT) {
            struc = -1;
        }
    }

    /**
     * Returns the shared instance for a non-structure data type.
     * @param data The data type. Must not be {@link AinDataType#STRUCT}.
     * @return The type.
     */
    public static AinType of(AinDataType data) {
        return switch (data) {
            case VOID -> VOID;
            case INT -> INT;
            case FLOAT -> FLOAT;
            case STRING -> STRING;
            case STRUCT -> throw new IllegalArgumentException("structure types need a structure index");
        };
    }

    /**
     * @param structNo The index of the structure.
     * @return A structure type.
     */
    public static AinType struct(int structNo) {
        return new AinType(AinDataType.STRUCT, structNo);
    }

    public boolean isNumeric() {
        return data.isNumeric();
    }

    @Override
    public String toString() {
        return data == AinDataType.STRUCT ? "struct#" + struc : data.name().toLowerCase();
    }
}
