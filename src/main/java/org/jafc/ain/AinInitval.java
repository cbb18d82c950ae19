package org.jafc.ain;

/**
 * The constant initial value of a global variable.
 *
 * @param globalIndex The index of the global.
 * @param dataType    The type of the payload: INT, FLOAT or STRING.
 * @param intValue    The payload if {@code dataType} is INT.
 * @param floatValue  The payload if {@code dataType} is FLOAT.
 * @param stringValue The payload if {@code dataType} is STRING, otherwise null.
 */
public record AinInitval(int globalIndex, AinDataType dataType, int intValue, float floatValue, String stringValue) {

    public static AinInitval ofInt(int globalIndex, int value) {
        return new AinInitval(globalIndex, AinDataType.INT, value, 0f, null);
    }

    public static AinInitval ofFloat(int globalIndex, float value) {
        return new AinInitval(globalIndex, AinDataType.FLOAT, 0, value, null);
    }

    public static AinInitval ofString(int globalIndex, String value) {
        return new AinInitval(globalIndex, AinDataType.STRING, 0, 0f, value);
    }

    /**
     * @return The payload boxed according to {@link #dataType()}.
     */
    public Object value() {
        return switch (dataType) {
            case INT -> intValue;
            case FLOAT -> floatValue;
            case STRING -> stringValue;
            default -> throw new IllegalStateException("Unexpected initval type: " + dataType);
        };
    }
}
