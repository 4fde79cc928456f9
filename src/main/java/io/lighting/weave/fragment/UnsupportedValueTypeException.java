package io.lighting.weave.fragment;

public class UnsupportedValueTypeException extends IllegalArgumentException {
    private final Class<?> valueType;

    public UnsupportedValueTypeException(Class<?> valueType) {
        super("Can't escape type " + valueType.getName());
        this.valueType = valueType;
    }

    public Class<?> valueType() {
        return valueType;
    }
}
