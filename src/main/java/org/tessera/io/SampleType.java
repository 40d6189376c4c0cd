package org.tessera.io;

import mil.nga.tiff.FieldType;

/**
 * Unsigned integer sample formats written to GeoTIFF.
 */
public enum SampleType {
    UINT8(FieldType.BYTE, 0xFF),
    UINT16(FieldType.SHORT, 0xFFFF);

    private final FieldType fieldType;
    private final int maxValue;

    SampleType(FieldType fieldType, int maxValue) {
        this.fieldType = fieldType;
        this.maxValue = maxValue;
    }

    FieldType fieldType() {
        return fieldType;
    }

    public int maxValue() {
        return maxValue;
    }

    /** Clamps a sample into the representable range. */
    public int clamp(int value) {
        return value < 0 ? 0 : Math.min(value, maxValue);
    }
}
