package co.keyfmt.core.compile;

import co.keyfmt.core.FieldType;

/**
 * One input of a compiled key.
 *
 * @param name      parameter name, the last component of the field path
 * @param fieldPath dotted path of the record field it stands for
 * @param type      the field's semantic type
 */
public record KeyParameter(String name, String fieldPath, FieldType type) {}
