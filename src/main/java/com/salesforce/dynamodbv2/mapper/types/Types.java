package com.salesforce.dynamodbv2.mapper.types;

/**
 * Factory methods for the built-in types.
 */
public final class Types {

    private static final StringType STRING = new StringType();
    private static final NumberType NUMBER = new NumberType();
    private static final IntegerType INTEGER = new IntegerType();
    private static final BinaryType BINARY = new BinaryType();
    private static final BooleanType BOOLEAN = new BooleanType();
    private static final UuidType UUID = new UuidType();
    private static final InstantType INSTANT = new InstantType();

    private Types() {
    }

    public static StringType string() {
        return STRING;
    }

    public static NumberType number() {
        return NUMBER;
    }

    public static IntegerType integer() {
        return INTEGER;
    }

    public static BinaryType binary() {
        return BINARY;
    }

    public static BooleanType bool() {
        return BOOLEAN;
    }

    public static UuidType uuid() {
        return UUID;
    }

    public static InstantType instant() {
        return INSTANT;
    }

    public static <V> SetType<V> setOf(Type<V> elementType) {
        return new SetType<>(elementType);
    }

    public static <V> ListType<V> listOf(Type<V> elementType) {
        return new ListType<>(elementType);
    }

    public static <V> TypedMapType<V> mapOf(Type<V> valueType) {
        return new TypedMapType<>(valueType);
    }

    public static MapType.Builder document() {
        return MapType.builder();
    }

}
