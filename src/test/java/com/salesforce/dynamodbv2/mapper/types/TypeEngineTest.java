package com.salesforce.dynamodbv2.mapper.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.salesforce.dynamodbv2.mapper.exceptions.InvalidModelException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests dumping and loading values through the built-in types.
 */
class TypeEngineTest {

    private final TypeEngine sut = new TypeEngine();

    private static Stream<Arguments> values() {
        return Stream.of(
            Arguments.of(Types.string(), "hello", new AttributeValue().withS("hello")),
            Arguments.of(Types.number(), new BigDecimal("1.5"), new AttributeValue().withN("1.5")),
            Arguments.of(Types.integer(), 42L, new AttributeValue().withN("42")),
            Arguments.of(Types.bool(), true, new AttributeValue().withBOOL(true)),
            Arguments.of(Types.uuid(), UUID.fromString("6a1c36c2-3d4c-4a53-8e3b-6a1d6f0a1e2f"),
                new AttributeValue().withS("6a1c36c2-3d4c-4a53-8e3b-6a1d6f0a1e2f")),
            Arguments.of(Types.instant(), Instant.parse("2019-03-01T10:15:30Z"),
                new AttributeValue().withS("2019-03-01T10:15:30Z")),
            Arguments.of(Types.setOf(Types.string()), ImmutableSet.of("a", "b"),
                new AttributeValue().withSS("a", "b")),
            Arguments.of(Types.setOf(Types.integer()), ImmutableSet.of(1L, 2L),
                new AttributeValue().withNS("1", "2")),
            Arguments.of(Types.listOf(Types.string()), List.of("x", "y"),
                new AttributeValue().withL(new AttributeValue().withS("x"), new AttributeValue().withS("y"))),
            Arguments.of(Types.mapOf(Types.integer()), ImmutableMap.of("k", 1L),
                new AttributeValue().withM(ImmutableMap.of("k", new AttributeValue().withN("1"))))
        );
    }

    @ParameterizedTest(name = "{index}: {0}")
    @MethodSource("values")
    void dumpAndLoad(Type<?> type, Object value, AttributeValue wire) {
        assertEquals(wire, sut.dump(type, value));
        assertEquals(value, sut.load(type, wire));
    }

    @Test
    void numbersDumpWithoutTrailingZeros() {
        assertEquals(new AttributeValue().withN("1.5"), sut.dump(Types.number(), new BigDecimal("1.50")));
        assertEquals(new AttributeValue().withN("100"), sut.dump(Types.number(), new BigDecimal("1.00E+2")));
    }

    @Test
    void binary() {
        byte[] bytes = {1, 2, 3};
        AttributeValue dumped = sut.dump(Types.binary(), bytes);
        assertArrayEquals(bytes, (byte[]) sut.load(Types.binary(), dumped));
    }

    @Test
    void nullDumpsToNothing() {
        assertNull(sut.dump(Types.string(), null));
        assertNull(sut.dump(Types.integer(), null));
    }

    @Test
    void emptyCollectionsDumpToNothing() {
        assertNull(sut.dump(Types.setOf(Types.string()), Set.of()));
        assertNull(sut.dump(Types.listOf(Types.string()), List.of()));
        assertNull(sut.dump(Types.mapOf(Types.string()), Map.of()));
        assertNull(sut.dump(Types.listOf(Types.string()), Arrays.asList(null, null)));
    }

    @Test
    void missingValuesLoadAsEmpty() {
        assertNull(sut.load(Types.string(), null));
        assertNull(sut.load(Types.integer(), new AttributeValue().withNULL(true)));
        assertEquals(Set.of(), sut.load(Types.setOf(Types.string()), null));
        assertEquals(List.of(), sut.load(Types.listOf(Types.integer()), null));
        assertEquals(Map.of(), sut.load(Types.mapOf(Types.integer()), null));
    }

    @Test
    void documentMap() {
        MapType type = Types.document()
            .with("name", Types.string())
            .with("age", Types.integer())
            .build();
        AttributeValue dumped = sut.dump(type, ImmutableMap.of("name", "bob", "age", 3L));
        assertEquals(new AttributeValue().withM(ImmutableMap.of(
            "name", new AttributeValue().withS("bob"),
            "age", new AttributeValue().withN("3"))), dumped);
        assertEquals(ImmutableMap.of("name", "bob", "age", 3L), sut.load(type, dumped));
        assertEquals(Types.integer().getClass(), type.typeAt("age").getClass());
        assertThrows(InvalidModelException.class, () -> type.typeAt("missing"));
    }

    @Test
    void wrongJavaTypeIsRejected() {
        assertThrows(InvalidModelException.class, () -> sut.dump(Types.integer(), "not a number"));
    }

    @Test
    void setsOnlySupportScalarElements() {
        assertThrows(InvalidModelException.class, () -> Types.setOf(Types.bool()));
    }

    @Test
    void backingTypes() {
        assertEquals("S", Types.string().getBackingType());
        assertEquals("N", Types.integer().getBackingType());
        assertEquals("SS", Types.setOf(Types.string()).getBackingType());
        assertEquals("NS", Types.setOf(Types.number()).getBackingType());
        assertEquals("L", Types.listOf(Types.string()).getBackingType());
        assertEquals("M", Types.mapOf(Types.string()).getBackingType());
    }

}
