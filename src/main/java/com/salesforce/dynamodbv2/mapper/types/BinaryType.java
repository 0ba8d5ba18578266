package com.salesforce.dynamodbv2.mapper.types;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import java.nio.ByteBuffer;
import javax.annotation.Nonnull;

/**
 * Raw bytes, stored as {@code B}. The SDK base64-encodes the buffer on the wire.
 */
public class BinaryType implements Type<byte[]> {

    @Override
    public String getBackingType() {
        return "B";
    }

    @Override
    public AttributeValue dump(@Nonnull byte[] value) {
        return new AttributeValue().withB(ByteBuffer.wrap(value.clone()));
    }

    @Override
    public byte[] load(@Nonnull AttributeValue value) {
        return toBytes(value.getB());
    }

    static byte[] toBytes(ByteBuffer buffer) {
        ByteBuffer copy = buffer.duplicate();
        copy.rewind();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return bytes;
    }

    @Override
    public String toString() {
        return "Binary";
    }

}
