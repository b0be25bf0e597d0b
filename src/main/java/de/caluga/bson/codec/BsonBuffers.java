package de.caluga.bson.codec;

import de.caluga.bson.BsonTypeException;
import io.netty.buffer.ByteBuf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * turns the byte holders callers hand in into the {@link ByteBuffer} the
 * codec works on: little endian, starting at index 0, limited to the bytes
 * handed in. The underlying memory is shared, not copied, wherever possible.
 **/
public final class BsonBuffers {
    private static final Logger log = LoggerFactory.getLogger(BsonBuffers.class);

    private BsonBuffers() {
    }

    /**
     * accepts {@code byte[]}, {@link ByteBuffer} (its remaining bytes) and
     * netty {@link ByteBuf} (its readable bytes).
     *
     * @throws BsonTypeException for anything else
     */
    public static ByteBuffer ensureBuffer(Object potentialBuffer) {
        if (potentialBuffer instanceof byte[]) {
            return ByteBuffer.wrap((byte[]) potentialBuffer).order(ByteOrder.LITTLE_ENDIAN);
        }

        if (potentialBuffer instanceof ByteBuffer) {
            return ((ByteBuffer) potentialBuffer).slice().order(ByteOrder.LITTLE_ENDIAN);
        }

        if (potentialBuffer instanceof ByteBuf) {
            return fromByteBuf((ByteBuf) potentialBuffer);
        }

        Class<?> cls = potentialBuffer == null ? null : potentialBuffer.getClass();
        throw new BsonTypeException("Must use either byte[], ByteBuffer or ByteBuf - got " + (cls == null ? "null" : cls.getName()), cls);
    }

    /**
     * a window of a byte array
     */
    public static ByteBuffer ensureBuffer(byte[] data, int offset, int length) {
        if (data == null) {
            throw new BsonTypeException("Must use either byte[], ByteBuffer or ByteBuf - got null", null);
        }

        return ByteBuffer.wrap(data, offset, length).slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    private static ByteBuffer fromByteBuf(ByteBuf buf) {
        int len = buf.readableBytes();

        if (buf.nioBufferCount() == 1) {
            return buf.nioBuffer(buf.readerIndex(), len).slice().order(ByteOrder.LITTLE_ENDIAN);
        }

        //composite buffers spread over several nio buffers have to be copied
        log.debug("ByteBuf consists of {} nio buffers - copying {} bytes", buf.nioBufferCount(), len);
        byte[] copy = new byte[len];
        buf.getBytes(buf.readerIndex(), copy);
        return ByteBuffer.wrap(copy).order(ByteOrder.LITTLE_ENDIAN);
    }
}
