/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.codec;

import ai.asserts.prw.DecompressionException;
import ai.asserts.prw.DeserializationException;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xerial.snappy.Snappy;
import prometheus.Remote.WriteRequest;

import java.io.IOException;

/**
 * Turns a remote-write request body into a {@link WriteRequest}. The body is a snappy block (not the framed
 * stream format) wrapping the protobuf encoded request. Values are not validated here.
 */
@Component
@Slf4j
public class WriteRequestDecoder {
    public WriteRequest decode(byte[] body) throws DecompressionException, DeserializationException {
        return parse(decompress(body));
    }

    @VisibleForTesting
    byte[] decompress(byte[] compressed) throws DecompressionException {
        if (compressed.length == 0) {
            throw new DecompressionException("Empty request body");
        }
        try {
            if (!Snappy.isValidCompressedBuffer(compressed)) {
                throw new DecompressionException("Request body is not valid snappy block data");
            }
            return Snappy.uncompress(compressed);
        } catch (IOException e) {
            throw new DecompressionException("Failed to decompress request body: " + e.getMessage(), e);
        }
    }

    @VisibleForTesting
    WriteRequest parse(byte[] payload) throws DeserializationException {
        try {
            return WriteRequest.parseFrom(payload);
        } catch (InvalidProtocolBufferException e) {
            throw new DeserializationException("Failed to parse WriteRequest: " + e.getMessage(), e);
        }
    }
}
