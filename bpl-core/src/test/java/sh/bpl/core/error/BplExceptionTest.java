// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.bpl.core.builder.TxBuilderException;

class BplExceptionTest {

    @Test
    void encodingFailuresShareOneBase() {
        List<BplException> failures = List.of(
                new MalformedHexException("hex"),
                new MalformedKeyException("key"),
                new InvalidAddressException("address"),
                new MissingFeeException("fee"),
                new MissingSignatureException("signature"),
                new UnrecognizedTypeException("type"));
        for (BplException failure : failures) {
            assertInstanceOf(EncodingException.class, failure);
            assertInstanceOf(RuntimeException.class, failure);
        }
    }

    @Test
    void builderFailuresAreTxnExceptions() {
        BplException e = new TxBuilderException("missing sender");
        assertInstanceOf(TxnException.class, e);
        assertEquals("missing sender", e.getMessage());
    }

    @Test
    void preservesCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        VerificationException e = new VerificationException("cannot verify", cause);
        assertSame(cause, e.getCause());
    }
}
