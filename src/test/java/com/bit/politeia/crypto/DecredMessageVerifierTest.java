package com.bit.politeia.crypto;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import org.bitcoinj.core.ECKey;
import org.bouncycastle.util.encoders.Base64;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DecredMessageVerifierTest {

    private final DecredMessageVerifier verifier = new DecredMessageVerifier();

    @Test
    void verifiesCompressedKeySignature() {
        ECKey key = new ECKey();
        String address = CompactSigner.address(key, DecredNet.TESTNET3);
        String message = "abc123" + "T1" + "1";
        assertTrue(verifier.verifyMessage(address, message, CompactSigner.signBase64(key, message)));
    }

    @Test
    void verifiesUncompressedKeySignature() {
        ECKey key = new ECKey().decompress();
        String address = CompactSigner.address(key, DecredNet.MAINNET);
        assertTrue(verifier.verifyMessage(address, "hello", CompactSigner.signBase64(key, "hello")));
    }

    @Test
    void tamperedMessageDoesNotVerify() {
        ECKey key = new ECKey();
        String address = CompactSigner.address(key, DecredNet.TESTNET3);
        String sig = CompactSigner.signBase64(key, "abc123T11");
        assertFalse(verifier.verifyMessage(address, "abc123T12", sig));
    }

    @Test
    void otherSignerDoesNotVerify() {
        String address = CompactSigner.address(new ECKey(), DecredNet.TESTNET3);
        String sig = CompactSigner.signBase64(new ECKey(), "abc123T11");
        assertFalse(verifier.verifyMessage(address, "abc123T11", sig));
    }

    @Test
    void compressionFlagIsPartOfIdentity() {
        ECKey key = new ECKey();
        byte[] sig = CompactSigner.sign(key, "msg");
        // 翻转压缩标志后恢复出的公钥序列化不同，地址不匹配
        sig[0] = (byte) (sig[0] - 4);
        String address = CompactSigner.address(key, DecredNet.TESTNET3);
        assertFalse(verifier.verifyMessage(address, "msg", Base64.toBase64String(sig)));
    }

    @Test
    void unrecoverableSignatureIsMismatch() {
        String address = CompactSigner.address(new ECKey(), DecredNet.TESTNET3);
        byte[] shortSig = new byte[64];
        assertFalse(verifier.verifyMessage(address, "msg", Base64.toBase64String(shortSig)));
        byte[] zeroRs = new byte[65];
        zeroRs[0] = 31;
        assertFalse(verifier.verifyMessage(address, "msg", Base64.toBase64String(zeroRs)));
        byte[] badHeader = new byte[65];
        badHeader[0] = 99;
        badHeader[1] = 1;
        badHeader[33] = 1;
        assertFalse(verifier.verifyMessage(address, "msg", Base64.toBase64String(badHeader)));
    }

    @Test
    void malformedInputsAreErrors() {
        ECKey key = new ECKey();
        String address = CompactSigner.address(key, DecredNet.TESTNET3);
        PoliteiaException badSig = assertThrows(PoliteiaException.class,
                () -> verifier.verifyMessage(address, "msg", "!!!not base64!!!"));
        assertEquals(ErrorType.INVALID_SIGNATURE, badSig.getErrorType());

        PoliteiaException badAddr = assertThrows(PoliteiaException.class,
                () -> verifier.verifyMessage("Tsbogus", "msg", CompactSigner.signBase64(key, "msg")));
        assertEquals(ErrorType.INVALID_ADDRESS, badAddr.getErrorType());
    }

    @Test
    void messageHashFramingMatchesDcrdWire() {
        // 0x17 = len("Decred Signed Message:\n")
        byte[] magic = {0x17, 'D', 'e', 'c', 'r', 'e', 'd', ' ', 'S', 'i', 'g', 'n', 'e', 'd', ' ',
                'M', 'e', 's', 's', 'a', 'g', 'e', ':', '\n'};
        ByteArrayOutputStream preimage = new ByteArrayOutputStream();
        preimage.write(magic, 0, magic.length);
        preimage.write(9);
        byte[] msg = "abc123T11".getBytes(StandardCharsets.US_ASCII);
        preimage.write(msg, 0, msg.length);
        assertArrayEquals(Blake256Digest.hash(preimage.toByteArray()), DecredMessageVerifier.messageHash("abc123T11"));
    }

    @Test
    void longMessageUsesThreeByteVarint() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            sb.append('a');
        }
        ByteArrayOutputStream preimage = new ByteArrayOutputStream();
        byte[] magic = DecredMessageVerifier.MESSAGE_MAGIC.getBytes(StandardCharsets.US_ASCII);
        preimage.write(magic.length);
        preimage.write(magic, 0, magic.length);
        // 300 = 0x012c，小端
        preimage.write(0xfd);
        preimage.write(0x2c);
        preimage.write(0x01);
        byte[] msg = sb.toString().getBytes(StandardCharsets.US_ASCII);
        preimage.write(msg, 0, msg.length);
        assertArrayEquals(Blake256Digest.hash(preimage.toByteArray()), DecredMessageVerifier.messageHash(sb.toString()));
    }
}
