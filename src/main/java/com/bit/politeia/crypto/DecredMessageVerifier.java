package com.bit.politeia.crypto;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.encoders.DecoderException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Decred 签名消息验证：从紧凑签名恢复公钥，推导地址后与期望地址比较。
 * 无状态，可并发调用。
 */
@Slf4j
@Component
public class DecredMessageVerifier {

    public static final String MESSAGE_MAGIC = "Decred Signed Message:\n";

    public static final int COMPACT_SIGNATURE_LENGTH = 65;

    private static final int COMPACT_HEADER_BASE = 27;
    private static final int COMPACT_HEADER_COMPRESSED = 4;

    /**
     * @param address   期望的签名者地址（必须为P2PKH）
     * @param message   原始消息
     * @param signature Base64 编码的65字节紧凑签名
     * @return 地址匹配返回 true；公钥恢复失败视同不匹配，返回 false
     * @throws PoliteiaException INVALID_ADDRESS / INVALID_SIGNATURE 输入本身格式错误
     */
    public boolean verifyMessage(String address, String message, String signature) {
        DecredAddress expected = DecredAddress.decode(address);

        byte[] sig;
        try {
            sig = Base64.decode(signature);
        } catch (DecoderException e) {
            throw new PoliteiaException(ErrorType.INVALID_SIGNATURE, "Base64 编码错误", e);
        }

        ECKey recovered = recoverCompact(sig, messageHash(message));
        if (recovered == null) {
            // 与 dcrd 一致：恢复失败不区分原因，一律按签名不匹配处理
            return false;
        }
        DecredAddress derived = DecredAddress.fromPubKey(recovered.getPubKey(), expected.getNet());
        return derived.encode().equals(address);
    }

    /**
     * BLAKE256(varstr(magic) || varstr(message))
     */
    public static byte[] messageHash(String message) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        writeVarString(buf, MESSAGE_MAGIC);
        writeVarString(buf, message);
        return Blake256Digest.hash(buf.toByteArray());
    }

    /**
     * 紧凑签名恢复公钥，返回的密钥压缩标志与签名头一致；失败返回 null
     */
    static ECKey recoverCompact(byte[] sig, byte[] hash) {
        if (sig.length != COMPACT_SIGNATURE_LENGTH) {
            return null;
        }
        int header = (sig[0] & 0xff) - COMPACT_HEADER_BASE;
        if (header < 0 || header > 7) {
            return null;
        }
        int recId = header & 3;
        boolean compressed = (header & COMPACT_HEADER_COMPRESSED) != 0;
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(sig, 1, 33));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, 33, 65));
        if (r.signum() == 0 || s.signum() == 0) {
            return null;
        }
        try {
            return ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s), Sha256Hash.wrap(hash), compressed);
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.debug("紧凑签名公钥恢复失败: {}", e.getMessage());
            return null;
        }
    }

    private static void writeVarString(ByteArrayOutputStream out, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVarInt(out, bytes.length);
        out.write(bytes, 0, bytes.length);
    }

    // 比特币风格变长整数，小端
    private static void writeVarInt(ByteArrayOutputStream out, long value) {
        if (value < 0xfd) {
            out.write((int) value);
        } else if (value <= 0xffffL) {
            out.write(0xfd);
            writeLittleEndian(out, value, 2);
        } else if (value <= 0xffffffffL) {
            out.write(0xfe);
            writeLittleEndian(out, value, 4);
        } else {
            out.write(0xff);
            writeLittleEndian(out, value, 8);
        }
    }

    private static void writeLittleEndian(ByteArrayOutputStream out, long value, int size) {
        for (int i = 0; i < size; i++) {
            out.write((int) (value >>> (8 * i)) & 0xff);
        }
    }
}
